package automata.email.app.action;

/**
 * Read state change. THREAD_* variants apply to every message of the parent
 * thread, RECORD_* variants only to the messages the entity covers.
 */
public enum ReadAction {
    UNSET,
    THREAD_READ,
    THREAD_UNREAD,
    RECORD_READ,
    RECORD_UNREAD;

    public boolean isRecordLevel() {
        return this == RECORD_READ || this == RECORD_UNREAD;
    }
}
