package automata.email.app.action;

/**
 * Where an entity should end up after the batch.
 * TO_* variants move whole threads; RECORD_* variants move only the messages
 * the entity covers.
 */
public enum MoveAction {
    UNSET,
    TO_INBOX,
    TO_ARCHIVE,
    TO_TRASH,
    RECORD_TO_INBOX,
    RECORD_TO_ARCHIVE,
    RECORD_TO_TRASH;

    public boolean isRecordLevel() {
        return this == RECORD_TO_INBOX || this == RECORD_TO_ARCHIVE || this == RECORD_TO_TRASH;
    }
}
