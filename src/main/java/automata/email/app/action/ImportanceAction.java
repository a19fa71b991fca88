package automata.email.app.action;

public enum ImportanceAction {
    UNSET,
    MARK_IMPORTANT,
    MARK_UNIMPORTANT
}
