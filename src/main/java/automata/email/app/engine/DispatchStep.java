package automata.email.app.engine;

/**
 * Steps of a batch, in the order they run.
 */
public enum DispatchStep {
    ADD_LABELS,
    REMOVE_LABELS,
    REASSIGN_CATEGORIES,
    MOVE,
    IMPORTANCE,
    READ_STATE,
    BOOKKEEPING
}
