package automata.email.app.engine;

/**
 * A batch carries an action the engine cannot apply: an invalid label name,
 * a value outside the entity kind's vocabulary, or an entity listed twice.
 * Raised before any mailbox call of the batch is made.
 */
public class MalformedActionException extends RuntimeException {
    public MalformedActionException(String message) {
        super(message);
    }
}
