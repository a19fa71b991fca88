package automata.email.app.engine;

import lombok.Getter;

/**
 * A mailbox call failed. Steps before {@link #getStep()} have been applied
 * and are not rolled back; later steps were not attempted.
 */
@Getter
public class MailboxCallException extends RuntimeException {
    private final DispatchStep step;
    private final String groupKey;
    private final int groupSize;

    public MailboxCallException(DispatchStep step, String groupKey, int groupSize, Throwable cause) {
        super("Mailbox call failed at " + step + " for group '" + groupKey + "' (" + groupSize + " entities): "
            + cause.getMessage(), cause);
        this.step = step;
        this.groupKey = groupKey;
        this.groupSize = groupSize;
    }
}
