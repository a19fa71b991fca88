package automata.email.app.mailbox;

import java.util.List;

/**
 * A thread or message the engine can mutate.
 */
public interface MailEntity {

    /** Gmail id of the thread or message. */
    String getId();

    /** Id of the thread this entity belongs to (its own id for a thread). */
    String getThreadId();

    /** Subject line, used for logging only. */
    String getSubject();

    /** Ids of the messages this entity covers. */
    List<String> getMessageIds();
}
