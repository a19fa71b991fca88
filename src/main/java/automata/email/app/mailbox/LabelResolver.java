package automata.email.app.mailbox;

import java.util.Optional;

/**
 * Looks up labels by name, creating them when the mailbox does not have them yet.
 */
public interface LabelResolver {

    /**
     * @param name label name as shown to the user
     * @return the existing or newly created label
     * @throws IllegalArgumentException if the mailbox rejects the name
     * @throws Exception if the Gmail API call fails
     */
    LabelHandle resolve(String name) throws Exception;

    /**
     * Lookup only; never creates a label.
     */
    Optional<LabelHandle> find(String name) throws Exception;
}
