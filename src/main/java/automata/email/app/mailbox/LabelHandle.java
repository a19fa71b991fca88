package automata.email.app.mailbox;

import lombok.NonNull;
import lombok.Value;

/**
 * A resolved Gmail label: the user-facing name and the id the API expects.
 */
@Value
public class LabelHandle {
    @NonNull String id;
    @NonNull String name;
}
