package automata.email.app.dto;

import automata.email.app.action.ImportanceAction;
import automata.email.app.action.MailCategory;
import automata.email.app.action.MoveAction;
import automata.email.app.action.ReadAction;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One entity of a batch request and the mutations decided for it.
 * For a thread batch {@code id} is the thread id; {@code messageIds} may be
 * given to skip the lookup. For a message batch either {@code id} names a
 * message or only {@code threadId} is set, which expands to the thread's
 * recent messages.
 */
@Data
public class EntityActionRequest {
    private String id;
    private String threadId;
    private String subject;
    private List<String> messageIds;

    private List<String> labelsToAdd = new ArrayList<>();
    private List<String> labelsToRemove = new ArrayList<>();
    private List<MailCategory> categories = new ArrayList<>();
    private MoveAction move;
    private ImportanceAction importance;
    private ReadAction read;
}
