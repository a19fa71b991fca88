package automata.email.app.mailbox;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
public class MessageHandle implements MailEntity {
    @NonNull String id;
    @NonNull String threadId;
    String subject;

    @Override
    public List<String> getMessageIds() {
        return List.of(id);
    }

    @Override
    public String toString() {
        return subject == null ? id : subject;
    }
}
