package automata.email.app.mailbox;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
public class ThreadHandle implements MailEntity {
    @NonNull String id;
    String subject;
    @NonNull List<String> messageIds;

    @Override
    public String getThreadId() {
        return id;
    }

    @Override
    public String toString() {
        return subject == null ? id : subject;
    }
}
