package automata.email.app.service;

import automata.email.app.mailbox.MessageHandle;
import automata.email.app.mailbox.ThreadHandle;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePartHeader;
import com.google.api.services.gmail.model.Thread;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fetches the ids and subjects the engine needs for threads and messages
 * that a batch request names only by id.
 */
@Slf4j
@Service
public class MailEntityLoader {
    private static final String METADATA_FORMAT = "metadata";
    private static final List<String> SUBJECT_HEADER = List.of("Subject");

    public ThreadHandle loadThread(Gmail gmail, String userId, String threadId) throws Exception {
        Thread thread = fetchThread(gmail, userId, threadId);
        List<Message> messages = messagesOf(thread);
        List<String> messageIds = new ArrayList<>(messages.size());
        for (Message message : messages) {
            messageIds.add(message.getId());
        }
        String subject = messages.isEmpty() ? null : subjectOf(messages.get(0));
        return new ThreadHandle(threadId, subject, messageIds);
    }

    public MessageHandle loadMessage(Gmail gmail, String userId, String messageId) throws Exception {
        Message message = gmail.users().messages().get(userId, messageId)
            .setFormat(METADATA_FORMAT)
            .setMetadataHeaders(SUBJECT_HEADER)
            .execute();
        return new MessageHandle(message.getId(), message.getThreadId(), subjectOf(message));
    }

    /**
     * Expands a thread into message handles, skipping messages received before
     * {@code oldestToProcess}. The latest message is always kept.
     */
    public List<MessageHandle> loadRecentMessages(Gmail gmail, String userId, String threadId, Instant oldestToProcess)
            throws Exception {
        List<Message> messages = messagesOf(fetchThread(gmail, userId, threadId));
        List<Message> recent = selectRecent(messages, oldestToProcess);
        if (recent.isEmpty()) {
            return Collections.emptyList();
        }

        int dropped = messages.size() - recent.size();
        if (dropped > 0) {
            log.warn("Ignoring oldest {} messages in thread \"{}\"", dropped, subjectOf(recent.get(0)));
        }
        List<MessageHandle> handles = new ArrayList<>(recent.size());
        for (Message message : recent) {
            handles.add(new MessageHandle(message.getId(), threadId, subjectOf(message)));
        }
        return handles;
    }

    static List<Message> selectRecent(List<Message> messages, Instant oldestToProcess) {
        if (messages.isEmpty()) {
            return Collections.emptyList();
        }
        long cutoff = oldestToProcess.toEpochMilli();
        List<Message> recent = new ArrayList<>();
        for (Message message : messages) {
            if (message.getInternalDate() != null && message.getInternalDate() > cutoff) {
                recent.add(message);
            }
        }
        if (recent.isEmpty()) {
            recent.add(messages.get(messages.size() - 1));
        }
        return recent;
    }

    static String subjectOf(Message message) {
        if (message.getPayload() == null || message.getPayload().getHeaders() == null) {
            return null;
        }
        for (MessagePartHeader header : message.getPayload().getHeaders()) {
            if ("subject".equalsIgnoreCase(header.getName())) {
                return header.getValue();
            }
        }
        return null;
    }

    private Thread fetchThread(Gmail gmail, String userId, String threadId) throws Exception {
        return gmail.users().threads().get(userId, threadId)
            .setFormat(METADATA_FORMAT)
            .setMetadataHeaders(SUBJECT_HEADER)
            .execute();
    }

    private List<Message> messagesOf(Thread thread) {
        return thread.getMessages() != null ? thread.getMessages() : Collections.emptyList();
    }
}
