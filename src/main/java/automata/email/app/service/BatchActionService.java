package automata.email.app.service;

import automata.email.app.action.EntityAction;
import automata.email.app.config.MailActionProperties;
import automata.email.app.dto.BatchActionRequest;
import automata.email.app.dto.EntityActionRequest;
import automata.email.app.engine.BatchActionEngine;
import automata.email.app.engine.BatchApplyResult;
import automata.email.app.engine.EntityDataset;
import automata.email.app.engine.EntityKind;
import automata.email.app.engine.MalformedActionException;
import automata.email.app.engine.SessionContext;
import automata.email.app.mailbox.GmailLabelResolver;
import automata.email.app.mailbox.GmailMailboxService;
import automata.email.app.mailbox.MessageHandle;
import automata.email.app.mailbox.ThreadHandle;
import com.google.api.services.gmail.Gmail;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Turns a batch request into an entity dataset for one Gmail mailbox and runs
 * it through the engine of the matching granularity.
 */
@Slf4j
@Service
public class BatchActionService {
    private final GmailClientFactory gmailClientFactory;
    private final MailEntityLoader mailEntityLoader;
    private final MailActionProperties properties;
    private final BatchActionEngine<ThreadHandle> threadActionEngine;
    private final BatchActionEngine<MessageHandle> messageActionEngine;

    public BatchActionService(
            GmailClientFactory gmailClientFactory,
            MailEntityLoader mailEntityLoader,
            MailActionProperties properties,
            BatchActionEngine<ThreadHandle> threadActionEngine,
            BatchActionEngine<MessageHandle> messageActionEngine) {
        this.gmailClientFactory = gmailClientFactory;
        this.mailEntityLoader = mailEntityLoader;
        this.properties = properties;
        this.threadActionEngine = threadActionEngine;
        this.messageActionEngine = messageActionEngine;
    }

    public BatchApplyResult applyThreadActions(String accessToken, BatchActionRequest request) throws Exception {
        List<EntityActionRequest> entries = entriesOf(request);
        Gmail gmail = gmailClientFactory.forAccessToken(accessToken);
        String userId = properties.getUserId();
        EntityDataset<ThreadHandle> dataset = new EntityDataset<>(EntityKind.THREAD, newSession(gmail, request));

        for (EntityActionRequest entry : entries) {
            if (isBlank(entry.getId())) {
                throw new MalformedActionException("Thread entry without an id");
            }
            ThreadHandle thread = entry.getMessageIds() != null && !entry.getMessageIds().isEmpty()
                ? new ThreadHandle(entry.getId(), entry.getSubject(), entry.getMessageIds())
                : mailEntityLoader.loadThread(gmail, userId, entry.getId());
            dataset.add(thread, toAction(entry));
        }

        log.info("Applying thread batch of {} entries for {}", dataset.size(), userId);
        return threadActionEngine.apply(dataset, new GmailMailboxService<>(gmail, userId));
    }

    public BatchApplyResult applyMessageActions(String accessToken, BatchActionRequest request) throws Exception {
        List<EntityActionRequest> entries = entriesOf(request);
        Gmail gmail = gmailClientFactory.forAccessToken(accessToken);
        String userId = properties.getUserId();
        SessionContext session = newSession(gmail, request);
        EntityDataset<MessageHandle> dataset = new EntityDataset<>(EntityKind.MESSAGE, session);

        for (EntityActionRequest entry : entries) {
            if (!isBlank(entry.getId())) {
                MessageHandle message = !isBlank(entry.getThreadId())
                    ? new MessageHandle(entry.getId(), entry.getThreadId(), entry.getSubject())
                    : mailEntityLoader.loadMessage(gmail, userId, entry.getId());
                dataset.add(message, toAction(entry));
            } else if (!isBlank(entry.getThreadId())) {
                for (MessageHandle message : mailEntityLoader.loadRecentMessages(
                        gmail, userId, entry.getThreadId(), session.getOldestToProcess())) {
                    dataset.add(message, toAction(entry));
                }
            } else {
                throw new MalformedActionException("Message entry needs an id or a threadId");
            }
        }

        log.info("Applying message batch of {} entries for {}", dataset.size(), userId);
        return messageActionEngine.apply(dataset, new GmailMailboxService<>(gmail, userId));
    }

    private static List<EntityActionRequest> entriesOf(BatchActionRequest request) {
        if (request == null || request.getEntries() == null) {
            throw new MalformedActionException("Batch request without entries");
        }
        List<EntityActionRequest> entries = request.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) == null) {
                throw new MalformedActionException("Batch entry " + i + " is null");
            }
        }
        return entries;
    }

    private SessionContext newSession(Gmail gmail, BatchActionRequest request) {
        String processedLabel = request.getProcessedLabel() != null
            ? request.getProcessedLabel() : properties.getProcessedLabel();
        String unprocessedLabel = request.getUnprocessedLabel() != null
            ? request.getUnprocessedLabel() : properties.getUnprocessedLabel();
        try {
            return SessionContext.builder()
                .processedLabel(processedLabel)
                .unprocessedLabel(unprocessedLabel)
                .oldestToProcess(Instant.now().minus(properties.getMaxMessageAge()))
                .labelResolver(new GmailLabelResolver(gmail, properties.getUserId()))
                .build();
        } catch (IllegalArgumentException e) {
            throw new MalformedActionException(e.getMessage());
        }
    }

    static EntityAction toAction(EntityActionRequest entry) {
        EntityAction action = new EntityAction();
        if (entry.getLabelsToAdd() != null) {
            entry.getLabelsToAdd().forEach(action::addLabel);
        }
        if (entry.getLabelsToRemove() != null) {
            entry.getLabelsToRemove().forEach(action::removeLabel);
        }
        if (entry.getCategories() != null) {
            entry.getCategories().stream()
                .filter(Objects::nonNull)
                .forEach(action::assignCategory);
        }
        return action.moveTo(entry.getMove())
            .markImportance(entry.getImportance())
            .markRead(entry.getRead());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
