package automata.email.app.mailbox;

import automata.email.app.action.MailCategory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.BatchModifyMessagesRequest;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import com.google.api.services.gmail.model.ModifyThreadRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link MailboxService} backed by the Gmail REST API for one mailbox.
 * Label, importance and record-level read changes go through
 * messages.batchModify; thread-level moves and read changes go through the
 * threads endpoints once per distinct thread. Moving to the inbox untrashes first.
 */
@Slf4j
public class GmailMailboxService<H extends MailEntity> implements MailboxService<H> {
    static final String INBOX = "INBOX";
    static final String UNREAD = "UNREAD";
    static final String IMPORTANT = "IMPORTANT";

    // messages.batchModify accepts at most 1000 ids per request
    static final int MAX_BATCH_MODIFY_IDS = 1000;

    private final Gmail gmail;
    private final String userId;

    public GmailMailboxService(Gmail gmail, String userId) {
        this.gmail = gmail;
        this.userId = userId;
    }

    @Override
    public void addLabel(LabelHandle label, List<H> entities) throws Exception {
        batchModify(entities, List.of(label.getId()), Collections.emptyList());
    }

    @Override
    public void removeLabel(LabelHandle label, List<H> entities) throws Exception {
        batchModify(entities, Collections.emptyList(), List.of(label.getId()));
    }

    @Override
    public void reassignCategories(H entity, List<MailCategory> add, List<MailCategory> remove) throws Exception {
        batchModify(List.of(entity), MailCategory.labelIdsOf(add), MailCategory.labelIdsOf(remove));
    }

    @Override
    public void moveToInbox(List<H> entities) throws Exception {
        for (String threadId : distinctThreadIds(entities)) {
            gmail.users().threads().untrash(userId, threadId).execute();
        }
        modifyThreads(entities, List.of(INBOX), Collections.emptyList());
    }

    @Override
    public void moveToArchive(List<H> entities) throws Exception {
        modifyThreads(entities, Collections.emptyList(), List.of(INBOX));
    }

    @Override
    public void moveToTrash(List<H> entities) throws Exception {
        for (String threadId : distinctThreadIds(entities)) {
            gmail.users().threads().trash(userId, threadId).execute();
        }
    }

    @Override
    public void moveRecordToInbox(H entity) throws Exception {
        for (String messageId : entity.getMessageIds()) {
            gmail.users().messages().untrash(userId, messageId).execute();
        }
        modifyMessages(entity, List.of(INBOX), Collections.emptyList());
    }

    @Override
    public void moveRecordToArchive(H entity) throws Exception {
        modifyMessages(entity, Collections.emptyList(), List.of(INBOX));
    }

    @Override
    public void moveRecordToTrash(H entity) throws Exception {
        for (String messageId : entity.getMessageIds()) {
            gmail.users().messages().trash(userId, messageId).execute();
        }
    }

    @Override
    public void markImportant(List<H> entities) throws Exception {
        batchModify(entities, List.of(IMPORTANT), Collections.emptyList());
    }

    @Override
    public void markUnimportant(List<H> entities) throws Exception {
        batchModify(entities, Collections.emptyList(), List.of(IMPORTANT));
    }

    @Override
    public void markThreadsRead(List<H> entities) throws Exception {
        modifyThreads(entities, Collections.emptyList(), List.of(UNREAD));
    }

    @Override
    public void markThreadsUnread(List<H> entities) throws Exception {
        modifyThreads(entities, List.of(UNREAD), Collections.emptyList());
    }

    @Override
    public void markRecordsRead(List<H> entities) throws Exception {
        batchModify(entities, Collections.emptyList(), List.of(UNREAD));
    }

    @Override
    public void markRecordsUnread(List<H> entities) throws Exception {
        batchModify(entities, List.of(UNREAD), Collections.emptyList());
    }

    private void batchModify(List<H> entities, List<String> addLabelIds, List<String> removeLabelIds) throws Exception {
        List<String> messageIds = new ArrayList<>();
        for (H entity : entities) {
            messageIds.addAll(entity.getMessageIds());
        }
        for (int i = 0; i < messageIds.size(); i += MAX_BATCH_MODIFY_IDS) {
            List<String> chunk = messageIds.subList(i, Math.min(i + MAX_BATCH_MODIFY_IDS, messageIds.size()));
            BatchModifyMessagesRequest request = new BatchModifyMessagesRequest()
                .setIds(new ArrayList<>(chunk))
                .setAddLabelIds(addLabelIds)
                .setRemoveLabelIds(removeLabelIds);
            gmail.users().messages().batchModify(userId, request).execute();
            log.debug("batchModify on {} messages: +{} -{}", chunk.size(), addLabelIds, removeLabelIds);
        }
    }

    private void modifyThreads(List<H> entities, List<String> addLabelIds, List<String> removeLabelIds) throws Exception {
        for (String threadId : distinctThreadIds(entities)) {
            ModifyThreadRequest request = new ModifyThreadRequest()
                .setAddLabelIds(addLabelIds)
                .setRemoveLabelIds(removeLabelIds);
            gmail.users().threads().modify(userId, threadId, request).execute();
        }
    }

    private void modifyMessages(H entity, List<String> addLabelIds, List<String> removeLabelIds) throws Exception {
        for (String messageId : entity.getMessageIds()) {
            ModifyMessageRequest request = new ModifyMessageRequest()
                .setAddLabelIds(addLabelIds)
                .setRemoveLabelIds(removeLabelIds);
            gmail.users().messages().modify(userId, messageId, request).execute();
        }
    }

    private Set<String> distinctThreadIds(List<H> entities) {
        Set<String> threadIds = new LinkedHashSet<>();
        for (H entity : entities) {
            threadIds.add(entity.getThreadId());
        }
        return threadIds;
    }
}
