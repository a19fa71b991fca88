package automata.email.app.mailbox;

import automata.email.app.action.MailCategory;

import java.util.List;

/**
 * Mutations the engine issues against a mailbox.
 * Bulk operations accept one or more entities; the single-record operations
 * exist because the mailbox has no bulk primitive for them.
 *
 * @param <H> the entity handle type
 */
public interface MailboxService<H extends MailEntity> {

    void addLabel(LabelHandle label, List<H> entities) throws Exception;

    void removeLabel(LabelHandle label, List<H> entities) throws Exception;

    /**
     * Replace the categories of one entity.
     * @param entity the entity to update
     * @param add categories to assign
     * @param remove categories to clear
     * @throws Exception if the Gmail API call fails
     */
    void reassignCategories(H entity, List<MailCategory> add, List<MailCategory> remove) throws Exception;

    void moveToInbox(List<H> entities) throws Exception;

    void moveToArchive(List<H> entities) throws Exception;

    void moveToTrash(List<H> entities) throws Exception;

    void moveRecordToInbox(H entity) throws Exception;

    void moveRecordToArchive(H entity) throws Exception;

    void moveRecordToTrash(H entity) throws Exception;

    void markImportant(List<H> entities) throws Exception;

    void markUnimportant(List<H> entities) throws Exception;

    void markThreadsRead(List<H> entities) throws Exception;

    void markThreadsUnread(List<H> entities) throws Exception;

    void markRecordsRead(List<H> entities) throws Exception;

    void markRecordsUnread(List<H> entities) throws Exception;
}
