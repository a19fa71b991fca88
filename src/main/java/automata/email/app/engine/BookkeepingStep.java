package automata.email.app.engine;

import automata.email.app.mailbox.LabelHandle;
import automata.email.app.mailbox.MailEntity;
import automata.email.app.mailbox.MailboxService;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Final pass over a batch: tags every entity with the processed label, when
 * one is configured, and clears the unprocessed label if the mailbox has it.
 */
@Slf4j
public class BookkeepingStep {

    /**
     * @return number of mailbox calls issued
     */
    public <H extends MailEntity> int apply(EntityDataset<H> dataset, MailboxService<H> mailbox) {
        if (dataset.isEmpty()) {
            return 0;
        }
        SessionContext session = dataset.getSession();
        List<H> entities = dataset.getEntities();
        int calls = 0;

        if (session.hasProcessedLabel()) {
            String processed = session.getProcessedLabel();
            MailboxCalls.invoke(DispatchStep.BOOKKEEPING, processed, entities.size(),
                () -> mailbox.addLabel(session.getOrCreateLabel(processed), entities));
            calls++;
        }
        String unprocessed = session.getUnprocessedLabel();
        Optional<LabelHandle> unprocessedLabel = MailboxCalls.fetch(DispatchStep.BOOKKEEPING, unprocessed,
            entities.size(), () -> session.findLabel(unprocessed));
        if (unprocessedLabel.isPresent()) {
            MailboxCalls.invoke(DispatchStep.BOOKKEEPING, unprocessed, entities.size(),
                () -> mailbox.removeLabel(unprocessedLabel.get(), entities));
            calls++;
        }

        log.info("Mark {} {}s as processed.", entities.size(), dataset.getKind().getDisplayName());
        return calls;
    }
}
