package automata.email.app.engine;

import automata.email.app.mailbox.MailEntity;
import automata.email.app.mailbox.MailboxService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies the actions of a dataset to a mailbox with as few calls as possible:
 * aggregate per dimension, dispatch the groups, then run bookkeeping.
 * One instance serves one {@link EntityKind}; it keeps no state between
 * batches.
 */
@Slf4j
public class BatchActionEngine<H extends MailEntity> {
    @Getter
    private final EntityKind kind;
    private final ActionAggregator aggregator;
    private final ActionDispatcher dispatcher;
    private final BookkeepingStep bookkeepingStep;

    public BatchActionEngine(EntityKind kind) {
        this(kind, new ActionAggregator(), new ActionDispatcher(), new BookkeepingStep());
    }

    public BatchActionEngine(EntityKind kind, ActionAggregator aggregator, ActionDispatcher dispatcher,
                             BookkeepingStep bookkeepingStep) {
        this.kind = kind;
        this.aggregator = aggregator;
        this.dispatcher = dispatcher;
        this.bookkeepingStep = bookkeepingStep;
    }

    /**
     * @throws MalformedActionException if an action cannot be applied; nothing has been sent yet
     * @throws MailboxCallException if a mailbox call fails; earlier steps stay applied
     */
    public BatchApplyResult apply(EntityDataset<H> dataset, MailboxService<H> mailbox) {
        if (dataset.getKind() != kind) {
            throw new IllegalArgumentException(
                "A " + kind.getDisplayName() + " engine cannot apply a " + dataset.getKind().getDisplayName() + " dataset");
        }
        if (dataset.isEmpty()) {
            log.info("No {}s to process", kind.getDisplayName());
            return BatchApplyResult.empty(kind);
        }

        ActionGroups<H> groups = aggregator.aggregate(dataset);
        log.info("Applying actions to {} {}s", dataset.size(), kind.getDisplayName());
        int calls = dispatcher.dispatch(groups, dataset.getSession(), mailbox);
        calls += bookkeepingStep.apply(dataset, mailbox);

        BatchApplyResult result = BatchApplyResult.of(groups, calls);
        log.info("Batch of {} {}s applied with {} mailbox calls", result.getEntityCount(), kind.getDisplayName(),
            result.getMailboxCalls());
        return result;
    }
}
