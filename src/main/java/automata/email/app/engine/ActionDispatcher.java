package automata.email.app.engine;

import automata.email.app.action.ImportanceAction;
import automata.email.app.action.MailCategory;
import automata.email.app.action.MoveAction;
import automata.email.app.action.ReadAction;
import automata.email.app.mailbox.LabelHandle;
import automata.email.app.mailbox.MailEntity;
import automata.email.app.mailbox.MailboxService;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Issues the grouped mailbox calls for a batch, one dimension after the other:
 * label additions, label removals, categories, moves, importance, read state.
 * Removals run after additions, so a label both added and removed ends up removed.
 * Removing a label the mailbox does not have is skipped rather than creating it.
 * The first failing call stops the batch.
 */
@Slf4j
public class ActionDispatcher {

    /**
     * @return number of mailbox calls issued
     */
    public <H extends MailEntity> int dispatch(ActionGroups<H> groups, SessionContext session, MailboxService<H> mailbox) {
        String noun = groups.getKind().getDisplayName();
        int calls = 0;

        Map<String, LabelHandle> addHandles = resolveLabelsToAdd(groups.getLabelsToAdd(), session);
        Map<String, LabelHandle> removeHandles = findLabelsToRemove(groups.getLabelsToRemove(), session);

        for (Map.Entry<String, List<H>> group : groups.getLabelsToAdd().entrySet()) {
            LabelHandle label = addHandles.get(group.getKey());
            List<H> entities = group.getValue();
            MailboxCalls.invoke(DispatchStep.ADD_LABELS, group.getKey(), entities.size(),
                () -> mailbox.addLabel(label, entities));
            calls++;
            log.info("add label {} to {} {}s", group.getKey(), entities.size(), noun);
        }
        for (Map.Entry<String, List<H>> group : groups.getLabelsToRemove().entrySet()) {
            LabelHandle label = removeHandles.get(group.getKey());
            List<H> entities = group.getValue();
            if (label == null) {
                log.debug("skip removing label {}: not in the mailbox", group.getKey());
                continue;
            }
            MailboxCalls.invoke(DispatchStep.REMOVE_LABELS, group.getKey(), entities.size(),
                () -> mailbox.removeLabel(label, entities));
            calls++;
            log.info("remove label {} from {} {}s", group.getKey(), entities.size(), noun);
        }
        if (!groups.getLabelsToAdd().isEmpty() || !groups.getLabelsToRemove().isEmpty()) {
            log.info("Updated labels: added {}, removed {}.",
                groups.getLabelsToAdd().keySet(), groups.getLabelsToRemove().keySet());
        }

        for (ActionEntry<H> entry : groups.getCategoryReassignments()) {
            H entity = entry.getEntity();
            List<MailCategory> add = MailCategory.orderedOf(entry.getAction().getCategories());
            List<MailCategory> remove = MailCategory.complementOf(entry.getAction().getCategories());
            MailboxCalls.invoke(DispatchStep.REASSIGN_CATEGORIES, entity.getId(), 1,
                () -> mailbox.reassignCategories(entity, add, remove));
            calls++;
            log.debug("set categories {} on {} '{}'", add, noun, entity.getSubject());
        }

        calls += dispatchMoves(groups.getMoveGroups(), mailbox, noun);
        calls += dispatchImportance(groups.getImportanceGroups(), mailbox, noun);
        calls += dispatchReadState(groups.getReadGroups(), mailbox, noun);
        log.info("Updated {}s status.", noun);
        return calls;
    }

    // Runs before the first label call.
    private <H extends MailEntity> Map<String, LabelHandle> resolveLabelsToAdd(Map<String, List<H>> labelGroups,
                                                                            SessionContext session) {
        Map<String, LabelHandle> handles = new HashMap<>();
        for (Map.Entry<String, List<H>> group : labelGroups.entrySet()) {
            String labelName = group.getKey();
            handles.put(labelName, MailboxCalls.fetch(DispatchStep.ADD_LABELS, labelName, group.getValue().size(),
                () -> session.getOrCreateLabel(labelName)));
        }
        return handles;
    }

    private <H extends MailEntity> Map<String, LabelHandle> findLabelsToRemove(Map<String, List<H>> labelGroups,
                                                                            SessionContext session) {
        Map<String, LabelHandle> handles = new HashMap<>();
        for (Map.Entry<String, List<H>> group : labelGroups.entrySet()) {
            String labelName = group.getKey();
            MailboxCalls.fetch(DispatchStep.REMOVE_LABELS, labelName, group.getValue().size(),
                () -> session.findLabel(labelName))
                .ifPresent(label -> handles.put(labelName, label));
        }
        return handles;
    }

    private <H extends MailEntity> int dispatchMoves(Map<MoveAction, List<H>> moveGroups, MailboxService<H> mailbox,
                                                     String noun) {
        int calls = 0;
        for (Map.Entry<MoveAction, List<H>> group : moveGroups.entrySet()) {
            MoveAction move = group.getKey();
            List<H> entities = group.getValue();
            if (move == MoveAction.UNSET || entities.isEmpty()) {
                continue;
            }
            if (move.isRecordLevel()) {
                for (H entity : entities) {
                    MailboxCalls.invoke(DispatchStep.MOVE, move.name(), 1, () -> moveRecord(move, entity, mailbox));
                    calls++;
                }
            } else {
                MailboxCalls.invoke(DispatchStep.MOVE, move.name(), entities.size(),
                    () -> moveThreads(move, entities, mailbox));
                calls++;
            }
            log.info("{} applied to {} {}s", move, entities.size(), noun);
        }
        return calls;
    }

    private <H extends MailEntity> void moveThreads(MoveAction move, List<H> entities, MailboxService<H> mailbox)
            throws Exception {
        switch (move) {
            case TO_INBOX:
                mailbox.moveToInbox(entities);
                break;
            case TO_ARCHIVE:
                mailbox.moveToArchive(entities);
                break;
            case TO_TRASH:
                mailbox.moveToTrash(entities);
                break;
            default:
                throw new IllegalStateException("Not a thread move: " + move);
        }
    }

    private <H extends MailEntity> void moveRecord(MoveAction move, H entity, MailboxService<H> mailbox)
            throws Exception {
        switch (move) {
            case RECORD_TO_INBOX:
                mailbox.moveRecordToInbox(entity);
                break;
            case RECORD_TO_ARCHIVE:
                mailbox.moveRecordToArchive(entity);
                break;
            case RECORD_TO_TRASH:
                mailbox.moveRecordToTrash(entity);
                break;
            default:
                throw new IllegalStateException("Not a record move: " + move);
        }
    }

    private <H extends MailEntity> int dispatchImportance(Map<ImportanceAction, List<H>> importanceGroups,
                                                          MailboxService<H> mailbox, String noun) {
        int calls = 0;
        for (Map.Entry<ImportanceAction, List<H>> group : importanceGroups.entrySet()) {
            ImportanceAction importance = group.getKey();
            List<H> entities = group.getValue();
            if (importance == ImportanceAction.UNSET || entities.isEmpty()) {
                continue;
            }
            MailboxCalls.invoke(DispatchStep.IMPORTANCE, importance.name(), entities.size(), () -> {
                if (importance == ImportanceAction.MARK_IMPORTANT) {
                    mailbox.markImportant(entities);
                } else {
                    mailbox.markUnimportant(entities);
                }
            });
            calls++;
            log.info("{} applied to {} {}s", importance, entities.size(), noun);
        }
        return calls;
    }

    private <H extends MailEntity> int dispatchReadState(Map<ReadAction, List<H>> readGroups,
                                                         MailboxService<H> mailbox, String noun) {
        int calls = 0;
        for (Map.Entry<ReadAction, List<H>> group : readGroups.entrySet()) {
            ReadAction read = group.getKey();
            List<H> entities = group.getValue();
            if (read == ReadAction.UNSET || entities.isEmpty()) {
                continue;
            }
            MailboxCalls.invoke(DispatchStep.READ_STATE, read.name(), entities.size(), () -> {
                switch (read) {
                    case THREAD_READ:
                        mailbox.markThreadsRead(entities);
                        break;
                    case THREAD_UNREAD:
                        mailbox.markThreadsUnread(entities);
                        break;
                    case RECORD_READ:
                        mailbox.markRecordsRead(entities);
                        break;
                    case RECORD_UNREAD:
                        mailbox.markRecordsUnread(entities);
                        break;
                    default:
                        throw new IllegalStateException("Unexpected read action: " + read);
                }
            });
            calls++;
            log.info("{} applied to {} {}s", read, entities.size(), noun);
        }
        return calls;
    }
}
