package automata.email.app.engine;

import automata.email.app.action.EntityAction;
import automata.email.app.action.ImportanceAction;
import automata.email.app.action.MoveAction;
import automata.email.app.action.ReadAction;
import automata.email.app.mailbox.MailEntity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partitions a dataset along each mutation dimension in a single pass.
 * The whole dataset is validated here, so a malformed action fails the batch
 * before anything is sent to the mailbox.
 */
@Slf4j
public class ActionAggregator {

    public <H extends MailEntity> ActionGroups<H> aggregate(EntityDataset<H> dataset) {
        EntityKind kind = dataset.getKind();
        Map<String, List<H>> labelsToAdd = new LinkedHashMap<>();
        Map<String, List<H>> labelsToRemove = new LinkedHashMap<>();
        List<ActionEntry<H>> categoryReassignments = new ArrayList<>();
        EnumMap<MoveAction, List<H>> moveGroups = emptyGroups(MoveAction.class);
        EnumMap<ImportanceAction, List<H>> importanceGroups = emptyGroups(ImportanceAction.class);
        EnumMap<ReadAction, List<H>> readGroups = emptyGroups(ReadAction.class);
        Set<String> seenIds = new HashSet<>();

        for (ActionEntry<H> entry : dataset.getEntries()) {
            H entity = entry.getEntity();
            EntityAction action = entry.getAction();
            validate(kind, entity, action, seenIds);
            log.debug("apply action {} to {} '{}'", action, kind.getDisplayName(), entity.getSubject());

            group(labelsToAdd, action.getLabelsToAdd(), entity);
            group(labelsToRemove, action.getLabelsToRemove(), entity);
            if (action.hasCategoryReassignment()) {
                categoryReassignments.add(entry);
            }
            moveGroups.get(action.getMove()).add(entity);
            importanceGroups.get(action.getImportance()).add(entity);
            readGroups.get(action.getRead()).add(entity);
        }

        return new ActionGroups<>(kind, dataset.getEntities(), labelsToAdd, labelsToRemove,
            categoryReassignments, moveGroups, importanceGroups, readGroups);
    }

    private <H extends MailEntity> void validate(EntityKind kind, H entity, EntityAction action, Set<String> seenIds) {
        if (!seenIds.add(entity.getId())) {
            throw new MalformedActionException(
                "The " + kind.getDisplayName() + " " + entity.getId() + " appears more than once in the batch");
        }
        validateLabelNames(entity, action.getLabelsToAdd());
        validateLabelNames(entity, action.getLabelsToRemove());
        if (!kind.supports(action.getMove())) {
            throw new MalformedActionException(
                "Move " + action.getMove() + " is not supported for a " + kind.getDisplayName() + " batch");
        }
        if (!kind.supports(action.getRead())) {
            throw new MalformedActionException(
                "Read action " + action.getRead() + " is not supported for a " + kind.getDisplayName() + " batch");
        }
    }

    private void validateLabelNames(MailEntity entity, Collection<String> labelNames) {
        for (String labelName : labelNames) {
            if (labelName == null || labelName.isBlank()) {
                throw new MalformedActionException("Empty label name in action for '" + entity + "'");
            }
        }
    }

    private static <H> void group(Map<String, List<H>> groups, Collection<String> keys, H entity) {
        for (String key : keys) {
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(entity);
        }
    }

    private static <E extends Enum<E>, H> EnumMap<E, List<H>> emptyGroups(Class<E> type) {
        EnumMap<E, List<H>> groups = new EnumMap<>(type);
        for (E value : type.getEnumConstants()) {
            groups.put(value, new ArrayList<>());
        }
        return groups;
    }
}
