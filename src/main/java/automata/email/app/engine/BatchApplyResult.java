package automata.email.app.engine;

import automata.email.app.action.ImportanceAction;
import automata.email.app.action.MoveAction;
import automata.email.app.action.ReadAction;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a batch did: group sizes per dimension and the number of mailbox calls.
 * Enum dimensions only list the values that produced a call.
 */
@Value
@Builder
public class BatchApplyResult {
    EntityKind kind;
    int entityCount;
    Map<String, Integer> labelsAdded;
    Map<String, Integer> labelsRemoved;
    int categoryReassignments;
    Map<MoveAction, Integer> moves;
    Map<ImportanceAction, Integer> importance;
    Map<ReadAction, Integer> readState;
    int mailboxCalls;

    public static BatchApplyResult empty(EntityKind kind) {
        return BatchApplyResult.builder()
            .kind(kind)
            .labelsAdded(Collections.emptyMap())
            .labelsRemoved(Collections.emptyMap())
            .moves(Collections.emptyMap())
            .importance(Collections.emptyMap())
            .readState(Collections.emptyMap())
            .build();
    }

    static BatchApplyResult of(ActionGroups<?> groups, int mailboxCalls) {
        return BatchApplyResult.builder()
            .kind(groups.getKind())
            .entityCount(groups.getEntities().size())
            .labelsAdded(sizes(groups.getLabelsToAdd()))
            .labelsRemoved(sizes(groups.getLabelsToRemove()))
            .categoryReassignments(groups.getCategoryReassignments().size())
            .moves(actedSizes(groups.getMoveGroups(), MoveAction.class, MoveAction.UNSET))
            .importance(actedSizes(groups.getImportanceGroups(), ImportanceAction.class, ImportanceAction.UNSET))
            .readState(actedSizes(groups.getReadGroups(), ReadAction.class, ReadAction.UNSET))
            .mailboxCalls(mailboxCalls)
            .build();
    }

    private static Map<String, Integer> sizes(Map<String, ? extends List<?>> groups) {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        groups.forEach((key, members) -> sizes.put(key, members.size()));
        return sizes;
    }

    private static <E extends Enum<E>> Map<E, Integer> actedSizes(Map<E, ? extends List<?>> groups, Class<E> type,
                                                                  E unset) {
        Map<E, Integer> sizes = new EnumMap<>(type);
        groups.forEach((value, members) -> {
            if (value != unset && !members.isEmpty()) {
                sizes.put(value, members.size());
            }
        });
        return sizes;
    }
}
