package automata.email.app.engine;

import automata.email.app.action.ImportanceAction;
import automata.email.app.action.MoveAction;
import automata.email.app.action.ReadAction;
import automata.email.app.mailbox.MailEntity;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A batch partitioned along each mutation dimension.
 * Enum dimensions hold an entry for every value, UNSET included.
 */
@Value
public class ActionGroups<H extends MailEntity> {
    EntityKind kind;
    List<H> entities;
    Map<String, List<H>> labelsToAdd;
    Map<String, List<H>> labelsToRemove;
    List<ActionEntry<H>> categoryReassignments;
    EnumMap<MoveAction, List<H>> moveGroups;
    EnumMap<ImportanceAction, List<H>> importanceGroups;
    EnumMap<ReadAction, List<H>> readGroups;
}
