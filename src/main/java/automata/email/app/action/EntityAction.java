package automata.email.app.action;

import lombok.Getter;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutations requested for one thread or message. Filled in by the rule stage
 * before a batch runs; the engine only reads it.
 */
@Getter
public class EntityAction {
    private final Set<String> labelsToAdd = new LinkedHashSet<>();
    private final Set<String> labelsToRemove = new LinkedHashSet<>();
    private final Set<MailCategory> categories = EnumSet.noneOf(MailCategory.class);
    private MoveAction move = MoveAction.UNSET;
    private ImportanceAction importance = ImportanceAction.UNSET;
    private ReadAction read = ReadAction.UNSET;

    public EntityAction addLabel(String labelName) {
        labelsToAdd.add(labelName);
        return this;
    }

    public EntityAction removeLabel(String labelName) {
        labelsToRemove.add(labelName);
        return this;
    }

    public EntityAction assignCategory(MailCategory category) {
        categories.add(category);
        return this;
    }

    public EntityAction moveTo(MoveAction move) {
        this.move = move == null ? MoveAction.UNSET : move;
        return this;
    }

    public EntityAction markImportance(ImportanceAction importance) {
        this.importance = importance == null ? ImportanceAction.UNSET : importance;
        return this;
    }

    public EntityAction markRead(ReadAction read) {
        this.read = read == null ? ReadAction.UNSET : read;
        return this;
    }

    public boolean hasCategoryReassignment() {
        return !categories.isEmpty();
    }

    @Override
    public String toString() {
        return "EntityAction{add=" + labelsToAdd + ", remove=" + labelsToRemove
                + ", categories=" + categories + ", move=" + move
                + ", importance=" + importance + ", read=" + read + "}";
    }
}
