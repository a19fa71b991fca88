package automata.email.app.engine;

import automata.email.app.action.EntityAction;
import automata.email.app.mailbox.MailEntity;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The entities of one run, in the order they were selected, each paired with
 * its requested mutations.
 */
public class EntityDataset<H extends MailEntity> {
    @Getter
    private final EntityKind kind;
    @Getter
    private final SessionContext session;
    private final List<ActionEntry<H>> entries = new ArrayList<>();

    public EntityDataset(EntityKind kind, SessionContext session) {
        this.kind = kind;
        this.session = session;
    }

    /**
     * Adds an entity with an empty action and returns that action so the
     * caller can fill it in.
     */
    public EntityAction add(H entity) {
        EntityAction action = new EntityAction();
        entries.add(new ActionEntry<>(entity, action));
        return action;
    }

    public void add(H entity, EntityAction action) {
        entries.add(new ActionEntry<>(entity, action));
    }

    public List<ActionEntry<H>> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<H> getEntities() {
        List<H> entities = new ArrayList<>(entries.size());
        for (ActionEntry<H> entry : entries) {
            entities.add(entry.getEntity());
        }
        return entities;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
