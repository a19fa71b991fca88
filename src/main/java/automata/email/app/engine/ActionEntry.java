package automata.email.app.engine;

import automata.email.app.action.EntityAction;
import automata.email.app.mailbox.MailEntity;
import lombok.NonNull;
import lombok.Value;

/**
 * One entity of a batch together with the mutations requested for it.
 */
@Value
public class ActionEntry<H extends MailEntity> {
    @NonNull H entity;
    @NonNull EntityAction action;
}
