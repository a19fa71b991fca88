package automata.email.app.engine;

import automata.email.app.action.MoveAction;
import automata.email.app.action.ReadAction;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Granularity an engine works at, and the move/read vocabulary allowed there.
 * A thread is already the finest unit a thread batch addresses, so the
 * RECORD_* variants only make sense for messages.
 */
@Getter
public enum EntityKind {
    THREAD("thread",
        EnumSet.of(MoveAction.UNSET, MoveAction.TO_INBOX, MoveAction.TO_ARCHIVE, MoveAction.TO_TRASH),
        EnumSet.of(ReadAction.UNSET, ReadAction.THREAD_READ, ReadAction.THREAD_UNREAD)),
    MESSAGE("message",
        EnumSet.allOf(MoveAction.class),
        EnumSet.allOf(ReadAction.class));

    private final String displayName;
    private final Set<MoveAction> supportedMoves;
    private final Set<ReadAction> supportedReads;

    EntityKind(String displayName, Set<MoveAction> supportedMoves, Set<ReadAction> supportedReads) {
        this.displayName = displayName;
        this.supportedMoves = Collections.unmodifiableSet(supportedMoves);
        this.supportedReads = Collections.unmodifiableSet(supportedReads);
    }

    public boolean supports(MoveAction move) {
        return supportedMoves.contains(move);
    }

    public boolean supports(ReadAction read) {
        return supportedReads.contains(read);
    }
}
