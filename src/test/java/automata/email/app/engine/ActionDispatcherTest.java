package automata.email.app.engine;

import automata.email.app.action.ImportanceAction;
import automata.email.app.action.MailCategory;
import automata.email.app.action.MoveAction;
import automata.email.app.action.ReadAction;
import automata.email.app.mailbox.LabelHandle;
import automata.email.app.mailbox.LabelResolver;
import automata.email.app.mailbox.MailboxService;
import automata.email.app.mailbox.MessageHandle;
import automata.email.app.mailbox.ThreadHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ActionDispatcherTest {

    @Mock
    private MailboxService<ThreadHandle> mailbox;

    @Mock
    private MailboxService<MessageHandle> messageMailbox;

    @Mock
    private LabelResolver labelResolver;

    private final ActionAggregator aggregator = new ActionAggregator();
    private final ActionDispatcher dispatcher = new ActionDispatcher();
    private SessionContext session;
    private ThreadHandle rec1;
    private ThreadHandle rec2;
    private ThreadHandle rec3;

    @BeforeEach
    void setUp() throws Exception {
        lenient().when(labelResolver.resolve(anyString()))
            .thenAnswer(invocation -> label(invocation.getArgument(0)));
        lenient().when(labelResolver.find(anyString()))
            .thenAnswer(invocation -> Optional.of(label(invocation.getArgument(0))));
        session = SessionContext.builder()
            .unprocessedLabel("unprocessed")
            .labelResolver(labelResolver)
            .build();
        rec1 = new ThreadHandle("t1", "First", List.of("m1"));
        rec2 = new ThreadHandle("t2", "Second", List.of("m2"));
        rec3 = new ThreadHandle("t3", "Third", List.of("m3"));
    }

    private static LabelHandle label(String name) {
        return new LabelHandle("Label_" + name, name);
    }

    private int dispatch(EntityDataset<ThreadHandle> dataset) {
        return dispatcher.dispatch(aggregator.aggregate(dataset), session, mailbox);
    }

    @Test
    void dispatch_PureLabelBatch_ShouldAddEachLabelOnce() throws Exception {
        // Given
        EntityDataset<ThreadHandle> dataset = new EntityDataset<>(EntityKind.THREAD, session);
        dataset.add(rec1).addLabel("A");
        dataset.add(rec2).addLabel("A");
        dataset.add(rec3).addLabel("B");

        // When
        int calls = dispatch(dataset);

        // Then
        assertEquals(2, calls);
        verify(mailbox).addLabel(label("A"), List.of(rec1, rec2));
        verify(mailbox).addLabel(label("B"), List.of(rec3));
        verify(mailbox, never()).removeLabel(any(), anyList());
        verifyNoMoreInteractions(mailbox);
    }

    @Test
    void dispatch_LabelInAddAndRemove_ShouldRemoveAfterAdd() throws Exception {
        EntityDataset<ThreadHandle> dataset = new EntityDataset<>(EntityKind.THREAD, session);
        dataset.add(rec1).addLabel("X").removeLabel("X");

        dispatch(dataset);

        InOrder inOrder = inOrder(mailbox);
        inOrder.verify(mailbox).addLabel(label("X"), List.of(rec1));
        inOrder.verify(mailbox).removeLabel(label("X"), List.of(rec1));
    }

    @Test
    void dispatch_OnlyUnsetValues_ShouldNotCallMailbox() {
        EntityDataset<ThreadHandle> dataset = new EntityDataset<>(EntityKind.THREAD, session);
        dataset.add(rec1);
        dataset.add(rec2).moveTo(MoveAction.UNSET).markImportance(ImportanceAction.UNSET).markRead(ReadAction.UNSET);

        int calls = dispatch(dataset);

        assertEquals(0, calls);
        verifyNoInteractions(mailbox, labelResolver);
    }

    @Test
    void dispatch_SingleCategory_ShouldRemoveEveryOtherCategory() throws Exception {
        EntityDataset<ThreadHandle> dataset = new EntityDataset<>(EntityKind.THREAD, session);
        dataset.add(rec1).assignCategory(MailCategory.SOCIAL);
        dataset.add(rec2);

        dispatch(dataset);

        verify(mailbox).reassignCategories(rec1,
            List.of(MailCategory.SOCIAL),
            List.of(MailCategory.PRIMARY, MailCategory.PROMOTIONS, MailCategory.UPDATES, MailCategory.FORUMS));
        verify(mailbox, never()).reassignCategories(eq(rec2), anyList(), anyList());
    }

    @Test
    void dispatch_ThreadMovesImportanceAndRead_ShouldIssueOneBulkCallPerGroup() throws Exception {
        // Given
        EntityDataset<ThreadHandle> dataset = new EntityDataset<>(EntityKind.THREAD, session);
        dataset.add(rec1).moveTo(MoveAction.TO_TRASH).markImportance(ImportanceAction.MARK_UNIMPORTANT);
        dataset.add(rec2).moveTo(MoveAction.TO_TRASH).markRead(ReadAction.THREAD_READ);
        dataset.add(rec3).moveTo(MoveAction.TO_INBOX).markImportance(ImportanceAction.MARK_IMPORTANT)
            .markRead(ReadAction.THREAD_UNREAD);

        // When
        int calls = dispatch(dataset);

        // Then
        assertEquals(6, calls);
        InOrder inOrder = inOrder(mailbox);
        inOrder.verify(mailbox).moveToInbox(List.of(rec3));
        inOrder.verify(mailbox).moveToTrash(List.of(rec1, rec2));
        inOrder.verify(mailbox).markImportant(List.of(rec3));
        inOrder.verify(mailbox).markUnimportant(List.of(rec1));
        inOrder.verify(mailbox).markThreadsRead(List.of(rec2));
        inOrder.verify(mailbox).markThreadsUnread(List.of(rec3));
        verify(mailbox, never()).moveToArchive(anyList());
    }

    @Test
    void dispatch_RecordMoves_ShouldCallOncePerMessage() throws Exception {
        // Given
        MessageHandle m1 = new MessageHandle("m1", "t1", "Hello");
        MessageHandle m2 = new MessageHandle("m2", "t1", "Re: Hello");
        MessageHandle m3 = new MessageHandle("m3", "t2", "Other");
        EntityDataset<MessageHandle> dataset = new EntityDataset<>(EntityKind.MESSAGE, session);
        dataset.add(m1).moveTo(MoveAction.RECORD_TO_TRASH).markRead(ReadAction.RECORD_READ);
        dataset.add(m2).moveTo(MoveAction.RECORD_TO_TRASH).markRead(ReadAction.RECORD_UNREAD);
        dataset.add(m3).moveTo(MoveAction.TO_ARCHIVE).markRead(ReadAction.RECORD_READ);

        // When
        int calls = dispatcher.dispatch(aggregator.aggregate(dataset), session, messageMailbox);

        // Then
        assertEquals(5, calls);
        verify(messageMailbox).moveToArchive(List.of(m3));
        verify(messageMailbox).moveRecordToTrash(m1);
        verify(messageMailbox).moveRecordToTrash(m2);
        verify(messageMailbox).markRecordsRead(List.of(m1, m3));
        verify(messageMailbox).markRecordsUnread(List.of(m2));
        verify(messageMailbox, never()).moveToTrash(anyList());
        verify(messageMailbox, never()).markThreadsRead(anyList());
    }

    @Test
    void dispatch_FailingCall_ShouldStopRemainingSteps() throws Exception {
        // Given
        EntityDataset<ThreadHandle> dataset = new EntityDataset<>(EntityKind.THREAD, session);
        dataset.add(rec1).addLabel("A").moveTo(MoveAction.TO_TRASH).markImportance(ImportanceAction.MARK_IMPORTANT);
        doThrow(new IOException("rate limit exceeded")).when(mailbox).moveToTrash(anyList());

        // When
        MailboxCallException e = assertThrows(MailboxCallException.class, () -> dispatch(dataset));

        // Then
        assertEquals(DispatchStep.MOVE, e.getStep());
        assertEquals("TO_TRASH", e.getGroupKey());
        assertEquals(1, e.getGroupSize());
        assertInstanceOf(IOException.class, e.getCause());
        verify(mailbox).addLabel(label("A"), List.of(rec1));
        verify(mailbox, never()).markImportant(anyList());
    }

    @Test
    void dispatch_LabelResolutionFailure_ShouldReportAddLabelsStep() throws Exception {
        EntityDataset<ThreadHandle> dataset = new EntityDataset<>(EntityKind.THREAD, session);
        dataset.add(rec1).addLabel("A").markRead(ReadAction.THREAD_READ);
        when(labelResolver.resolve("A")).thenThrow(new IOException("forbidden"));

        MailboxCallException e = assertThrows(MailboxCallException.class, () -> dispatch(dataset));

        assertEquals(DispatchStep.ADD_LABELS, e.getStep());
        verifyNoInteractions(mailbox);
    }

    @Test
    void dispatch_RejectedLabelName_ShouldFailBeforeAnyLabelIsAdded() throws Exception {
        // Given
        String tooLong = "X".repeat(300);
        EntityDataset<ThreadHandle> dataset = new EntityDataset<>(EntityKind.THREAD, session);
        dataset.add(rec1).addLabel("A");
        dataset.add(rec2).addLabel(tooLong);
        when(labelResolver.resolve(tooLong)).thenThrow(new IllegalArgumentException("name too long"));

        // When
        MalformedActionException e = assertThrows(MalformedActionException.class, () -> dispatch(dataset));

        // Then
        assertTrue(e.getMessage().contains("name too long"));
        verifyNoInteractions(mailbox);
    }

    @Test
    void dispatch_LaterLabelResolutionFailure_ShouldNotAddEarlierLabels() throws Exception {
        EntityDataset<ThreadHandle> dataset = new EntityDataset<>(EntityKind.THREAD, session);
        dataset.add(rec1).addLabel("A");
        dataset.add(rec2).addLabel("B");
        when(labelResolver.resolve("B")).thenThrow(new IOException("backend error"));

        MailboxCallException e = assertThrows(MailboxCallException.class, () -> dispatch(dataset));

        assertEquals(DispatchStep.ADD_LABELS, e.getStep());
        assertEquals("B", e.getGroupKey());
        verifyNoInteractions(mailbox);
    }

    @Test
    void dispatch_RemoveLabelUnknownToMailbox_ShouldSkipWithoutCreatingIt() throws Exception {
        EntityDataset<ThreadHandle> dataset = new EntityDataset<>(EntityKind.THREAD, session);
        dataset.add(rec1).removeLabel("stale");
        dataset.add(rec2).removeLabel("known");
        when(labelResolver.find("stale")).thenReturn(Optional.empty());

        int calls = dispatch(dataset);

        assertEquals(1, calls);
        verify(mailbox).removeLabel(label("known"), List.of(rec2));
        verify(labelResolver, never()).resolve(anyString());
        verifyNoMoreInteractions(mailbox);
    }
}
