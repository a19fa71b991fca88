package automata.email.app.engine;

import automata.email.app.mailbox.LabelHandle;
import automata.email.app.mailbox.LabelResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionContextTest {

    @Mock
    private LabelResolver labelResolver;

    @Test
    void getOrCreateLabel_SameNameTwice_ShouldResolveOnce() throws Exception {
        // Given
        LabelHandle handle = new LabelHandle("Label_7", "receipts");
        when(labelResolver.resolve("receipts")).thenReturn(handle);
        SessionContext session = SessionContext.builder()
            .unprocessedLabel("unprocessed")
            .labelResolver(labelResolver)
            .build();

        // When
        LabelHandle first = session.getOrCreateLabel("receipts");
        LabelHandle second = session.getOrCreateLabel("receipts");

        // Then
        assertSame(first, second);
        verify(labelResolver, times(1)).resolve("receipts");
    }

    @Test
    void builder_WithoutOptionalValues_ShouldApplyDefaults() {
        SessionContext session = SessionContext.builder()
            .unprocessedLabel("unprocessed")
            .labelResolver(labelResolver)
            .build();

        assertEquals("", session.getProcessedLabel());
        assertFalse(session.hasProcessedLabel());
        assertEquals(Instant.EPOCH, session.getOldestToProcess());
    }

    @Test
    void builder_WithBlankUnprocessedLabel_ShouldFail() {
        SessionContext.SessionContextBuilder builder = SessionContext.builder()
            .processedLabel("processed")
            .unprocessedLabel(" ")
            .labelResolver(labelResolver);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void getOrCreateLabel_RejectedName_ShouldThrowMalformedAction() throws Exception {
        when(labelResolver.resolve("bad/name")).thenThrow(new IllegalArgumentException("labels.create returned 400"));
        SessionContext session = SessionContext.builder()
            .unprocessedLabel("unprocessed")
            .labelResolver(labelResolver)
            .build();

        assertThrows(MalformedActionException.class, () -> session.getOrCreateLabel("bad/name"));
    }

    @Test
    void findLabel_AfterCreate_ShouldUseCachedHandle() throws Exception {
        LabelHandle handle = new LabelHandle("Label_7", "receipts");
        when(labelResolver.resolve("receipts")).thenReturn(handle);
        SessionContext session = SessionContext.builder()
            .unprocessedLabel("unprocessed")
            .labelResolver(labelResolver)
            .build();

        session.getOrCreateLabel("receipts");

        assertEquals(Optional.of(handle), session.findLabel("receipts"));
        verify(labelResolver, never()).find("receipts");
    }

    @Test
    void findLabel_MissingName_ShouldNotCreate() throws Exception {
        when(labelResolver.find("archive-2019")).thenReturn(Optional.empty());
        SessionContext session = SessionContext.builder()
            .unprocessedLabel("unprocessed")
            .labelResolver(labelResolver)
            .build();

        assertTrue(session.findLabel("archive-2019").isEmpty());
        verify(labelResolver, never()).resolve("archive-2019");
    }
}
