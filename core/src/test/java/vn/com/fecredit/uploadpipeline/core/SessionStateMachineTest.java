package vn.com.fecredit.uploadpipeline.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import vn.com.fecredit.uploadpipeline.exception.InvalidTransitionException;
import vn.com.fecredit.uploadpipeline.exception.SessionNotFoundException;
import vn.com.fecredit.uploadpipeline.model.SessionEvent;
import vn.com.fecredit.uploadpipeline.model.SessionEventType;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.model.impl.DefaultUploadSession;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;
import vn.com.fecredit.uploadpipeline.port.impl.DefaultSessionEventPort;
import vn.com.fecredit.uploadpipeline.port.impl.DefaultUploadSessionPort;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SessionStateMachineTest {

    private MutableClock clock;
    private DefaultSessionEventPort events;
    private DefaultUploadSessionPort sessions;
    private SessionStateMachine<DefaultUploadSession> stateMachine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        events = new DefaultSessionEventPort();
        sessions = new DefaultUploadSessionPort(events);
        stateMachine = new SessionStateMachine<>(sessions, clock);
    }

    private String pending(String sessionId, String filename) {
        DefaultUploadSession session = new DefaultUploadSession();
        session.setSessionId(sessionId);
        session.setWorkspaceId(1L);
        session.setFilename(filename);
        session.setStatus(UploadStatus.PENDING);
        session.setActiveSlotKey(IUploadSession.slotKey(1L, null, filename));
        session.setCreatedAt(stateMachine.now());
        session.setUpdatedAt(stateMachine.now());
        sessions.create(session, SessionEvent.of(session.getSessionId(), SessionEventType.CREATED,
                UploadStatus.PENDING, null, null, stateMachine.now()));
        return session.getSessionId();
    }

    @Test
    void testIllegalTransition_isRejectedBeforeTouchingStore() {
        String id = pending("s-a", "a.txt");

        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> stateMachine.transition(id, UploadStatus.PENDING, UploadStatus.COMPLETED,
                        SessionEventType.TRANSITION, null, null));

        assertEquals(UploadStatus.PENDING, e.getFrom());
        assertEquals(UploadStatus.COMPLETED, e.getTo());
        assertEquals(UploadStatus.PENDING, stateMachine.require(id).getStatus());
        assertEquals(1, events.findEvents(id).size());
    }

    @Test
    void testLostCompareAndSet_appendsNoEvent() {
        String id = pending("s-b", "b.txt");

        assertFalse(stateMachine.transition(id, UploadStatus.UPLOADING, UploadStatus.ASSEMBLING,
                SessionEventType.TRANSITION, null, null));

        assertEquals(UploadStatus.PENDING, stateMachine.require(id).getStatus());
        assertEquals(1, events.findEvents(id).size());
    }

    @Test
    void testCommittedTransition_stampsTimestampsAndLogsEvent() {
        String id = pending("s-c", "c.wav");
        clock.advance(Duration.ofMinutes(5));

        assertTrue(stateMachine.transition(id, Set.of(UploadStatus.PENDING), UploadStatus.ASSEMBLING,
                SessionEventType.TRANSITION, Map.of("completed_chunks", 1), null, null));
        assertTrue(stateMachine.transition(id, Set.of(UploadStatus.ASSEMBLING), UploadStatus.VIRUS_SCANNING,
                SessionEventType.VIRUS_SCAN, Map.of("status", "queued"), null, s -> s.setAssembledFilePath("/tmp/x")));

        DefaultUploadSession session = stateMachine.require(id);
        assertEquals(stateMachine.now(), session.getUpdatedAt());
        assertEquals(stateMachine.now(), session.getVirusScanQueuedAt());
        assertEquals("/tmp/x", session.getAssembledFilePath());
        assertNotNull(session.getActiveSlotKey());

        List<SessionEvent> log = events.findEvents(id);
        assertEquals(3, log.size());
        assertEquals(UploadStatus.ASSEMBLING, log.get(2).getFromStatus());
        assertEquals(UploadStatus.VIRUS_SCANNING, log.get(2).getToStatus());
    }

    @Test
    void testTerminalTransition_releasesFilenameSlot() {
        String id = pending("s-d", "d.txt");

        assertTrue(stateMachine.transition(id, UploadStatus.PENDING, UploadStatus.CANCELLED,
                SessionEventType.TRANSITION, null, null));

        assertNull(stateMachine.require(id).getActiveSlotKey());
        assertEquals("s-d2", pending("s-d2", "d.txt"));
    }

    @Test
    void testUnknownSession() {
        assertThrows(SessionNotFoundException.class, () -> stateMachine.require("missing"));
        assertFalse(stateMachine.transition("missing", UploadStatus.PENDING, UploadStatus.UPLOADING,
                SessionEventType.TRANSITION, null, null));
    }
}
