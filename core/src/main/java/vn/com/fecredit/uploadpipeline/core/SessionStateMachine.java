package vn.com.fecredit.uploadpipeline.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.uploadpipeline.exception.InvalidTransitionException;
import vn.com.fecredit.uploadpipeline.exception.SessionNotFoundException;
import vn.com.fecredit.uploadpipeline.model.SessionEvent;
import vn.com.fecredit.uploadpipeline.model.SessionEventType;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;
import vn.com.fecredit.uploadpipeline.port.interfaces.IUploadSessionPort;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Single entry point for session status changes.
 *
 * <p>
 * Every transition is checked against {@link UploadStatus#canTransitionTo} and committed as a
 * compare-and-swap through the session port, together with the status timestamps, the release
 * of the filename slot on terminal states, and one appended event.
 */
public class SessionStateMachine<S extends IUploadSession> {

    private static final Logger log = LoggerFactory.getLogger(SessionStateMachine.class);

    private final IUploadSessionPort<S> sessionPort;
    private final Clock clock;

    public SessionStateMachine(IUploadSessionPort<S> sessionPort, Clock clock) {
        this.sessionPort = sessionPort;
        this.clock = clock;
    }

    public Optional<S> find(String sessionId) {
        return sessionPort.findBySessionId(sessionId);
    }

    public S require(String sessionId) {
        return sessionPort.findBySessionId(sessionId)
                .orElseThrow(() -> new SessionNotFoundException("Upload session not found: " + sessionId));
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Moves the session from any status in {@code expected} to {@code target}.
     *
     * @return {@code true} if this call won the transition
     * @throws InvalidTransitionException if some expected status may not move to {@code target}
     */
    public boolean transition(String sessionId, Set<UploadStatus> expected, UploadStatus target,
                              SessionEventType eventType, Map<String, Object> attributes, String message,
                              Consumer<S> changes) {
        for (UploadStatus from : expected) {
            if (!from.canTransitionTo(target)) {
                throw new InvalidTransitionException(from, target);
            }
        }
        LocalDateTime now = now();
        SessionEvent event = SessionEvent.of(sessionId, eventType, target, attributes, message, now);
        boolean committed = sessionPort.transition(sessionId, expected, target, session -> {
            session.setUpdatedAt(now);
            stampTimestamps(session, target, now);
            if (!target.holdsFilenameSlot()) {
                session.setActiveSlotKey(null);
            }
            if (changes != null) {
                changes.accept(session);
            }
        }, event);
        if (committed) {
            log.info("Upload session {} moved to {}", sessionId, target);
        } else {
            log.debug("Upload session {} was not in {}; transition to {} skipped", sessionId, expected, target);
        }
        return committed;
    }

    public boolean transition(String sessionId, UploadStatus expected, UploadStatus target,
                              SessionEventType eventType, Map<String, Object> attributes, String message) {
        return transition(sessionId, Set.of(expected), target, eventType, attributes, message, null);
    }

    private void stampTimestamps(S session, UploadStatus target, LocalDateTime now) {
        switch (target) {
            case VIRUS_SCANNING:
                session.setVirusScanQueuedAt(now);
                break;
            case FINALIZING:
            case VIRUS_SCAN_FAILED:
                session.setVirusScanCompletedAt(now);
                break;
            case COMPLETED:
            case FINALIZATION_FAILED:
                session.setCompletedAt(now);
                break;
            default:
                break;
        }
    }
}
