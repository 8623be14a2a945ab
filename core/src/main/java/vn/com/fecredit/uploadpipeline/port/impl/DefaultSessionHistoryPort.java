package vn.com.fecredit.uploadpipeline.port.impl;

import vn.com.fecredit.uploadpipeline.model.SessionOutcome;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;
import vn.com.fecredit.uploadpipeline.port.interfaces.ISessionHistoryPort;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default in-memory implementation of ISessionHistoryPort; keeps only the outcome per session.
 */
public class DefaultSessionHistoryPort implements ISessionHistoryPort {

    private final Map<String, SessionOutcome> outcomes = new ConcurrentHashMap<>();

    @Override
    public void archive(IUploadSession session, SessionOutcome outcome, LocalDateTime archivedAt) {
        outcomes.put(session.getSessionId(), outcome);
    }

    public Optional<SessionOutcome> findOutcome(String sessionId) {
        return Optional.ofNullable(outcomes.get(sessionId));
    }
}
