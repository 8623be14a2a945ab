package vn.com.fecredit.uploadpipeline.port.impl;

import vn.com.fecredit.uploadpipeline.exception.DuplicateUploadException;
import vn.com.fecredit.uploadpipeline.model.SessionEvent;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.model.impl.DefaultUploadSession;
import vn.com.fecredit.uploadpipeline.port.interfaces.ISessionEventPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IUploadSessionPort;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Default in-memory implementation of IUploadSessionPort.
 *
 * <p>
 * Slot uniqueness is enforced by an atomic {@code putIfAbsent} on the slot map;
 * transitions are serialized per session.
 */
public class DefaultUploadSessionPort implements IUploadSessionPort<DefaultUploadSession> {

    private final Map<String, DefaultUploadSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> slots = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final ISessionEventPort eventPort;

    public DefaultUploadSessionPort(ISessionEventPort eventPort) {
        this.eventPort = eventPort;
    }

    @Override
    public DefaultUploadSession create(DefaultUploadSession session, SessionEvent createdEvent) {
        if (session == null || session.getSessionId() == null) {
            throw new IllegalArgumentException("Session or sessionId cannot be null");
        }
        String slotKey = session.getActiveSlotKey();
        if (slotKey != null) {
            String holder = slots.putIfAbsent(slotKey, session.getSessionId());
            if (holder != null) {
                throw new DuplicateUploadException("An upload for '" + session.getFilename()
                        + "' is already in progress in this location (session " + holder + ")");
            }
        }
        session.setId(ids.incrementAndGet());
        sessions.put(session.getSessionId(), session);
        eventPort.append(createdEvent);
        return session;
    }

    @Override
    public Optional<DefaultUploadSession> findBySessionId(String sessionId) {
        return Optional.ofNullable(sessionId != null ? sessions.get(sessionId) : null);
    }

    @Override
    public boolean transition(String sessionId, Set<UploadStatus> expected, UploadStatus target,
                              Consumer<DefaultUploadSession> changes, SessionEvent event) {
        DefaultUploadSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        synchronized (session) {
            UploadStatus current = session.getStatus();
            if (!expected.contains(current)) {
                return false;
            }
            String slotBefore = session.getActiveSlotKey();
            session.setStatus(target);
            if (changes != null) {
                changes.accept(session);
            }
            if (slotBefore != null && !Objects.equals(slotBefore, session.getActiveSlotKey())) {
                slots.remove(slotBefore, sessionId);
            }
            eventPort.append(event.withFromStatus(current));
            return true;
        }
    }

    @Override
    public boolean touch(String sessionId, Set<UploadStatus> expected, LocalDateTime at) {
        DefaultUploadSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        synchronized (session) {
            if (!expected.contains(session.getStatus())) {
                return false;
            }
            session.setUpdatedAt(at);
            return true;
        }
    }

    @Override
    public List<DefaultUploadSession> findCreatedBefore(Set<UploadStatus> statuses, LocalDateTime cutoff,
                                                        long afterId, int limit) {
        return page(statuses, DefaultUploadSession::getCreatedAt, cutoff, afterId, limit);
    }

    @Override
    public List<DefaultUploadSession> findUpdatedBefore(Set<UploadStatus> statuses, LocalDateTime cutoff,
                                                        long afterId, int limit) {
        return page(statuses, DefaultUploadSession::getUpdatedAt, cutoff, afterId, limit);
    }

    private List<DefaultUploadSession> page(Set<UploadStatus> statuses,
                                            Function<DefaultUploadSession, LocalDateTime> timestamp,
                                            LocalDateTime cutoff, long afterId, int limit) {
        return sessions.values().stream()
                .filter(s -> statuses.contains(s.getStatus()))
                .filter(s -> timestamp.apply(s) != null && timestamp.apply(s).isBefore(cutoff))
                .filter(s -> s.getId() > afterId)
                .sorted(Comparator.comparing(DefaultUploadSession::getId))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public void delete(DefaultUploadSession session) {
        if (session == null || session.getSessionId() == null) return;
        DefaultUploadSession removed = sessions.remove(session.getSessionId());
        if (removed != null && removed.getActiveSlotKey() != null) {
            slots.remove(removed.getActiveSlotKey(), removed.getSessionId());
        }
    }
}
