package vn.com.fecredit.uploadpipeline.port.jpa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import vn.com.fecredit.uploadpipeline.exception.DuplicateUploadException;
import vn.com.fecredit.uploadpipeline.model.SessionEvent;
import vn.com.fecredit.uploadpipeline.model.UploadSession;
import vn.com.fecredit.uploadpipeline.model.UploadSessionRepository;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.port.interfaces.ISessionEventPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IUploadSessionPort;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Session store on the {@code upload_session} table.
 *
 * <p>
 * The unique index on {@code active_slot_key} enforces one in-flight upload per location, and
 * {@link #transition} is a conditional UPDATE, so the database decides every race.
 */
@Component
public class JpaUploadSessionPort implements IUploadSessionPort<UploadSession> {

    private static final Logger log = LoggerFactory.getLogger(JpaUploadSessionPort.class);

    private final UploadSessionRepository repository;
    private final ISessionEventPort eventPort;

    public JpaUploadSessionPort(UploadSessionRepository repository, ISessionEventPort eventPort) {
        this.repository = repository;
        this.eventPort = eventPort;
    }

    @Override
    @Transactional
    public UploadSession create(UploadSession session, SessionEvent createdEvent) {
        UploadSession saved;
        try {
            saved = repository.saveAndFlush(session);
        } catch (DataIntegrityViolationException e) {
            log.debug("Rejected session for slot {}: {}", session.getActiveSlotKey(), e.getMessage());
            throw new DuplicateUploadException("An upload for '" + session.getFilename()
                    + "' is already in progress in this location");
        }
        eventPort.append(createdEvent);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UploadSession> findBySessionId(String sessionId) {
        return repository.findBySessionId(sessionId);
    }

    @Override
    @Transactional
    public boolean transition(String sessionId, Set<UploadStatus> expected, UploadStatus target,
                              Consumer<UploadSession> changes, SessionEvent event) {
        Optional<UploadSession> observed = repository.findBySessionId(sessionId);
        if (observed.isEmpty() || !expected.contains(observed.get().getStatus())) {
            return false;
        }
        UploadStatus from = observed.get().getStatus();
        if (repository.compareAndSetStatus(sessionId, from, target) == 0) {
            return false;
        }
        UploadSession session = repository.findBySessionId(sessionId)
                .orElseThrow(() -> new IllegalStateException("Session " + sessionId + " vanished during transition"));
        session.setStatus(target);
        if (changes != null) {
            changes.accept(session);
        }
        repository.saveAndFlush(session);
        eventPort.append(event.withFromStatus(from));
        return true;
    }

    @Override
    @Transactional
    public boolean touch(String sessionId, Set<UploadStatus> expected, LocalDateTime at) {
        return repository.touch(sessionId, expected, at) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<UploadSession> findCreatedBefore(Set<UploadStatus> statuses, LocalDateTime cutoff, long afterId,
                                                 int limit) {
        return repository.findCreatedBefore(statuses, cutoff, afterId, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<UploadSession> findUpdatedBefore(Set<UploadStatus> statuses, LocalDateTime cutoff, long afterId,
                                                 int limit) {
        return repository.findUpdatedBefore(statuses, cutoff, afterId, PageRequest.of(0, limit));
    }

    @Override
    @Transactional
    public void delete(UploadSession session) {
        repository.findBySessionId(session.getSessionId()).ifPresent(repository::delete);
    }
}
