package vn.com.fecredit.uploadpipeline.port.jpa;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import vn.com.fecredit.uploadpipeline.model.SessionOutcome;
import vn.com.fecredit.uploadpipeline.model.UploadSessionHistory;
import vn.com.fecredit.uploadpipeline.model.UploadSessionHistoryRepository;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;
import vn.com.fecredit.uploadpipeline.port.interfaces.ISessionHistoryPort;

import java.time.LocalDateTime;

/**
 * Archives removed sessions to {@code upload_session_history}. Re-archiving a session
 * whose earlier cleanup failed overwrites its row.
 */
@Component
public class JpaSessionHistoryPort implements ISessionHistoryPort {

    private final UploadSessionHistoryRepository repository;

    public JpaSessionHistoryPort(UploadSessionHistoryRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public void archive(IUploadSession session, SessionOutcome outcome, LocalDateTime archivedAt) {
        UploadSessionHistory history = UploadSessionHistory.fromUploadSession(session, outcome, archivedAt);
        repository.findBySessionId(session.getSessionId()).ifPresent(existing -> history.setId(existing.getId()));
        repository.save(history);
    }
}
