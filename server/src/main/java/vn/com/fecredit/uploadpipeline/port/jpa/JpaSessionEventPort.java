package vn.com.fecredit.uploadpipeline.port.jpa;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import vn.com.fecredit.uploadpipeline.model.SessionEvent;
import vn.com.fecredit.uploadpipeline.model.SessionEventRecord;
import vn.com.fecredit.uploadpipeline.model.SessionEventRecordRepository;
import vn.com.fecredit.uploadpipeline.port.interfaces.ISessionEventPort;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Event log on the {@code upload_session_event} table. Appends join the caller's transaction.
 */
@Component
public class JpaSessionEventPort implements ISessionEventPort {

    private final SessionEventRecordRepository repository;

    public JpaSessionEventPort(SessionEventRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public void append(SessionEvent event) {
        repository.save(SessionEventRecord.fromEvent(event));
    }

    @Override
    @Transactional(readOnly = true)
    public List<SessionEvent> findEvents(String sessionId) {
        return repository.findBySessionIdOrderByIdAsc(sessionId).stream()
                .map(SessionEventRecord::toEvent)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public void deleteEvents(String sessionId) {
        repository.deleteBySessionId(sessionId);
    }
}
