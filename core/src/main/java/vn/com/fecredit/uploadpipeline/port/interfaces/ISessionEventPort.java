package vn.com.fecredit.uploadpipeline.port.interfaces;

import vn.com.fecredit.uploadpipeline.model.SessionEvent;

import java.util.List;

/**
 * Append-only session event log.
 */
public interface ISessionEventPort {

    void append(SessionEvent event);

    /**
     * @return events of the session in append order
     */
    List<SessionEvent> findEvents(String sessionId);

    void deleteEvents(String sessionId);
}
