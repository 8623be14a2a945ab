package vn.com.fecredit.uploadpipeline.port.interfaces;

import vn.com.fecredit.uploadpipeline.model.SessionOutcome;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;

import java.time.LocalDateTime;

public interface ISessionHistoryPort {

    /**
     * Records a session that is about to be removed.
     */
    void archive(IUploadSession session, SessionOutcome outcome, LocalDateTime archivedAt);
}
