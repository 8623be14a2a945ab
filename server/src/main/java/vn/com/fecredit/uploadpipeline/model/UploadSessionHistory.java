package vn.com.fecredit.uploadpipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;

import java.time.LocalDateTime;

/**
 * Entity representing the history of upload sessions removed by the cleanup sweeper.
 * This table keeps a summary of sessions that completed, expired, failed or were cancelled.
 */
@Entity
@Table(name = "upload_session_history")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadSessionHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, unique = true, length = 36)
    private String sessionId;

    @Column(name = "workspace_id", nullable = false)
    private Long workspaceId;

    @Column(name = "container_id")
    private Long containerId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false)
    private String filename;

    @Column(name = "total_size", nullable = false)
    private long totalSize;

    @Column(name = "chunks_count", nullable = false)
    private int chunksCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "final_status", nullable = false, length = 32)
    private UploadStatus finalStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SessionOutcome outcome;

    @Column(name = "asset_id")
    private Long assetId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "archived_at", nullable = false)
    private LocalDateTime archivedAt;

    /**
     * Creates an UploadSessionHistory instance from a session about to be removed.
     *
     * @param session    The session to summarize
     * @param outcome    How the session ended
     * @param archivedAt When the sweeper archived it
     * @return A new UploadSessionHistory instance
     */
    public static UploadSessionHistory fromUploadSession(IUploadSession session, SessionOutcome outcome,
                                                         LocalDateTime archivedAt) {
        UploadSessionHistory history = new UploadSessionHistory();
        history.setSessionId(session.getSessionId());
        history.setWorkspaceId(session.getWorkspaceId());
        history.setContainerId(session.getContainerId());
        history.setUserId(session.getUserId());
        history.setFilename(session.getFilename());
        history.setTotalSize(session.getTotalSize());
        history.setChunksCount(session.getChunksCount());
        history.setFinalStatus(session.getStatus());
        history.setOutcome(outcome);
        history.setAssetId(session.getAssetId());
        history.setCreatedAt(session.getCreatedAt());
        history.setCompletedAt(session.getCompletedAt());
        history.setArchivedAt(archivedAt);
        return history;
    }
}
