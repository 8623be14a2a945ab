package vn.com.fecredit.uploadpipeline.model;

import jakarta.persistence.*;
import lombok.Data;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persistent upload session. {@code activeSlotKey} is unique while set, which keeps one
 * in-flight upload per (workspace, container, filename); terminal states clear it.
 */
@Entity
@Table(name = "upload_session", indexes = {
        @Index(name = "idx_upload_session_status_updated", columnList = "status, updated_at"),
        @Index(name = "idx_upload_session_status_created", columnList = "status, created_at")
})
@Data
public class UploadSession implements IUploadSession {

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
    @Column(nullable = false, length = 32)
    private UploadStatus status;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 16384)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "assembled_file_path", length = 1024)
    private String assembledFilePath;

    @Column(name = "asset_id")
    private Long assetId;

    @Column(name = "active_slot_key", unique = true, length = 512)
    private String activeSlotKey;

    @Column(name = "virus_scan_queued_at")
    private LocalDateTime virusScanQueuedAt;

    @Column(name = "virus_scan_completed_at")
    private LocalDateTime virusScanCompletedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
