package vn.com.fecredit.uploadpipeline.model.interfaces;

import vn.com.fecredit.uploadpipeline.model.UploadStatus;

import java.time.LocalDateTime;
import java.util.Map;

public interface IUploadSession {

    /**
     * Builds the key of the filename slot a non-terminal session reserves.
     */
    static String slotKey(Long workspaceId, Long containerId, String filename) {
        return workspaceId + "/" + (containerId != null ? containerId.toString() : "-") + "/" + filename;
    }

    /** Surrogate key, increasing in creation order; used for keyset batching. */
    Long getId();

    void setId(Long id);

    String getSessionId();

    void setSessionId(String sessionId);

    Long getWorkspaceId();

    void setWorkspaceId(Long workspaceId);

    Long getContainerId();

    void setContainerId(Long containerId);

    Long getUserId();

    void setUserId(Long userId);

    String getFilename();

    void setFilename(String filename);

    long getTotalSize();

    void setTotalSize(long totalSize);

    int getChunksCount();

    void setChunksCount(int chunksCount);

    UploadStatus getStatus();

    void setStatus(UploadStatus status);

    Map<String, Object> getMetadata();

    void setMetadata(Map<String, Object> metadata);

    String getAssembledFilePath();

    void setAssembledFilePath(String assembledFilePath);

    Long getAssetId();

    void setAssetId(Long assetId);

    /** {@code null} once the session reached a terminal state. */
    String getActiveSlotKey();

    void setActiveSlotKey(String activeSlotKey);

    LocalDateTime getVirusScanQueuedAt();

    void setVirusScanQueuedAt(LocalDateTime virusScanQueuedAt);

    LocalDateTime getVirusScanCompletedAt();

    void setVirusScanCompletedAt(LocalDateTime virusScanCompletedAt);

    LocalDateTime getCompletedAt();

    void setCompletedAt(LocalDateTime completedAt);

    LocalDateTime getCreatedAt();

    void setCreatedAt(LocalDateTime createdAt);

    LocalDateTime getUpdatedAt();

    void setUpdatedAt(LocalDateTime updatedAt);
}
