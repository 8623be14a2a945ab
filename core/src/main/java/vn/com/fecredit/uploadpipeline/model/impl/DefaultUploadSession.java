package vn.com.fecredit.uploadpipeline.model.impl;

import lombok.Data;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class DefaultUploadSession implements IUploadSession {

    private Long id;
    private String sessionId;
    private Long workspaceId;
    private Long containerId;
    private Long userId;
    private String filename;
    private long totalSize;
    private int chunksCount;
    private UploadStatus status;
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private String assembledFilePath;
    private Long assetId;
    private String activeSlotKey;
    private LocalDateTime virusScanQueuedAt;
    private LocalDateTime virusScanCompletedAt;
    private LocalDateTime completedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
