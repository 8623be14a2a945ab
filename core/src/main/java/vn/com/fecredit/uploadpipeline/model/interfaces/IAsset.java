package vn.com.fecredit.uploadpipeline.model.interfaces;

import java.time.LocalDateTime;
import java.util.Map;

public interface IAsset {

    Long getId();

    void setId(Long id);

    /** Originating session; at most one asset exists per session. */
    String getUploadSessionId();

    void setUploadSessionId(String uploadSessionId);

    Long getWorkspaceId();

    void setWorkspaceId(Long workspaceId);

    Long getContainerId();

    void setContainerId(Long containerId);

    Long getUserId();

    void setUserId(Long userId);

    String getFilename();

    void setFilename(String filename);

    long getFileSize();

    void setFileSize(long fileSize);

    String getContentType();

    void setContentType(String contentType);

    String getStorageReference();

    void setStorageReference(String storageReference);

    Map<String, Object> getMetadata();

    void setMetadata(Map<String, Object> metadata);

    LocalDateTime getCreatedAt();

    void setCreatedAt(LocalDateTime createdAt);
}
