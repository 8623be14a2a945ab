package vn.com.fecredit.uploadpipeline.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request object for declaring a new chunked upload session.
 *
 * <p>
 * Contains all necessary information to:
 * <ul>
 * <li>Place the upload in a workspace and optional container</li>
 * <li>Attribute the upload to a user</li>
 * <li>Declare the size and chunk layout of the file</li>
 * </ul>
 */
public class CreateSessionRequest {

    /**
     * Workspace the uploaded file will belong to.
     */
    @NotNull
    private Long workspaceId;

    /**
     * Optional container (folder) inside the workspace. {@code null} means the workspace root.
     */
    private Long containerId;

    /**
     * User performing the upload.
     */
    @NotNull
    private Long userId;

    /**
     * Target filename. Required, at most 255 characters.
     */
    @NotBlank
    @Size(max = 255)
    private String filename;

    /**
     * Declared total size of the file in bytes. Must be greater than 0.
     */
    @Positive
    private long totalSize;

    /**
     * Declared number of chunks the file is split into. Must be greater than 0.
     */
    @Positive
    private int chunksCount;

    /**
     * Free-form client metadata (client info, original path, upload source, ...).
     */
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public CreateSessionRequest() {
    }

    public CreateSessionRequest(Long workspaceId, Long containerId, Long userId, String filename, long totalSize, int chunksCount) {
        this.workspaceId = workspaceId;
        this.containerId = containerId;
        this.userId = userId;
        this.filename = filename;
        this.totalSize = totalSize;
        this.chunksCount = chunksCount;
    }

    public Long getWorkspaceId() {
        return workspaceId;
    }

    public void setWorkspaceId(Long workspaceId) {
        this.workspaceId = workspaceId;
    }

    public Long getContainerId() {
        return containerId;
    }

    public void setContainerId(Long containerId) {
        this.containerId = containerId;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public long getTotalSize() {
        return totalSize;
    }

    public void setTotalSize(long totalSize) {
        this.totalSize = totalSize;
    }

    public int getChunksCount() {
        return chunksCount;
    }

    public void setChunksCount(int chunksCount) {
        this.chunksCount = chunksCount;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? metadata : new LinkedHashMap<>();
    }
}
