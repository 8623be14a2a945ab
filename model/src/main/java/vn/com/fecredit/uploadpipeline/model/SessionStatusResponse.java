package vn.com.fecredit.uploadpipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of an upload session returned to callers polling for progress.
 *
 * <p>
 * This class encapsulates:
 * <ul>
 * <li>The committed lifecycle status of the session</li>
 * <li>Chunk progress (percentage, completed count, missing chunk numbers)</li>
 * <li>The failure reason, when the session ended in a failure state</li>
 * <li>The metadata view folded from the session's event log</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionStatusResponse {

    /** Opaque upload session identifier. */
    private String sessionId;
    /** Target filename. */
    private String filename;
    /** Wire value of the session status, e.g. {@code virus_scanning}. */
    private String status;
    /** Declared total size in bytes. */
    private long totalSize;
    /** Declared number of chunks. */
    private int chunksCount;
    /** Number of chunks stored and verified. */
    private int completedChunks;
    /** {@code completedChunks / chunksCount * 100}, rounded to two decimals. */
    private double progressPercentage;
    /** Sum of the sizes of completed chunks. */
    private long uploadedSize;
    /** Chunk size the server recommends for a file of this size. */
    private long recommendedChunkSize;
    /** 1-based chunk numbers not yet completed. */
    private List<Integer> missingChunks = Collections.emptyList();

    /** Human-readable failure reason; only present for failed sessions. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String errorMessage;

    /** Metadata view (virus_scan, finalization, client metadata). */
    private Map<String, Object> metadata = Collections.emptyMap();

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
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

    public int getCompletedChunks() {
        return completedChunks;
    }

    public void setCompletedChunks(int completedChunks) {
        this.completedChunks = completedChunks;
    }

    public double getProgressPercentage() {
        return progressPercentage;
    }

    public void setProgressPercentage(double progressPercentage) {
        this.progressPercentage = progressPercentage;
    }

    public long getUploadedSize() {
        return uploadedSize;
    }

    public void setUploadedSize(long uploadedSize) {
        this.uploadedSize = uploadedSize;
    }

    public long getRecommendedChunkSize() {
        return recommendedChunkSize;
    }

    public void setRecommendedChunkSize(long recommendedChunkSize) {
        this.recommendedChunkSize = recommendedChunkSize;
    }

    public List<Integer> getMissingChunks() {
        return missingChunks;
    }

    public void setMissingChunks(List<Integer> missingChunks) {
        this.missingChunks = missingChunks;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }
}
