package vn.com.fecredit.uploadpipeline.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Result of storing one chunk.
 */
@Getter
@ToString
public final class ChunkReceipt {

    private final String sessionId;
    private final int chunkNumber;
    private final long size;
    private final String checksum;
    /** Session status after the chunk was recorded. */
    private final UploadStatus sessionStatus;
    /** {@code true} when this chunk completed the set and won the move to assembling. */
    private final boolean assemblyTriggered;

    public ChunkReceipt(String sessionId, int chunkNumber, long size, String checksum,
                        UploadStatus sessionStatus, boolean assemblyTriggered) {
        this.sessionId = sessionId;
        this.chunkNumber = chunkNumber;
        this.size = size;
        this.checksum = checksum;
        this.sessionStatus = sessionStatus;
        this.assemblyTriggered = assemblyTriggered;
    }
}
