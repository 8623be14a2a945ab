package vn.com.fecredit.uploadpipeline.model.interfaces;

import vn.com.fecredit.uploadpipeline.model.ChunkStatus;

import java.time.LocalDateTime;

public interface IChunk {

    String getSessionId();

    void setSessionId(String sessionId);

    /** 1-based, unique within a session. */
    int getChunkNumber();

    void setChunkNumber(int chunkNumber);

    long getSize();

    void setSize(long size);

    String getChecksum();

    void setChecksum(String checksum);

    ChunkStatus getStatus();

    void setStatus(ChunkStatus status);

    String getStorageKey();

    void setStorageKey(String storageKey);

    LocalDateTime getCreatedAt();

    void setCreatedAt(LocalDateTime createdAt);

    LocalDateTime getUpdatedAt();

    void setUpdatedAt(LocalDateTime updatedAt);
}
