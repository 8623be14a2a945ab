package vn.com.fecredit.uploadpipeline.model.impl;

import lombok.Data;
import vn.com.fecredit.uploadpipeline.model.ChunkStatus;
import vn.com.fecredit.uploadpipeline.model.interfaces.IChunk;

import java.time.LocalDateTime;

@Data
public class DefaultChunk implements IChunk {

    private String sessionId;
    private int chunkNumber;
    private long size;
    private String checksum;
    private ChunkStatus status;
    private String storageKey;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
