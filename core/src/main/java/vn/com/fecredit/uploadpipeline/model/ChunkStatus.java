package vn.com.fecredit.uploadpipeline.model;

public enum ChunkStatus {
    PENDING,
    COMPLETED,
    FAILED
}
