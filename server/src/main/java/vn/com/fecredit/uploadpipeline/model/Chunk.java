package vn.com.fecredit.uploadpipeline.model;

import jakarta.persistence.*;
import lombok.Data;
import vn.com.fecredit.uploadpipeline.model.interfaces.IChunk;

import java.time.LocalDateTime;

@Entity
@Table(name = "upload_chunk", uniqueConstraints =
        @UniqueConstraint(name = "uk_upload_chunk_session_number", columnNames = {"session_id", "chunk_number"}))
@Data
public class Chunk implements IChunk {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, length = 36)
    private String sessionId;

    @Column(name = "chunk_number", nullable = false)
    private int chunkNumber;

    @Column(nullable = false)
    private long size;

    @Column(length = 64)
    private String checksum;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ChunkStatus status;

    @Column(name = "storage_key", length = 512)
    private String storageKey;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
