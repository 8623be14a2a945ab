package vn.com.fecredit.uploadpipeline.model;

import jakarta.persistence.*;
import lombok.Data;
import vn.com.fecredit.uploadpipeline.model.interfaces.IAsset;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Permanent record of a finalized upload. At most one per upload session.
 */
@Entity
@Table(name = "asset", indexes = @Index(name = "idx_asset_location", columnList = "workspace_id, container_id, filename"))
@Data
public class Asset implements IAsset {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "upload_session_id", nullable = false, unique = true, length = 36)
    private String uploadSessionId;

    @Column(name = "workspace_id", nullable = false)
    private Long workspaceId;

    @Column(name = "container_id")
    private Long containerId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false)
    private String filename;

    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Column(name = "content_type", nullable = false, length = 128)
    private String contentType;

    @Column(name = "storage_reference", nullable = false, length = 1024)
    private String storageReference;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 16384)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
