package vn.com.fecredit.uploadpipeline.model.impl;

import lombok.Data;
import vn.com.fecredit.uploadpipeline.model.interfaces.IAsset;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class DefaultAsset implements IAsset {

    private Long id;
    private String uploadSessionId;
    private Long workspaceId;
    private Long containerId;
    private Long userId;
    private String filename;
    private long fileSize;
    private String contentType;
    private String storageReference;
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private LocalDateTime createdAt;
}
