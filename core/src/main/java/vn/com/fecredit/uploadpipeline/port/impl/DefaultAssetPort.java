package vn.com.fecredit.uploadpipeline.port.impl;

import vn.com.fecredit.uploadpipeline.model.impl.DefaultAsset;
import vn.com.fecredit.uploadpipeline.port.interfaces.IAssetPort;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default in-memory implementation of IAssetPort.
 */
public class DefaultAssetPort implements IAssetPort<DefaultAsset> {

    private final Map<String, DefaultAsset> assetsBySession = new ConcurrentHashMap<>();
    private final Map<Long, DefaultAsset> assetsById = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public DefaultAsset createAsset(DefaultAsset asset) {
        if (asset == null || asset.getUploadSessionId() == null) {
            throw new IllegalArgumentException("Asset or uploadSessionId cannot be null");
        }
        DefaultAsset existing = assetsBySession.putIfAbsent(asset.getUploadSessionId(), asset);
        if (existing != null) {
            return existing;
        }
        asset.setId(ids.incrementAndGet());
        assetsById.put(asset.getId(), asset);
        return asset;
    }

    @Override
    public Optional<DefaultAsset> findAssetById(Long id) {
        return Optional.ofNullable(id != null ? assetsById.get(id) : null);
    }

    @Override
    public Optional<DefaultAsset> findByUploadSessionId(String uploadSessionId) {
        return Optional.ofNullable(uploadSessionId != null ? assetsBySession.get(uploadSessionId) : null);
    }

    @Override
    public boolean existsByLocation(Long workspaceId, Long containerId, String filename) {
        return assetsById.values().stream().anyMatch(a -> Objects.equals(a.getWorkspaceId(), workspaceId)
                && Objects.equals(a.getContainerId(), containerId)
                && Objects.equals(a.getFilename(), filename));
    }

    @Override
    public DefaultAsset annotate(Long assetId, Map<String, Object> extra) {
        DefaultAsset asset = findAssetById(assetId)
                .orElseThrow(() -> new IllegalArgumentException("Asset not found: " + assetId));
        synchronized (asset) {
            Map<String, Object> metadata = new LinkedHashMap<>(asset.getMetadata());
            metadata.putAll(extra);
            asset.setMetadata(metadata);
        }
        return asset;
    }
}
