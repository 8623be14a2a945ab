package vn.com.fecredit.uploadpipeline.port.jpa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import vn.com.fecredit.uploadpipeline.model.Asset;
import vn.com.fecredit.uploadpipeline.model.AssetRepository;
import vn.com.fecredit.uploadpipeline.port.interfaces.IAssetPort;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Component
public class JpaAssetPort implements IAssetPort<Asset> {

    private static final Logger log = LoggerFactory.getLogger(JpaAssetPort.class);

    private final AssetRepository repository;

    public JpaAssetPort(AssetRepository repository) {
        this.repository = repository;
    }

    /**
     * Inserts the asset, or returns the one another finalization already created for the session.
     */
    @Override
    public Asset createAsset(Asset asset) {
        try {
            return repository.saveAndFlush(asset);
        } catch (DataIntegrityViolationException e) {
            Asset existing = repository.findByUploadSessionId(asset.getUploadSessionId()).orElseThrow(() -> e);
            log.info("Asset for session {} already exists as {}", asset.getUploadSessionId(), existing.getId());
            return existing;
        }
    }

    @Override
    public Optional<Asset> findAssetById(Long id) {
        return repository.findById(id);
    }

    @Override
    public Optional<Asset> findByUploadSessionId(String uploadSessionId) {
        return repository.findByUploadSessionId(uploadSessionId);
    }

    @Override
    public boolean existsByLocation(Long workspaceId, Long containerId, String filename) {
        return repository.countByLocation(workspaceId, containerId, filename) > 0;
    }

    @Override
    @Transactional
    public Asset annotate(Long assetId, Map<String, Object> extra) {
        Asset asset = repository.findById(assetId)
                .orElseThrow(() -> new IllegalArgumentException("Asset not found: " + assetId));
        Map<String, Object> metadata = new LinkedHashMap<>(asset.getMetadata());
        metadata.putAll(extra);
        asset.setMetadata(metadata);
        return repository.save(asset);
    }
}
