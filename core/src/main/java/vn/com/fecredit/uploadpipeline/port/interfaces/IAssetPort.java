package vn.com.fecredit.uploadpipeline.port.interfaces;

import vn.com.fecredit.uploadpipeline.model.interfaces.IAsset;

import java.util.Map;
import java.util.Optional;

/**
 * Port interface for assets. At most one asset exists per upload session.
 */
public interface IAssetPort<T extends IAsset> {

    /**
     * Creates the asset of a session. If an asset already exists for the same session,
     * the existing one is returned and {@code asset} is discarded.
     */
    T createAsset(T asset);

    Optional<T> findAssetById(Long id);

    Optional<T> findByUploadSessionId(String uploadSessionId);

    /**
     * @return {@code true} if an asset with this filename exists in the workspace and container
     */
    boolean existsByLocation(Long workspaceId, Long containerId, String filename);

    /**
     * Merges {@code extra} into the metadata of an existing asset.
     */
    T annotate(Long assetId, Map<String, Object> extra);
}
