package vn.com.fecredit.uploadpipeline.model;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AssetRepository extends JpaRepository<Asset, Long> {

    Optional<Asset> findByUploadSessionId(String uploadSessionId);

    /**
     * Number of assets with this filename in the workspace root ({@code containerId} null)
     * or in the given container.
     */
    @Query("SELECT COUNT(a) FROM Asset a WHERE a.workspaceId = :workspaceId AND a.filename = :filename "
            + "AND ((:containerId IS NULL AND a.containerId IS NULL) OR a.containerId = :containerId)")
    long countByLocation(@Param("workspaceId") Long workspaceId, @Param("containerId") Long containerId,
                         @Param("filename") String filename);
}
