package vn.com.fecredit.uploadpipeline.model;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for UploadSessionHistory entity.
 */
@Repository
public interface UploadSessionHistoryRepository extends JpaRepository<UploadSessionHistory, Long> {

    Optional<UploadSessionHistory> findBySessionId(String sessionId);

    /**
     * Find history records by outcome.
     *
     * @param outcome The outcome to filter by
     * @return List of history records with the specified outcome
     */
    List<UploadSessionHistory> findByOutcome(SessionOutcome outcome);
}
