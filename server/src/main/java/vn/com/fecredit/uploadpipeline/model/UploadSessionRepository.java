package vn.com.fecredit.uploadpipeline.model;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface UploadSessionRepository extends JpaRepository<UploadSession, Long> {

    Optional<UploadSession> findBySessionId(String sessionId);

    /**
     * Conditional status update; the row only changes if it is still in {@code expected}.
     *
     * @return number of rows updated, 0 or 1
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE UploadSession s SET s.status = :target WHERE s.sessionId = :sessionId AND s.status = :expected")
    int compareAndSetStatus(@Param("sessionId") String sessionId, @Param("expected") UploadStatus expected,
                            @Param("target") UploadStatus target);

    /**
     * Bumps {@code updatedAt} while the session is still in one of {@code statuses}.
     *
     * @return number of rows updated, 0 or 1
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE UploadSession s SET s.updatedAt = :at WHERE s.sessionId = :sessionId AND s.status IN :statuses")
    int touch(@Param("sessionId") String sessionId, @Param("statuses") Collection<UploadStatus> statuses,
              @Param("at") LocalDateTime at);

    /**
     * Keyset page of sessions in the given statuses created before {@code cutoff}.
     */
    @Query("SELECT s FROM UploadSession s WHERE s.status IN :statuses AND s.createdAt < :cutoff AND s.id > :afterId "
            + "ORDER BY s.id")
    List<UploadSession> findCreatedBefore(@Param("statuses") Collection<UploadStatus> statuses,
                                          @Param("cutoff") LocalDateTime cutoff, @Param("afterId") long afterId,
                                          Pageable page);

    /**
     * Keyset page of sessions in the given statuses not updated since {@code cutoff}.
     */
    @Query("SELECT s FROM UploadSession s WHERE s.status IN :statuses AND s.updatedAt < :cutoff AND s.id > :afterId "
            + "ORDER BY s.id")
    List<UploadSession> findUpdatedBefore(@Param("statuses") Collection<UploadStatus> statuses,
                                          @Param("cutoff") LocalDateTime cutoff, @Param("afterId") long afterId,
                                          Pageable page);
}
