package vn.com.fecredit.uploadpipeline.model;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SessionEventRecordRepository extends JpaRepository<SessionEventRecord, Long> {

    List<SessionEventRecord> findBySessionIdOrderByIdAsc(String sessionId);

    @Modifying
    @Query("DELETE FROM SessionEventRecord e WHERE e.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") String sessionId);
}
