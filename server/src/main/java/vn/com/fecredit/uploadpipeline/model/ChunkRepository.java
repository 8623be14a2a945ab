package vn.com.fecredit.uploadpipeline.model;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ChunkRepository extends JpaRepository<Chunk, Long> {

    Optional<Chunk> findBySessionIdAndChunkNumber(String sessionId, int chunkNumber);

    List<Chunk> findBySessionIdOrderByChunkNumberAsc(String sessionId);

    @Modifying
    @Query("DELETE FROM Chunk c WHERE c.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") String sessionId);
}
