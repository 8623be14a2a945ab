package vn.com.fecredit.uploadpipeline.port.jpa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import vn.com.fecredit.uploadpipeline.model.Chunk;
import vn.com.fecredit.uploadpipeline.model.ChunkRepository;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkPort;

import java.util.List;
import java.util.Optional;

/**
 * Chunk records on the {@code upload_chunk} table, unique per (session, chunk number).
 */
@Component
public class JpaChunkPort implements IChunkPort<Chunk> {

    private static final Logger log = LoggerFactory.getLogger(JpaChunkPort.class);

    private final ChunkRepository repository;

    public JpaChunkPort(ChunkRepository repository) {
        this.repository = repository;
    }

    /**
     * Upsert by (session, chunk number). A concurrent insert of the same number loses the
     * unique-constraint race and is applied to the winning row instead.
     */
    @Override
    public Chunk saveChunk(Chunk chunk) {
        try {
            return repository.saveAndFlush(chunk);
        } catch (DataIntegrityViolationException e) {
            Chunk existing = repository.findBySessionIdAndChunkNumber(chunk.getSessionId(), chunk.getChunkNumber())
                    .orElseThrow(() -> e);
            log.debug("Chunk {} of session {} inserted concurrently, updating row {}", chunk.getChunkNumber(),
                    chunk.getSessionId(), existing.getId());
            existing.setSize(chunk.getSize());
            existing.setChecksum(chunk.getChecksum());
            existing.setStatus(chunk.getStatus());
            existing.setStorageKey(chunk.getStorageKey());
            existing.setUpdatedAt(chunk.getUpdatedAt());
            Chunk saved = repository.saveAndFlush(existing);
            chunk.setId(saved.getId());
            return saved;
        }
    }

    @Override
    public Optional<Chunk> findChunk(String sessionId, int chunkNumber) {
        return repository.findBySessionIdAndChunkNumber(sessionId, chunkNumber);
    }

    @Override
    public List<Chunk> findChunks(String sessionId) {
        return repository.findBySessionIdOrderByChunkNumberAsc(sessionId);
    }

    @Override
    @Transactional
    public void deleteChunks(String sessionId) {
        repository.deleteBySessionId(sessionId);
    }
}
