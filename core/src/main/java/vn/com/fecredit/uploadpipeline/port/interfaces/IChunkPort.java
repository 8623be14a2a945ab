package vn.com.fecredit.uploadpipeline.port.interfaces;

import vn.com.fecredit.uploadpipeline.model.interfaces.IChunk;

import java.util.List;
import java.util.Optional;

/**
 * Port interface for chunk records. (sessionId, chunkNumber) is unique.
 */
public interface IChunkPort<T extends IChunk> {

    /**
     * Inserts or updates the chunk identified by its session id and chunk number.
     * A concurrent insert of the same chunk resolves to an update of the existing record.
     */
    T saveChunk(T chunk);

    Optional<T> findChunk(String sessionId, int chunkNumber);

    /**
     * @return all chunk records of the session ordered by chunk number
     */
    List<T> findChunks(String sessionId);

    void deleteChunks(String sessionId);
}
