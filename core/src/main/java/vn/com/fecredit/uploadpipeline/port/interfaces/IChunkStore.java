package vn.com.fecredit.uploadpipeline.port.interfaces;

import vn.com.fecredit.uploadpipeline.exception.ChunkNotFoundException;
import vn.com.fecredit.uploadpipeline.exception.ChunkStorageException;

import java.io.InputStream;

/**
 * Storage of raw chunk bytes, addressed by keys derived from session id and chunk number.
 *
 * <p>
 * I/O failures surface as {@link ChunkStorageException}; missing keys as
 * {@link ChunkNotFoundException}.
 */
public interface IChunkStore {

    /**
     * Stores the bytes of a chunk, replacing any earlier copy. A partially written
     * chunk is never visible under the returned key.
     *
     * @return the storage key of the chunk
     */
    String store(String sessionId, int chunkNumber, InputStream data);

    boolean exists(String storageKey);

    long size(String storageKey);

    /**
     * Opens the chunk for reading. The caller closes the stream.
     */
    InputStream read(String storageKey);

    /**
     * @return {@code true} if something was deleted
     */
    boolean delete(String storageKey);

    /**
     * Removes whatever is left of the session's storage area.
     */
    void deleteSession(String sessionId);
}
