package vn.com.fecredit.uploadpipeline.port.impl;

import vn.com.fecredit.uploadpipeline.model.impl.DefaultChunk;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Default in-memory implementation of IChunkPort.
 */
public class DefaultChunkPort implements IChunkPort<DefaultChunk> {

    private final Map<String, ConcurrentSkipListMap<Integer, DefaultChunk>> chunksBySession = new ConcurrentHashMap<>();

    @Override
    public DefaultChunk saveChunk(DefaultChunk chunk) {
        if (chunk == null || chunk.getSessionId() == null) {
            throw new IllegalArgumentException("Chunk or sessionId cannot be null");
        }
        chunksBySession.computeIfAbsent(chunk.getSessionId(), k -> new ConcurrentSkipListMap<>())
                .put(chunk.getChunkNumber(), chunk);
        return chunk;
    }

    @Override
    public Optional<DefaultChunk> findChunk(String sessionId, int chunkNumber) {
        Map<Integer, DefaultChunk> chunks = chunksBySession.get(sessionId);
        return Optional.ofNullable(chunks != null ? chunks.get(chunkNumber) : null);
    }

    @Override
    public List<DefaultChunk> findChunks(String sessionId) {
        ConcurrentSkipListMap<Integer, DefaultChunk> chunks = chunksBySession.get(sessionId);
        return chunks != null ? new ArrayList<>(chunks.values()) : new ArrayList<>();
    }

    @Override
    public void deleteChunks(String sessionId) {
        chunksBySession.remove(sessionId);
    }
}
