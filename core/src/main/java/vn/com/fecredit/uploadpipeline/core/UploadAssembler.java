package vn.com.fecredit.uploadpipeline.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.uploadpipeline.exception.AssemblyException;
import vn.com.fecredit.uploadpipeline.exception.ChunkNotFoundException;
import vn.com.fecredit.uploadpipeline.exception.ChunkStorageException;
import vn.com.fecredit.uploadpipeline.manager.ChunkCompletenessManager;
import vn.com.fecredit.uploadpipeline.model.AssembledFile;
import vn.com.fecredit.uploadpipeline.model.ContentTypes;
import vn.com.fecredit.uploadpipeline.model.SessionEventType;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.model.interfaces.IChunk;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;
import vn.com.fecredit.uploadpipeline.port.interfaces.IAssetPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Concatenates the chunks of a session into one temp file and hands the session to scanning.
 */
public class UploadAssembler<S extends IUploadSession, C extends IChunk> {

    private static final Logger log = LoggerFactory.getLogger(UploadAssembler.class);

    private final SessionStateMachine<S> stateMachine;
    private final IChunkPort<C> chunkPort;
    private final IAssetPort<?> assetPort;
    private final IChunkStore chunkStore;
    private final Path assemblyDir;
    private final SecureRandom random = new SecureRandom();

    public UploadAssembler(SessionStateMachine<S> stateMachine, IChunkPort<C> chunkPort, IAssetPort<?> assetPort,
                           IChunkStore chunkStore, Path assemblyDir) throws IOException {
        this.stateMachine = stateMachine;
        this.chunkPort = chunkPort;
        this.assetPort = assetPort;
        this.chunkStore = chunkStore;
        this.assemblyDir = assemblyDir;
        Files.createDirectories(assemblyDir);
    }

    public boolean canAssemble(S session) {
        if (session == null || session.getStatus() != UploadStatus.ASSEMBLING) {
            return false;
        }
        return ChunkCompletenessManager.evaluate(session.getChunksCount(),
                chunkPort.findChunks(session.getSessionId())).isComplete();
    }

    /**
     * Assembles the session's chunks and commits ASSEMBLING → VIRUS_SCANNING.
     *
     * @return the assembled file, or empty if the session is no longer assembling
     * (cancelled, or another attempt already committed)
     * @throws AssemblyException    if the chunk set cannot produce the declared file
     * @throws ChunkStorageException if writing the temp file failed
     */
    public Optional<AssembledFile> assemble(String sessionId) {
        S session = stateMachine.require(sessionId);
        if (session.getStatus() != UploadStatus.ASSEMBLING) {
            log.info("Skipping assembly of session {} in status {}", sessionId, session.getStatus());
            return Optional.empty();
        }
        List<C> chunks = chunkPort.findChunks(sessionId);
        verifyChunks(session, chunks);
        if (assetPort.existsByLocation(session.getWorkspaceId(), session.getContainerId(), session.getFilename())) {
            throw new AssemblyException("File '" + session.getFilename() + "' already exists in this location");
        }

        Path assembled = assemblyDir.resolve(tempFileName(session));
        long size = writeAssembledFile(session, chunks, assembled);

        Map<String, Object> scanQueued = new LinkedHashMap<>();
        scanQueued.put("status", "queued");
        scanQueued.put("queued_at", stateMachine.now().toString());
        boolean committed = stateMachine.transition(sessionId, Set.of(UploadStatus.ASSEMBLING),
                UploadStatus.VIRUS_SCANNING, SessionEventType.VIRUS_SCAN, scanQueued, null,
                s -> s.setAssembledFilePath(assembled.toString()));
        if (!committed) {
            log.info("Assembly of session {} lost the commit; discarding {}", sessionId, assembled);
            deleteQuietly(assembled);
            return Optional.empty();
        }
        releaseChunks(sessionId, chunks);
        log.info("Assembled session {} into {} ({} bytes)", sessionId, assembled, size);
        return Optional.of(new AssembledFile(sessionId, assembled, size));
    }

    private void verifyChunks(S session, List<C> chunks) {
        ChunkCompletenessManager.Completeness completeness =
                ChunkCompletenessManager.evaluate(session.getChunksCount(), chunks);
        if (!completeness.isComplete()) {
            throw new AssemblyException("Upload incomplete: missing chunks " + completeness.getMissingChunks()
                    + ", duplicate chunks " + completeness.getDuplicateChunks());
        }
        for (C chunk : chunks) {
            String key = chunk.getStorageKey();
            if (key == null || !chunkStore.exists(key)) {
                throw new AssemblyException("Chunk file missing for chunk " + chunk.getChunkNumber());
            }
            long stored = chunkStore.size(key);
            if (stored != chunk.getSize()) {
                throw new AssemblyException("Chunk " + chunk.getChunkNumber() + " size mismatch: expected "
                        + chunk.getSize() + ", stored " + stored);
            }
        }
    }

    private String tempFileName(S session) {
        byte[] suffix = new byte[8];
        random.nextBytes(suffix);
        String extension = ContentTypes.extensionOf(session.getFilename());
        return "assembled_" + session.getSessionId() + "_" + HexFormat.of().formatHex(suffix)
                + (extension.isEmpty() ? "" : "." + extension);
    }

    private long writeAssembledFile(S session, List<C> chunks, Path assembled) {
        try {
            try (OutputStream out = Files.newOutputStream(assembled, StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE)) {
                for (C chunk : chunks) {
                    try (InputStream in = chunkStore.read(chunk.getStorageKey())) {
                        in.transferTo(out);
                    }
                }
            }
            long size = Files.size(assembled);
            if (size != session.getTotalSize()) {
                throw new AssemblyException("Assembled file size mismatch: expected " + session.getTotalSize()
                        + " bytes, got " + size);
            }
            return size;
        } catch (ChunkNotFoundException e) {
            deleteQuietly(assembled);
            throw new AssemblyException("Chunk became unreadable during assembly: " + e.getMessage(), e);
        } catch (IOException e) {
            deleteQuietly(assembled);
            throw new ChunkStorageException("Failed to write assembled file for session " + session.getSessionId(), e);
        } catch (RuntimeException e) {
            deleteQuietly(assembled);
            throw e;
        }
    }

    private void releaseChunks(String sessionId, List<C> chunks) {
        try {
            for (C chunk : chunks) {
                chunkStore.delete(chunk.getStorageKey());
            }
            chunkStore.deleteSession(sessionId);
            chunkPort.deleteChunks(sessionId);
        } catch (RuntimeException e) {
            log.warn("Could not release chunks of assembled session {}; the sweeper will retry: {}",
                    sessionId, e.getMessage());
        }
    }

    static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
