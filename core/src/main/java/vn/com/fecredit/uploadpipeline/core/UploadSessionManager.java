package vn.com.fecredit.uploadpipeline.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.uploadpipeline.exception.ChecksumMismatchException;
import vn.com.fecredit.uploadpipeline.exception.ChunkStorageException;
import vn.com.fecredit.uploadpipeline.exception.IncompleteUploadException;
import vn.com.fecredit.uploadpipeline.exception.InvalidSessionStateException;
import vn.com.fecredit.uploadpipeline.exception.InvalidTransitionException;
import vn.com.fecredit.uploadpipeline.manager.ChunkCompletenessManager;
import vn.com.fecredit.uploadpipeline.model.ChunkReceipt;
import vn.com.fecredit.uploadpipeline.model.ChunkStatus;
import vn.com.fecredit.uploadpipeline.model.CreateSessionRequest;
import vn.com.fecredit.uploadpipeline.model.SessionEvent;
import vn.com.fecredit.uploadpipeline.model.SessionEventType;
import vn.com.fecredit.uploadpipeline.model.SessionMetadataView;
import vn.com.fecredit.uploadpipeline.model.SessionStatusResponse;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.model.interfaces.IChunk;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;
import vn.com.fecredit.uploadpipeline.model.util.ChecksumUtil;
import vn.com.fecredit.uploadpipeline.model.util.FileNameValidator;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkStore;
import vn.com.fecredit.uploadpipeline.port.interfaces.ISessionEventPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IUploadSessionPort;

import java.io.ByteArrayInputStream;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Client-facing side of the session state machine: declaring sessions, receiving chunks,
 * completion, cancellation and status.
 */
public class UploadSessionManager<S extends IUploadSession, C extends IChunk> {

    private static final Logger log = LoggerFactory.getLogger(UploadSessionManager.class);

    private static final long MB = 1024L * 1024;
    private static final long GB = 1024L * MB;

    private static final Set<UploadStatus> CHUNK_ACCEPTING = EnumSet.of(UploadStatus.PENDING, UploadStatus.UPLOADING);
    private static final Set<UploadStatus> CANCELLABLE = EnumSet.of(UploadStatus.PENDING, UploadStatus.UPLOADING,
            UploadStatus.ASSEMBLING, UploadStatus.VIRUS_SCANNING);

    private final SessionStateMachine<S> stateMachine;
    private final IUploadSessionPort<S> sessionPort;
    private final IChunkPort<C> chunkPort;
    private final ISessionEventPort eventPort;
    private final IChunkStore chunkStore;
    private final Supplier<S> sessionFactory;
    private final Supplier<C> chunkFactory;
    private final PipelineSettings settings;

    public UploadSessionManager(SessionStateMachine<S> stateMachine, IUploadSessionPort<S> sessionPort,
                                IChunkPort<C> chunkPort, ISessionEventPort eventPort, IChunkStore chunkStore,
                                Supplier<S> sessionFactory, Supplier<C> chunkFactory, PipelineSettings settings) {
        this.stateMachine = stateMachine;
        this.sessionPort = sessionPort;
        this.chunkPort = chunkPort;
        this.eventPort = eventPort;
        this.chunkStore = chunkStore;
        this.sessionFactory = sessionFactory;
        this.chunkFactory = chunkFactory;
        this.settings = settings;
    }

    /**
     * Recommended chunk size for a file: 1 MB up to 10 MB, 5 MB below 1 GB,
     * 10 MB up to 5 GB and 25 MB beyond.
     */
    public static long recommendedChunkSize(long totalSize) {
        if (totalSize <= 10 * MB) {
            return MB;
        }
        if (totalSize < GB) {
            return 5 * MB;
        }
        if (totalSize <= 5 * GB) {
            return 10 * MB;
        }
        return 25 * MB;
    }

    public S createSession(CreateSessionRequest request) {
        validate(request);
        LocalDateTime now = stateMachine.now();
        S session = sessionFactory.get();
        session.setSessionId(UUID.randomUUID().toString());
        session.setWorkspaceId(request.getWorkspaceId());
        session.setContainerId(request.getContainerId());
        session.setUserId(request.getUserId());
        session.setFilename(request.getFilename());
        session.setTotalSize(request.getTotalSize());
        session.setChunksCount(request.getChunksCount());
        session.setMetadata(new LinkedHashMap<>(request.getMetadata()));
        session.setStatus(UploadStatus.PENDING);
        session.setActiveSlotKey(IUploadSession.slotKey(request.getWorkspaceId(), request.getContainerId(),
                request.getFilename()));
        session.setCreatedAt(now);
        session.setUpdatedAt(now);

        SessionEvent created = SessionEvent.of(session.getSessionId(), SessionEventType.CREATED, UploadStatus.PENDING,
                Map.of("chunks_count", request.getChunksCount(), "total_size", request.getTotalSize()), null, now);
        S saved = sessionPort.create(session, created);
        log.info("Created upload session {} for '{}' ({} bytes in {} chunks)", saved.getSessionId(),
                saved.getFilename(), saved.getTotalSize(), saved.getChunksCount());
        return saved;
    }

    private void validate(CreateSessionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Create session request is required");
        }
        if (request.getWorkspaceId() == null || request.getUserId() == null) {
            throw new IllegalArgumentException("workspaceId and userId are required");
        }
        String filenameError = FileNameValidator.validate(request.getFilename());
        if (filenameError != null) {
            throw new IllegalArgumentException(filenameError);
        }
        if (request.getTotalSize() <= 0) {
            throw new IllegalArgumentException("totalSize must be greater than 0");
        }
        if (request.getTotalSize() > settings.getMaxFileSize()) {
            throw new IllegalArgumentException("totalSize exceeds the maximum file size of "
                    + settings.getMaxFileSize() + " bytes");
        }
        if (request.getChunksCount() < 1) {
            throw new IllegalArgumentException("chunksCount must be at least 1");
        }
        if (request.getChunksCount() > request.getTotalSize()) {
            throw new IllegalArgumentException("chunksCount cannot exceed totalSize");
        }
    }

    /**
     * Stores one chunk and records it as completed.
     *
     * <p>
     * The first chunk moves the session from PENDING to UPLOADING. The chunk that completes
     * the set moves it to ASSEMBLING; {@link ChunkReceipt#isAssemblyTriggered()} tells the caller
     * whether this call won that move.
     */
    public ChunkReceipt uploadChunk(String sessionId, int chunkNumber, byte[] payload, String checksum) {
        S session = stateMachine.require(sessionId);
        if (!session.getStatus().acceptsChunks()) {
            throw new InvalidSessionStateException("Upload session " + sessionId + " does not accept chunks in status "
                    + session.getStatus().getValue());
        }
        if (chunkNumber < 1 || chunkNumber > session.getChunksCount()) {
            throw new IllegalArgumentException("Chunk number " + chunkNumber + " is out of range 1.."
                    + session.getChunksCount());
        }
        if (payload == null || payload.length == 0) {
            throw new IllegalArgumentException("Chunk " + chunkNumber + " has no data");
        }
        boolean hasChecksum = checksum != null && !checksum.isBlank();
        if (hasChecksum && !ChecksumUtil.matches(payload, checksum)) {
            throw new ChecksumMismatchException("Checksum mismatch for chunk " + chunkNumber + " of session " + sessionId);
        }

        String checksumValue = hasChecksum ? checksum : ChecksumUtil.generateChecksum(payload, ChecksumUtil.SHA_256);
        Optional<C> existing = chunkPort.findChunk(sessionId, chunkNumber);
        boolean alreadyCompleted = existing.isPresent() && existing.get().getStatus() == ChunkStatus.COMPLETED;

        // store first; a completed record is never downgraded
        String storageKey;
        try {
            storageKey = chunkStore.store(sessionId, chunkNumber, new ByteArrayInputStream(payload));
        } catch (ChunkStorageException e) {
            if (!alreadyCompleted) {
                C failed = existing.orElseGet(() -> newChunk(sessionId, chunkNumber));
                failed.setSize(payload.length);
                failed.setChecksum(checksumValue);
                failed.setStatus(ChunkStatus.FAILED);
                failed.setUpdatedAt(stateMachine.now());
                chunkPort.saveChunk(failed);
            }
            eventPort.append(SessionEvent.of(sessionId, SessionEventType.CHUNK_FAILED, null,
                    Map.of("chunk_number", chunkNumber), e.getMessage(), stateMachine.now()));
            log.warn("Storing chunk {} of session {} failed: {}", chunkNumber, sessionId, e.getMessage());
            throw e;
        }

        UploadStatus current = stateMachine.require(sessionId).getStatus();
        if (!current.acceptsChunks()) {
            return lateChunk(sessionId, chunkNumber, payload.length, checksumValue, storageKey, current,
                    alreadyCompleted);
        }

        C chunk = existing.orElseGet(() -> newChunk(sessionId, chunkNumber));
        chunk.setSize(payload.length);
        chunk.setChecksum(checksumValue);
        chunk.setStorageKey(storageKey);
        chunk.setStatus(ChunkStatus.COMPLETED);
        LocalDateTime now = stateMachine.now();
        chunk.setUpdatedAt(now);
        chunkPort.saveChunk(chunk);
        log.debug("Chunk {}/{} of session {} stored ({} bytes)", chunkNumber, session.getChunksCount(), sessionId,
                payload.length);

        if (current == UploadStatus.PENDING) {
            stateMachine.transition(sessionId, UploadStatus.PENDING, UploadStatus.UPLOADING,
                    SessionEventType.TRANSITION, Map.of("first_chunk", chunkNumber), null);
        }
        sessionPort.touch(sessionId, EnumSet.of(UploadStatus.UPLOADING), now);
        boolean assemblyTriggered = startAssemblyIfComplete(session);
        UploadStatus status = stateMachine.require(sessionId).getStatus();
        return new ChunkReceipt(sessionId, chunkNumber, payload.length, checksumValue, status, assemblyTriggered);
    }

    /**
     * The session stopped accepting chunks while the bytes were being written. A retry of a chunk
     * that is already recorded is acknowledged; anything else is refused.
     */
    private ChunkReceipt lateChunk(String sessionId, int chunkNumber, int size, String checksum, String storageKey,
                                   UploadStatus current, boolean alreadyCompleted) {
        if (current == UploadStatus.CANCELLED || current.isFailure() || current == UploadStatus.COMPLETED) {
            chunkStore.deleteSession(sessionId);
        } else if (current != UploadStatus.ASSEMBLING) {
            // assembly has consumed the chunks already
            chunkStore.delete(storageKey);
        }
        if (alreadyCompleted && current != UploadStatus.CANCELLED && !current.isFailure()) {
            log.debug("Chunk {} of session {} arrived again in status {}", chunkNumber, sessionId, current.getValue());
            return new ChunkReceipt(sessionId, chunkNumber, size, checksum, current, false);
        }
        throw new InvalidSessionStateException("Upload session " + sessionId + " does not accept chunks in status "
                + current.getValue());
    }

    private C newChunk(String sessionId, int chunkNumber) {
        C fresh = chunkFactory.get();
        fresh.setSessionId(sessionId);
        fresh.setChunkNumber(chunkNumber);
        fresh.setCreatedAt(stateMachine.now());
        return fresh;
    }

    /**
     * Explicit completion signal from the client.
     *
     * @return {@code true} if this call moved the session to ASSEMBLING; {@code false} if the
     * session was already past that point
     * @throws IncompleteUploadException if chunks are missing
     */
    public boolean completeUpload(String sessionId) {
        S session = stateMachine.require(sessionId);
        UploadStatus status = session.getStatus();
        if (status == UploadStatus.ASSEMBLING || status == UploadStatus.VIRUS_SCANNING
                || status == UploadStatus.FINALIZING || status == UploadStatus.COMPLETED) {
            return false;
        }
        if (!status.acceptsChunks()) {
            throw new InvalidSessionStateException("Upload session " + sessionId + " cannot be completed in status "
                    + status.getValue());
        }
        ChunkCompletenessManager.Completeness completeness =
                ChunkCompletenessManager.evaluate(session.getChunksCount(), chunkPort.findChunks(sessionId));
        if (!completeness.isComplete()) {
            throw new IncompleteUploadException(sessionId, completeness.getMissingChunks());
        }
        return startAssemblyIfComplete(session);
    }

    private boolean startAssemblyIfComplete(S session) {
        List<C> chunks = chunkPort.findChunks(session.getSessionId());
        ChunkCompletenessManager.Completeness completeness =
                ChunkCompletenessManager.evaluate(session.getChunksCount(), chunks);
        if (!completeness.isComplete()) {
            return false;
        }
        return stateMachine.transition(session.getSessionId(), CHUNK_ACCEPTING, UploadStatus.ASSEMBLING,
                SessionEventType.TRANSITION, Map.of("completed_chunks", completeness.getCompletedChunks()), null, null);
    }

    public S cancel(String sessionId) {
        S session = stateMachine.require(sessionId);
        boolean cancelled = stateMachine.transition(sessionId, CANCELLABLE, UploadStatus.CANCELLED,
                SessionEventType.TRANSITION, Map.of("cancelled_from", session.getStatus().getValue()), null, null);
        S current = stateMachine.require(sessionId);
        if (!cancelled && current.getStatus() != UploadStatus.CANCELLED) {
            throw new InvalidTransitionException(current.getStatus(), UploadStatus.CANCELLED);
        }
        return current;
    }

    public SessionStatusResponse getStatus(String sessionId) {
        S session = stateMachine.require(sessionId);
        ChunkCompletenessManager.Completeness completeness =
                ChunkCompletenessManager.evaluate(session.getChunksCount(), chunkPort.findChunks(sessionId));
        SessionMetadataView view = SessionMetadataView.fold(session.getMetadata(), eventPort.findEvents(sessionId));

        SessionStatusResponse response = new SessionStatusResponse();
        response.setSessionId(session.getSessionId());
        response.setFilename(session.getFilename());
        response.setStatus(session.getStatus().getValue());
        response.setTotalSize(session.getTotalSize());
        response.setChunksCount(session.getChunksCount());
        response.setRecommendedChunkSize(recommendedChunkSize(session.getTotalSize()));
        response.setMetadata(view.asMap());
        if (session.getStatus().isFailure()) {
            response.setErrorMessage(view.getErrorMessage());
        }
        if (isPastUpload(session.getStatus())) {
            // chunk records are consumed by assembly
            response.setCompletedChunks(session.getChunksCount());
            response.setProgressPercentage(100.0);
            response.setUploadedSize(session.getTotalSize());
        } else {
            response.setCompletedChunks(completeness.getCompletedChunks());
            response.setProgressPercentage(completeness.getProgressPercentage());
            response.setUploadedSize(completeness.getUploadedSize());
            response.setMissingChunks(completeness.getMissingChunks());
        }
        return response;
    }

    private boolean isPastUpload(UploadStatus status) {
        return status == UploadStatus.VIRUS_SCANNING || status == UploadStatus.FINALIZING
                || status == UploadStatus.COMPLETED || status == UploadStatus.VIRUS_SCAN_FAILED
                || status == UploadStatus.FINALIZATION_FAILED;
    }
}
