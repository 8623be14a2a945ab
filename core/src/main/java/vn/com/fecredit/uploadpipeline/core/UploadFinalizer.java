package vn.com.fecredit.uploadpipeline.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.uploadpipeline.exception.DurableStorageException;
import vn.com.fecredit.uploadpipeline.exception.FinalizationException;
import vn.com.fecredit.uploadpipeline.model.ContentTypes;
import vn.com.fecredit.uploadpipeline.model.SessionEventType;
import vn.com.fecredit.uploadpipeline.model.SessionMetadataView;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.model.interfaces.IAsset;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;
import vn.com.fecredit.uploadpipeline.port.interfaces.IAssetPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IDurableStorage;
import vn.com.fecredit.uploadpipeline.port.interfaces.ISessionEventPort;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Promotes a scanned upload to a permanent asset. Idempotent per session.
 */
public class UploadFinalizer<S extends IUploadSession, A extends IAsset> {

    private static final Logger log = LoggerFactory.getLogger(UploadFinalizer.class);

    private final SessionStateMachine<S> stateMachine;
    private final IAssetPort<A> assetPort;
    private final ISessionEventPort eventPort;
    private final IDurableStorage durableStorage;
    private final Supplier<A> assetFactory;

    public UploadFinalizer(SessionStateMachine<S> stateMachine, IAssetPort<A> assetPort, ISessionEventPort eventPort,
                           IDurableStorage durableStorage, Supplier<A> assetFactory) {
        this.stateMachine = stateMachine;
        this.assetPort = assetPort;
        this.eventPort = eventPort;
        this.durableStorage = durableStorage;
        this.assetFactory = assetFactory;
    }

    /**
     * Creates the asset of a FINALIZING session and commits COMPLETED.
     *
     * @return the asset, or empty when the session was cancelled
     * @throws FinalizationException if the session is not finalizable or its assembled file is gone
     */
    public Optional<A> finalizeUpload(String sessionId) {
        S session = stateMachine.require(sessionId);
        Optional<A> existing = assetPort.findByUploadSessionId(sessionId);
        UploadStatus status = session.getStatus();

        if (status == UploadStatus.COMPLETED) {
            if (existing.isPresent()) {
                return existing;
            }
            throw new FinalizationException("Session " + sessionId + " is completed but has no asset");
        }
        if (status == UploadStatus.CANCELLED) {
            log.info("Skipping finalization of cancelled session {}", sessionId);
            return Optional.empty();
        }
        if (status != UploadStatus.FINALIZING) {
            throw new FinalizationException("Session " + sessionId + " is not ready for finalization: status "
                    + status.getValue());
        }
        if (existing.isPresent()) {
            log.info("Asset {} already exists for session {}, completing", existing.get().getId(), sessionId);
            complete(session, existing.get());
            return existing;
        }

        Path assembled = session.getAssembledFilePath() != null ? Paths.get(session.getAssembledFilePath()) : null;
        if (assembled == null || !Files.isRegularFile(assembled)) {
            throw new FinalizationException("Assembled file not found for session " + sessionId);
        }

        String contentType = ContentTypes.forFilename(session.getFilename());
        long size;
        String reference;
        try (InputStream in = Files.newInputStream(assembled)) {
            size = Files.size(assembled);
            reference = durableStorage.attach(in, size, session.getFilename(), contentType);
        } catch (IOException e) {
            throw new DurableStorageException("Failed to read assembled file of session " + sessionId, e);
        }

        A asset = assetFactory.get();
        asset.setUploadSessionId(sessionId);
        asset.setWorkspaceId(session.getWorkspaceId());
        asset.setContainerId(session.getContainerId());
        asset.setUserId(session.getUserId());
        asset.setFilename(session.getFilename());
        asset.setFileSize(size);
        asset.setContentType(contentType);
        asset.setStorageReference(reference);
        asset.setMetadata(assetMetadata(session));
        asset.setCreatedAt(stateMachine.now());
        A saved = assetPort.createAsset(asset);

        complete(session, saved);
        UploadAssembler.deleteQuietly(assembled);
        log.info("Finalized session {} as asset {} ({} bytes, {})", sessionId, saved.getId(), size, contentType);
        return Optional.of(saved);
    }

    /**
     * Completes a FINALIZING session whose asset was already created.
     *
     * @return {@code true} if the session is COMPLETED afterwards
     */
    public boolean completeIfAssetExists(String sessionId) {
        Optional<A> existing = assetPort.findByUploadSessionId(sessionId);
        if (existing.isEmpty()) {
            return false;
        }
        S session = stateMachine.require(sessionId);
        if (session.getStatus() == UploadStatus.FINALIZING) {
            complete(session, existing.get());
        }
        if (stateMachine.require(sessionId).getStatus() != UploadStatus.COMPLETED) {
            return false;
        }
        if (session.getAssembledFilePath() != null) {
            UploadAssembler.deleteQuietly(Paths.get(session.getAssembledFilePath()));
        }
        return true;
    }

    private void complete(S session, A asset) {
        Map<String, Object> finalization = new LinkedHashMap<>();
        finalization.put("asset_id", asset.getId());
        finalization.put("asset_filename", asset.getFilename());
        finalization.put("finalized_at", stateMachine.now().toString());
        finalization.put("file_size", asset.getFileSize());
        boolean committed = stateMachine.transition(session.getSessionId(), Set.of(UploadStatus.FINALIZING),
                UploadStatus.COMPLETED, SessionEventType.FINALIZATION, finalization, null,
                s -> s.setAssetId(asset.getId()));
        if (!committed) {
            UploadStatus now = stateMachine.require(session.getSessionId()).getStatus();
            if (now != UploadStatus.COMPLETED) {
                log.warn("Asset {} was created but session {} moved to {} before completion",
                        asset.getId(), session.getSessionId(), now);
            }
        }
    }

    /**
     * Terminal failure of the finalization stage: FINALIZING → FINALIZATION_FAILED.
     * The recorded scan verdict is left as it is.
     */
    public void markFailed(String sessionId, RuntimeException error) {
        Map<String, Object> failure = new LinkedHashMap<>();
        failure.put("status", "failed");
        failure.put("error", error.getMessage());
        failure.put("failed_at", stateMachine.now().toString());
        stateMachine.transition(sessionId, UploadStatus.FINALIZING, UploadStatus.FINALIZATION_FAILED,
                SessionEventType.FINALIZATION, failure, "Finalization failed: " + error.getMessage());
    }

    private Map<String, Object> assetMetadata(S session) {
        SessionMetadataView view = SessionMetadataView.fold(session.getMetadata(),
                eventPort.findEvents(session.getSessionId()));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("upload_session_id", session.getSessionId());
        metadata.put("chunks_count", session.getChunksCount());
        Double duration = uploadDuration(session.getCreatedAt(), session.getVirusScanCompletedAt());
        if (duration != null) {
            metadata.put("upload_duration", duration);
        }
        if (view.getVirusScan() != null) {
            metadata.put(SessionMetadataView.VIRUS_SCAN, view.getVirusScan());
        }
        if (session.getMetadata() != null) {
            session.getMetadata().forEach((key, value) -> {
                if (!SessionMetadataView.VIRUS_SCAN.equals(key) && value != null) {
                    metadata.put(key, value);
                }
            });
        }
        return metadata;
    }

    /**
     * Seconds from session creation to the scan verdict, rounded to two decimals.
     */
    static Double uploadDuration(LocalDateTime createdAt, LocalDateTime scanCompletedAt) {
        if (createdAt == null || scanCompletedAt == null) {
            return null;
        }
        long millis = Duration.between(createdAt, scanCompletedAt).toMillis();
        return Math.round(millis / 10.0) / 100.0;
    }
}
