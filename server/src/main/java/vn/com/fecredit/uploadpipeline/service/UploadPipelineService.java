package vn.com.fecredit.uploadpipeline.service;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import vn.com.fecredit.uploadpipeline.exception.SessionNotFoundException;
import vn.com.fecredit.uploadpipeline.model.Asset;
import vn.com.fecredit.uploadpipeline.model.ChunkReceipt;
import vn.com.fecredit.uploadpipeline.model.CreateSessionRequest;
import vn.com.fecredit.uploadpipeline.model.SessionStatusResponse;
import vn.com.fecredit.uploadpipeline.model.UploadSession;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for callers of the upload pipeline. Validates requests and delegates to
 * {@link ServerUploadPipeline}.
 */
@Service
@Validated
public class UploadPipelineService {

    private static final Logger log = LoggerFactory.getLogger(UploadPipelineService.class);

    private static final Set<UploadStatus> IN_FLIGHT =
            EnumSet.of(UploadStatus.ASSEMBLING, UploadStatus.VIRUS_SCANNING, UploadStatus.FINALIZING);

    private final ServerUploadPipeline pipeline;
    private final Clock clock;
    private final boolean resumeOnStartup;
    private final int batchSize;

    public UploadPipelineService(ServerUploadPipeline pipeline, Clock clock,
                                 @Value("${uploadpipeline.resume-on-startup:true}") boolean resumeOnStartup,
                                 @Value("${uploadpipeline.cleanup.batch-size:50}") int batchSize) {
        this.pipeline = pipeline;
        this.clock = clock;
        this.resumeOnStartup = resumeOnStartup;
        this.batchSize = batchSize;
    }

    public UploadSession createSession(@Valid @NotNull CreateSessionRequest request) {
        UploadSession session = pipeline.createSession(request);
        log.info("Created upload session {} for '{}' ({} bytes in {} chunks)", session.getSessionId(),
                session.getFilename(), session.getTotalSize(), session.getChunksCount());
        return session;
    }

    public ChunkReceipt uploadChunk(@NotBlank String sessionId, @Positive int chunkNumber,
                                    @NotNull byte[] payload, String checksum) {
        return pipeline.uploadChunk(sessionId, chunkNumber, payload, checksum);
    }

    public SessionStatusResponse completeUpload(@NotBlank String sessionId) {
        return pipeline.completeUpload(sessionId);
    }

    public UploadSession cancel(@NotBlank String sessionId) {
        return pipeline.cancel(sessionId);
    }

    public SessionStatusResponse getStatus(@NotBlank String sessionId) {
        return pipeline.getStatus(sessionId);
    }

    public Optional<Asset> findAsset(@NotBlank String sessionId) {
        return pipeline.findAsset(sessionId);
    }

    /**
     * Merges post-processing results into the asset of a completed session.
     */
    public Asset annotateAsset(@NotBlank String sessionId, @NotNull Map<String, Object> metadata) {
        Asset asset = pipeline.findAsset(sessionId)
                .orElseThrow(() -> new SessionNotFoundException("No asset for upload session: " + sessionId));
        return pipeline.annotateAsset(asset.getId(), metadata);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (resumeOnStartup) {
            resumeInFlightSessions();
        }
    }

    /**
     * Re-dispatches sessions whose queued stages were lost with the previous process.
     *
     * @return number of sessions resumed
     */
    public int resumeInFlightSessions() {
        LocalDateTime now = LocalDateTime.now(clock);
        int resumed = 0;
        long afterId = 0;
        List<UploadSession> page;
        do {
            page = pipeline.getSessionPort().findUpdatedBefore(IN_FLIGHT, now, afterId, batchSize);
            for (UploadSession session : page) {
                afterId = session.getId();
                try {
                    if (pipeline.resume(session.getSessionId())) {
                        resumed++;
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to resume upload session {}: {}", session.getSessionId(), e.getMessage(), e);
                }
            }
        } while (page.size() == batchSize);
        if (resumed > 0) {
            log.info("Resumed {} in-flight upload session(s)", resumed);
        }
        return resumed;
    }
}
