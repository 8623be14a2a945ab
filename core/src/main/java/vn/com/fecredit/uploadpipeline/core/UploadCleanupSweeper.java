package vn.com.fecredit.uploadpipeline.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.uploadpipeline.model.SessionEventType;
import vn.com.fecredit.uploadpipeline.model.SessionOutcome;
import vn.com.fecredit.uploadpipeline.model.SweepReport;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.model.interfaces.IChunk;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkStore;
import vn.com.fecredit.uploadpipeline.port.interfaces.ISessionEventPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.ISessionHistoryPort;
import vn.com.fecredit.uploadpipeline.port.interfaces.IUploadSessionPort;

import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.LongFunction;

/**
 * Periodic reclamation of abandoned, expired and stuck sessions.
 *
 * <p>
 * One sweep runs, in order:
 * <ul>
 * <li>expiry of PENDING sessions past the pending expiry and UPLOADING sessions idle past the stale-upload timeout</li>
 * <li>removal of cancelled and failed sessions past the retention window</li>
 * <li>force-failing of ASSEMBLING, VIRUS_SCANNING and FINALIZING sessions idle past the staleness threshold;
 * a FINALIZING session whose asset already exists is completed instead</li>
 * <li>archiving of completed sessions past the history retention</li>
 * </ul>
 * Sessions are read in keyset batches and handled one at a time; a failure on one session
 * is logged and counted without stopping the sweep.
 */
public class UploadCleanupSweeper<S extends IUploadSession, C extends IChunk> {

    private static final Logger log = LoggerFactory.getLogger(UploadCleanupSweeper.class);

    private static final Set<UploadStatus> RETAINED = EnumSet.of(UploadStatus.CANCELLED, UploadStatus.FAILED,
            UploadStatus.VIRUS_SCAN_FAILED, UploadStatus.FINALIZATION_FAILED);
    private static final Set<UploadStatus> IN_FLIGHT = EnumSet.of(UploadStatus.ASSEMBLING,
            UploadStatus.VIRUS_SCANNING, UploadStatus.FINALIZING);

    private final SessionStateMachine<S> stateMachine;
    private final IUploadSessionPort<S> sessionPort;
    private final IChunkPort<C> chunkPort;
    private final ISessionEventPort eventPort;
    private final ISessionHistoryPort historyPort;
    private final IChunkStore chunkStore;
    private final UploadFinalizer<S, ?> finalizer;
    private final PipelineSettings settings;

    public UploadCleanupSweeper(SessionStateMachine<S> stateMachine, IUploadSessionPort<S> sessionPort,
                                IChunkPort<C> chunkPort, ISessionEventPort eventPort, ISessionHistoryPort historyPort,
                                IChunkStore chunkStore, UploadFinalizer<S, ?> finalizer, PipelineSettings settings) {
        this.stateMachine = stateMachine;
        this.sessionPort = sessionPort;
        this.chunkPort = chunkPort;
        this.eventPort = eventPort;
        this.historyPort = historyPort;
        this.chunkStore = chunkStore;
        this.finalizer = finalizer;
        this.settings = settings;
    }

    public SweepReport sweep() {
        SweepReport report = new SweepReport();
        LocalDateTime now = stateMachine.now();

        forEachCreatedBefore(EnumSet.of(UploadStatus.PENDING), now.minus(settings.getPendingExpiry()), report,
                session -> expire(session, report));
        forEachUpdatedBefore(EnumSet.of(UploadStatus.UPLOADING), now.minus(settings.getStaleUploadTimeout()), report,
                session -> expire(session, report));
        forEachUpdatedBefore(RETAINED, now.minus(settings.getRetention()), report, session -> {
            destroy(session, SessionOutcome.of(session.getStatus()));
            report.recordCleaned();
        });
        forEachUpdatedBefore(IN_FLIGHT, now.minus(settings.getStalenessThreshold()), report,
                session -> forceFail(session, report));
        forEachUpdatedBefore(EnumSet.of(UploadStatus.COMPLETED), now.minus(settings.getHistoryRetention()), report,
                session -> {
                    destroy(session, SessionOutcome.COMPLETED);
                    report.recordArchived();
                });

        if (report.getCleaned() + report.getFailed() + report.getForceFailed() + report.getArchived()
                + report.getRecovered() > 0) {
            log.info("Upload cleanup finished: {}", report);
        } else {
            log.debug("Upload cleanup finished, nothing to do");
        }
        return report;
    }

    private void expire(S session, SweepReport report) {
        String sessionId = session.getSessionId();
        UploadStatus observed = session.getStatus();
        boolean expired = stateMachine.transition(sessionId, Set.of(observed), UploadStatus.FAILED,
                SessionEventType.SWEEP, Map.of("reason", "expired", "expired_from", observed.getValue()),
                "Upload session expired", null);
        if (!expired) {
            return;
        }
        destroy(session, SessionOutcome.EXPIRED);
        report.recordCleaned();
    }

    private void forceFail(S session, SweepReport report) {
        String sessionId = session.getSessionId();
        UploadStatus observed = session.getStatus();
        // a finalizer that died after creating the asset only missed the status commit
        if (observed == UploadStatus.FINALIZING && finalizer.completeIfAssetExists(sessionId)) {
            log.info("Completed stuck upload session {} from its existing asset", sessionId);
            report.recordRecovered();
            return;
        }
        UploadStatus target = failureOf(observed);
        String message = "Stuck in " + observed.getValue() + " for more than "
                + settings.getStalenessThreshold().toMinutes() + " minutes";
        boolean failed = stateMachine.transition(sessionId, Set.of(observed), target, SessionEventType.SWEEP,
                Map.of("reason", "stuck", "stuck_in", observed.getValue()), message, null);
        if (failed) {
            log.warn("Force-failed upload session {}: {}", sessionId, message);
            if (session.getAssembledFilePath() != null) {
                UploadAssembler.deleteQuietly(Paths.get(session.getAssembledFilePath()));
            }
            report.recordForceFailed();
        }
    }

    private static UploadStatus failureOf(UploadStatus status) {
        switch (status) {
            case VIRUS_SCANNING:
                return UploadStatus.VIRUS_SCAN_FAILED;
            case FINALIZING:
                return UploadStatus.FINALIZATION_FAILED;
            default:
                return UploadStatus.FAILED;
        }
    }

    /**
     * Archives the session, then deletes its chunk objects and records, its assembled
     * temp file, its event log and finally the session itself.
     */
    private void destroy(S session, SessionOutcome outcome) {
        String sessionId = session.getSessionId();
        S current = sessionPort.findBySessionId(sessionId).orElse(session);
        historyPort.archive(current, outcome, stateMachine.now());
        for (C chunk : chunkPort.findChunks(sessionId)) {
            if (chunk.getStorageKey() != null) {
                chunkStore.delete(chunk.getStorageKey());
            }
        }
        chunkStore.deleteSession(sessionId);
        chunkPort.deleteChunks(sessionId);
        if (current.getAssembledFilePath() != null) {
            UploadAssembler.deleteQuietly(Paths.get(current.getAssembledFilePath()));
        }
        eventPort.deleteEvents(sessionId);
        sessionPort.delete(current);
        log.info("Removed upload session {} ({})", sessionId, outcome);
    }

    private void forEachCreatedBefore(Set<UploadStatus> statuses, LocalDateTime cutoff, SweepReport report,
                                      Consumer<S> handler) {
        forEachBatch(afterId -> sessionPort.findCreatedBefore(statuses, cutoff, afterId, settings.getBatchSize()),
                report, handler);
    }

    private void forEachUpdatedBefore(Set<UploadStatus> statuses, LocalDateTime cutoff, SweepReport report,
                                      Consumer<S> handler) {
        forEachBatch(afterId -> sessionPort.findUpdatedBefore(statuses, cutoff, afterId, settings.getBatchSize()),
                report, handler);
    }

    private void forEachBatch(LongFunction<List<S>> pageQuery, SweepReport report,
                              Consumer<S> handler) {
        long afterId = 0;
        while (true) {
            List<S> batch = pageQuery.apply(afterId);
            for (S session : batch) {
                try {
                    handler.accept(session);
                } catch (RuntimeException e) {
                    log.error("Error cleaning up upload session {}: {}", session.getSessionId(), e.getMessage(), e);
                    report.recordFailed();
                }
            }
            if (batch.size() < settings.getBatchSize()) {
                return;
            }
            afterId = batch.get(batch.size() - 1).getId();
        }
    }
}
