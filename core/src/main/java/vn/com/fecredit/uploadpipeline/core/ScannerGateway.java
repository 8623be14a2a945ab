package vn.com.fecredit.uploadpipeline.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.uploadpipeline.exception.ScanFileNotFoundException;
import vn.com.fecredit.uploadpipeline.exception.ScannerUnavailableException;
import vn.com.fecredit.uploadpipeline.model.ScanResult;
import vn.com.fecredit.uploadpipeline.model.SessionEventType;
import vn.com.fecredit.uploadpipeline.model.UploadStatus;
import vn.com.fecredit.uploadpipeline.model.interfaces.IUploadSession;
import vn.com.fecredit.uploadpipeline.port.interfaces.IVirusScanner;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the assembled file of a session through the virus scanner and commits the verdict.
 *
 * <p>
 * Outcomes:
 * <ul>
 * <li>clean: VIRUS_SCANNING → FINALIZING</li>
 * <li>scanner unavailable: scan recorded as skipped, VIRUS_SCANNING → FINALIZING</li>
 * <li>infected: assembled file deleted, VIRUS_SCANNING → VIRUS_SCAN_FAILED</li>
 * <li>file missing: {@link ScanFileNotFoundException}, not retried</li>
 * <li>timeouts and other scanner errors: thrown for the dispatcher to retry</li>
 * </ul>
 */
public class ScannerGateway<S extends IUploadSession> {

    private static final Logger log = LoggerFactory.getLogger(ScannerGateway.class);

    private final SessionStateMachine<S> stateMachine;
    private final IVirusScanner scanner;

    public ScannerGateway(SessionStateMachine<S> stateMachine, IVirusScanner scanner) {
        this.stateMachine = stateMachine;
        this.scanner = scanner;
    }

    /**
     * @return {@code true} if the session moved to FINALIZING and should be finalized
     */
    public boolean scan(String sessionId) {
        S session = stateMachine.require(sessionId);
        if (session.getStatus() != UploadStatus.VIRUS_SCANNING) {
            log.info("Skipping scan of session {} in status {}", sessionId, session.getStatus());
            return false;
        }
        if (session.getAssembledFilePath() == null) {
            throw new ScanFileNotFoundException("Session " + sessionId + " has no assembled file");
        }
        Path file = Paths.get(session.getAssembledFilePath());

        if (!scanner.isAvailable()) {
            return skip(sessionId, "Scanner unavailable");
        }
        ScanResult result;
        try {
            result = scanner.scan(file);
        } catch (ScannerUnavailableException e) {
            log.warn("Scanner became unavailable while scanning session {}: {}", sessionId, e.getMessage());
            return skip(sessionId, "Scanner became unavailable: " + e.getMessage());
        }

        if (result.isClean()) {
            Map<String, Object> verdict = verdict("clean", result);
            return stateMachine.transition(sessionId, UploadStatus.VIRUS_SCANNING, UploadStatus.FINALIZING,
                    SessionEventType.VIRUS_SCAN, verdict, null);
        }

        log.warn("Virus {} detected in session {}", result.getVirusName(), sessionId);
        Map<String, Object> verdict = verdict("infected", result);
        verdict.put("virus_name", result.getVirusName());
        boolean committed = stateMachine.transition(sessionId, UploadStatus.VIRUS_SCANNING,
                UploadStatus.VIRUS_SCAN_FAILED, SessionEventType.VIRUS_SCAN, verdict,
                "Virus detected: " + result.getVirusName());
        if (committed) {
            UploadAssembler.deleteQuietly(file);
        }
        return false;
    }

    /**
     * Terminal failure of the scan stage: VIRUS_SCANNING → VIRUS_SCAN_FAILED.
     */
    public void markFailed(String sessionId, RuntimeException error) {
        Map<String, Object> failure = new LinkedHashMap<>();
        failure.put("status", "failed");
        failure.put("error", error.getMessage());
        failure.put("failed_at", stateMachine.now().toString());
        failure.put("scanner", scanner.getName());
        stateMachine.transition(sessionId, UploadStatus.VIRUS_SCANNING, UploadStatus.VIRUS_SCAN_FAILED,
                SessionEventType.VIRUS_SCAN, failure, "Virus scan failed: " + error.getMessage());
    }

    private boolean skip(String sessionId, String reason) {
        Map<String, Object> skipped = new LinkedHashMap<>();
        skipped.put("status", "skipped");
        skipped.put("reason", reason);
        skipped.put("skipped_at", stateMachine.now().toString());
        log.warn("Skipping virus scan of session {}: {}", sessionId, reason);
        return stateMachine.transition(sessionId, UploadStatus.VIRUS_SCANNING, UploadStatus.FINALIZING,
                SessionEventType.VIRUS_SCAN, skipped, null);
    }

    private Map<String, Object> verdict(String status, ScanResult result) {
        Map<String, Object> verdict = new LinkedHashMap<>();
        verdict.put("status", status);
        verdict.put("scanner", result.getScanner());
        verdict.put("completed_at", stateMachine.now().toString());
        verdict.put("scan_duration_ms", result.getDuration() != null ? result.getDuration().toMillis() : 0L);
        verdict.put("file_size", result.getFileSize());
        return verdict;
    }
}
