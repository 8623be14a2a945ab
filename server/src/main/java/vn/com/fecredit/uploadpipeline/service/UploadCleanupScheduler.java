package vn.com.fecredit.uploadpipeline.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import vn.com.fecredit.uploadpipeline.model.SweepReport;

/**
 * Runs the cleanup sweep in the background, every 5 minutes by default.
 */
@Service
public class UploadCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(UploadCleanupScheduler.class);

    private final ServerUploadPipeline pipeline;

    public UploadCleanupScheduler(ServerUploadPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Scheduled(fixedDelayString = "${uploadpipeline.cleanup.interval-ms:300000}",
            initialDelayString = "${uploadpipeline.cleanup.initial-delay-ms:60000}")
    public void runCleanup() {
        log.debug("Starting upload session cleanup");
        try {
            SweepReport report = pipeline.sweep();
            if (report.getCleaned() + report.getForceFailed() + report.getArchived() + report.getRecovered()
                    + report.getFailed() > 0) {
                log.info("Upload session cleanup finished: {}", report);
            }
            if (report.getFailed() > 0) {
                log.warn("{} session(s) could not be cleaned up and will be retried", report.getFailed());
            }
        } catch (Exception e) {
            log.error("Error during upload session cleanup: {}", e.getMessage(), e);
        }
    }
}
