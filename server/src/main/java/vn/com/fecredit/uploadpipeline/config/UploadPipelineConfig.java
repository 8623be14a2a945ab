package vn.com.fecredit.uploadpipeline.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import vn.com.fecredit.uploadpipeline.core.PipelineSettings;
import vn.com.fecredit.uploadpipeline.core.RetryPolicy;
import vn.com.fecredit.uploadpipeline.core.RetryingStageDispatcher;
import vn.com.fecredit.uploadpipeline.core.StageDispatcher;
import vn.com.fecredit.uploadpipeline.port.impl.ClamAvVirusScanner;
import vn.com.fecredit.uploadpipeline.port.impl.LocalFileChunkStore;
import vn.com.fecredit.uploadpipeline.port.impl.LocalFileDurableStorage;
import vn.com.fecredit.uploadpipeline.port.impl.NoOpVirusScanner;
import vn.com.fecredit.uploadpipeline.port.interfaces.IChunkStore;
import vn.com.fecredit.uploadpipeline.port.interfaces.IDurableStorage;
import vn.com.fecredit.uploadpipeline.port.interfaces.IVirusScanner;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the stores, scanner, stage dispatcher and tunables of the pipeline from
 * {@code uploadpipeline.*} properties.
 */
@Configuration
public class UploadPipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(UploadPipelineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PipelineSettings pipelineSettings(
            @Value("${uploadpipeline.assembly-dir:uploads/assembling}") String assemblyDir,
            @Value("${uploadpipeline.max-file-size:" + PipelineSettings.FIVE_GIB + "}") long maxFileSize,
            @Value("${uploadpipeline.pending-expiry-minutes:60}") long pendingExpiryMinutes,
            @Value("${uploadpipeline.stale-upload-timeout-minutes:60}") long staleUploadTimeoutMinutes,
            @Value("${uploadpipeline.retention-hours:24}") long retentionHours,
            @Value("${uploadpipeline.staleness-threshold-minutes:60}") long stalenessThresholdMinutes,
            @Value("${uploadpipeline.history-retention-days:7}") long historyRetentionDays,
            @Value("${uploadpipeline.cleanup.batch-size:50}") int batchSize) {
        return PipelineSettings.builder()
                .assemblyDir(Paths.get(assemblyDir))
                .maxFileSize(maxFileSize)
                .pendingExpiry(Duration.ofMinutes(pendingExpiryMinutes))
                .staleUploadTimeout(Duration.ofMinutes(staleUploadTimeoutMinutes))
                .retention(Duration.ofHours(retentionHours))
                .stalenessThreshold(Duration.ofMinutes(stalenessThresholdMinutes))
                .historyRetention(Duration.ofDays(historyRetentionDays))
                .batchSize(batchSize)
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService stageExecutor(@Value("${uploadpipeline.stage.pool-size:4}") int poolSize) {
        return Executors.newScheduledThreadPool(poolSize);
    }

    @Bean
    public RetryPolicy retryPolicy(@Value("${uploadpipeline.stage.max-attempts:3}") int maxAttempts,
                                   @Value("${uploadpipeline.stage.initial-backoff-ms:1000}") long initialBackoffMs,
                                   @Value("${uploadpipeline.stage.max-backoff-ms:30000}") long maxBackoffMs) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(initialBackoffMs), Duration.ofMillis(maxBackoffMs));
    }

    @Bean
    public StageDispatcher stageDispatcher(ScheduledExecutorService stageExecutor, RetryPolicy retryPolicy) {
        return new RetryingStageDispatcher(stageExecutor, retryPolicy);
    }

    @Bean
    public IVirusScanner virusScanner(@Value("${uploadpipeline.scanner.type:noop}") String type,
                                      @Value("${uploadpipeline.scanner.clamav.host:localhost}") String host,
                                      @Value("${uploadpipeline.scanner.clamav.port:3310}") int port,
                                      @Value("${uploadpipeline.scanner.clamav.timeout-seconds:300}") long timeoutSeconds) {
        switch (type) {
            case "clamav":
                log.info("Using ClamAV scanner at {}:{}", host, port);
                return new ClamAvVirusScanner(host, port, Duration.ofSeconds(timeoutSeconds));
            case "noop":
                log.warn("Virus scanning disabled, uploads are reported clean without scanning");
                return new NoOpVirusScanner();
            default:
                throw new IllegalStateException("Unknown uploadpipeline.scanner.type: " + type);
        }
    }

    @Bean
    public IChunkStore chunkStore(@Value("${uploadpipeline.chunk-dir:uploads/chunks}") String chunkDir)
            throws IOException {
        return new LocalFileChunkStore(chunkDir);
    }

    @Bean
    public IDurableStorage durableStorage(@Value("${uploadpipeline.asset-dir:uploads/assets}") String assetDir)
            throws IOException {
        return new LocalFileDurableStorage(assetDir);
    }
}
