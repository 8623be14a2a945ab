package vn.com.fecredit.uploadpipeline.core;

import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Tunables of the upload pipeline.
 */
@Getter
@Builder
public class PipelineSettings {

    public static final long FIVE_GIB = 5L * 1024 * 1024 * 1024;

    /** Directory receiving assembled temp files. */
    private final Path assemblyDir;

    @Builder.Default
    private final long maxFileSize = FIVE_GIB;

    /** PENDING sessions older than this are expired. */
    @Builder.Default
    private final Duration pendingExpiry = Duration.ofHours(1);

    /** UPLOADING sessions not updated within this window are expired. */
    @Builder.Default
    private final Duration staleUploadTimeout = Duration.ofHours(1);

    /** How long cancelled and failed sessions are kept. */
    @Builder.Default
    private final Duration retention = Duration.ofHours(24);

    /** ASSEMBLING, VIRUS_SCANNING and FINALIZING sessions not updated within this window are force-failed. */
    @Builder.Default
    private final Duration stalenessThreshold = Duration.ofHours(1);

    /** How long completed sessions are kept before they are archived. */
    @Builder.Default
    private final Duration historyRetention = Duration.ofDays(7);

    @Builder.Default
    private final int batchSize = 50;
}
