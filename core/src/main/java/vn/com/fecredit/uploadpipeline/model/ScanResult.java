package vn.com.fecredit.uploadpipeline.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Verdict returned by a virus scanner for one file.
 */
@Getter
@ToString
public final class ScanResult {

    private final boolean clean;
    /** Engine name, e.g. {@code clamav} or {@code noop}. */
    private final String scanner;
    /** Signature name for infected files, otherwise {@code null}. */
    private final String virusName;
    private final Duration duration;
    private final long fileSize;

    public ScanResult(boolean clean, String scanner, String virusName, Duration duration, long fileSize) {
        this.clean = clean;
        this.scanner = scanner;
        this.virusName = virusName;
        this.duration = duration;
        this.fileSize = fileSize;
    }

    public static ScanResult clean(String scanner, Duration duration, long fileSize) {
        return new ScanResult(true, scanner, null, duration, fileSize);
    }

    public static ScanResult infected(String scanner, String virusName, Duration duration, long fileSize) {
        return new ScanResult(false, scanner, virusName, duration, fileSize);
    }
}
