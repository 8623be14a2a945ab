package vn.com.fecredit.uploadpipeline.core;

import lombok.Getter;
import vn.com.fecredit.uploadpipeline.exception.UploadPipelineException;

import java.time.Duration;

/**
 * Bounded attempts with exponential backoff capped at {@code maxBackoff}.
 */
@Getter
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    public static boolean isRetryable(RuntimeException error) {
        if (error instanceof UploadPipelineException) {
            return ((UploadPipelineException) error).isRetryable();
        }
        return true;
    }

    /**
     * @param attempt 1-based number of the attempt that just failed
     */
    public boolean shouldRetry(RuntimeException error, int attempt) {
        return attempt < maxAttempts && isRetryable(error);
    }

    /**
     * Delay before the attempt following {@code attempt}.
     */
    public Duration backoff(int attempt) {
        long factor = 1L << Math.min(attempt - 1, 30);
        Duration delay = initialBackoff.multipliedBy(factor);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }
}
