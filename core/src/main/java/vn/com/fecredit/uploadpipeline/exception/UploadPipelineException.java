package vn.com.fecredit.uploadpipeline.exception;

/**
 * Root of the pipeline's exception taxonomy.
 *
 * <p>
 * Stage dispatch retries an exception only when {@link #isRetryable()} is {@code true}.
 * Exceptions outside this hierarchy are treated as transient and retried as well.
 */
public class UploadPipelineException extends RuntimeException {

    private final boolean retryable;

    public UploadPipelineException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public UploadPipelineException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
