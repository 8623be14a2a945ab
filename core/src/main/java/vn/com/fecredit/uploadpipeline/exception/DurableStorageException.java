package vn.com.fecredit.uploadpipeline.exception;

/**
 * Attaching the assembled file to durable storage failed.
 */
public class DurableStorageException extends UploadPipelineException {

    public DurableStorageException(String message) {
        super(message, true);
    }

    public DurableStorageException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
