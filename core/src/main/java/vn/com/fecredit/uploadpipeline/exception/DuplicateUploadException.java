package vn.com.fecredit.uploadpipeline.exception;

/**
 * Another active session already holds the (workspace, container, filename) slot.
 */
public class DuplicateUploadException extends UploadPipelineException {

    public DuplicateUploadException(String message) {
        super(message, false);
    }

    public DuplicateUploadException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
