package vn.com.fecredit.uploadpipeline.exception;

/**
 * The scanner cannot be reached. The gateway degrades to a skipped scan instead of failing the upload.
 */
public class ScannerUnavailableException extends UploadPipelineException {

    public ScannerUnavailableException(String message) {
        super(message, false);
    }

    public ScannerUnavailableException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
