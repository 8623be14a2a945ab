package vn.com.fecredit.uploadpipeline.exception;

public class ScanTimeoutException extends UploadPipelineException {

    public ScanTimeoutException(String message) {
        super(message, true);
    }

    public ScanTimeoutException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
