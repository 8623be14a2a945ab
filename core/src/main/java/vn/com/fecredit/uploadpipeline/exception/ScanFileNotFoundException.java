package vn.com.fecredit.uploadpipeline.exception;

public class ScanFileNotFoundException extends UploadPipelineException {

    public ScanFileNotFoundException(String message) {
        super(message, false);
    }

    public ScanFileNotFoundException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
