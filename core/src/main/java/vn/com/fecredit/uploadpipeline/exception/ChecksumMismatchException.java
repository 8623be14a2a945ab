package vn.com.fecredit.uploadpipeline.exception;

public class ChecksumMismatchException extends UploadPipelineException {

    public ChecksumMismatchException(String message) {
        super(message, false);
    }

    public ChecksumMismatchException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
