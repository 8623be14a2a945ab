package vn.com.fecredit.uploadpipeline.exception;

public class InvalidSessionStateException extends UploadPipelineException {

    public InvalidSessionStateException(String message) {
        super(message, false);
    }

    public InvalidSessionStateException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
