package vn.com.fecredit.uploadpipeline.exception;

public class SessionNotFoundException extends UploadPipelineException {

    public SessionNotFoundException(String message) {
        super(message, false);
    }

    public SessionNotFoundException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
