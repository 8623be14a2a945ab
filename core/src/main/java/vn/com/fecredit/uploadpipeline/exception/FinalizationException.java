package vn.com.fecredit.uploadpipeline.exception;

public class FinalizationException extends UploadPipelineException {

    public FinalizationException(String message) {
        super(message, false);
    }

    public FinalizationException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
