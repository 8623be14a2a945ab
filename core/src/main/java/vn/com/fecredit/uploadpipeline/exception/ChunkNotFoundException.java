package vn.com.fecredit.uploadpipeline.exception;

public class ChunkNotFoundException extends UploadPipelineException {

    public ChunkNotFoundException(String message) {
        super(message, false);
    }

    public ChunkNotFoundException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
