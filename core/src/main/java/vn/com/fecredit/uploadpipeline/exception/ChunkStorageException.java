package vn.com.fecredit.uploadpipeline.exception;

/**
 * Reading or writing chunk bytes failed at the I/O level.
 */
public class ChunkStorageException extends UploadPipelineException {

    public ChunkStorageException(String message) {
        super(message, true);
    }

    public ChunkStorageException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
