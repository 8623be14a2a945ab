package vn.com.fecredit.uploadpipeline.exception;

/**
 * Unexpected scanner error, e.g. a broken connection or an error reply.
 */
public class VirusScanException extends UploadPipelineException {

    public VirusScanException(String message) {
        super(message, true);
    }

    public VirusScanException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
