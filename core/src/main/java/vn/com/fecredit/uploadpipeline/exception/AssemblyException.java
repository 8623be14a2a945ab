package vn.com.fecredit.uploadpipeline.exception;

/**
 * The chunk set cannot be assembled: incomplete, unreadable, wrong size, or the filename is taken.
 */
public class AssemblyException extends UploadPipelineException {

    public AssemblyException(String message) {
        super(message, false);
    }

    public AssemblyException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
