package vn.com.fecredit.uploadpipeline.exception;

import vn.com.fecredit.uploadpipeline.model.UploadStatus;

public class InvalidTransitionException extends UploadPipelineException {

    private final UploadStatus from;
    private final UploadStatus to;

    public InvalidTransitionException(UploadStatus from, UploadStatus to) {
        super("Invalid status transition from " + from + " to " + to, false);
        this.from = from;
        this.to = to;
    }

    public UploadStatus getFrom() {
        return from;
    }

    public UploadStatus getTo() {
        return to;
    }
}
