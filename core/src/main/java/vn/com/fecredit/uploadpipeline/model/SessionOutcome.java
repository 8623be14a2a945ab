package vn.com.fecredit.uploadpipeline.model;

/**
 * Outcome recorded when a session is archived to history.
 */
public enum SessionOutcome {
    COMPLETED,
    EXPIRED,
    CANCELLED,
    FAILED;

    public static SessionOutcome of(UploadStatus status) {
        switch (status) {
            case COMPLETED:
                return COMPLETED;
            case CANCELLED:
                return CANCELLED;
            case FAILED:
            case VIRUS_SCAN_FAILED:
            case FINALIZATION_FAILED:
                return FAILED;
            default:
                return EXPIRED;
        }
    }
}
