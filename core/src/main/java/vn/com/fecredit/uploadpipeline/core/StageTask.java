package vn.com.fecredit.uploadpipeline.core;

/**
 * One asynchronous pipeline stage run for one session.
 */
public interface StageTask {

    /** Stage name used in logs, e.g. {@code assembly}. */
    String name();

    String sessionId();

    /**
     * Runs the stage once. Throwing signals a failed attempt.
     */
    void execute();

    /**
     * Called once when the stage failed for good: a non-retryable error or exhausted attempts.
     *
     * @param lastError the error of the last attempt
     */
    void onFailure(RuntimeException lastError);
}
