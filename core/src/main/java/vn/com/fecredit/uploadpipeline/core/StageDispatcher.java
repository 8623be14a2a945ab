package vn.com.fecredit.uploadpipeline.core;

public interface StageDispatcher {

    /**
     * Schedules the stage to run after the caller's commit.
     */
    void dispatch(StageTask task);
}
