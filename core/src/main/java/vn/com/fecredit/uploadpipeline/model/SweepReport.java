package vn.com.fecredit.uploadpipeline.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Counters of one cleanup sweep.
 */
@Getter
@ToString
public class SweepReport {

    /** Expired or retained-too-long sessions that were removed. */
    private int cleaned;
    /** Sessions whose cleanup threw; they are retried on the next sweep. */
    private int failed;
    /** Stuck sessions moved to a failure state. */
    private int forceFailed;
    /** Completed sessions archived to history and removed. */
    private int archived;
    /** Stuck FINALIZING sessions completed from an asset that already existed. */
    private int recovered;

    public void recordCleaned() {
        cleaned++;
    }

    public void recordFailed() {
        failed++;
    }

    public void recordForceFailed() {
        forceFailed++;
    }

    public void recordArchived() {
        archived++;
    }

    public void recordRecovered() {
        recovered++;
    }
}
