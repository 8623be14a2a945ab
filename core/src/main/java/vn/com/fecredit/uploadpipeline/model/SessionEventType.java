package vn.com.fecredit.uploadpipeline.model;

/**
 * Kinds of entries in a session's append-only event log.
 */
public enum SessionEventType {
    /** Session declared; attributes hold nothing beyond the creation metadata on the session. */
    CREATED,
    /** Plain status transition. */
    TRANSITION,
    /** Storing a chunk failed; no status change. */
    CHUNK_FAILED,
    /** Scan queued or scan verdict; attributes become the {@code virus_scan} metadata. */
    VIRUS_SCAN,
    /** Finalization outcome; attributes become the {@code finalization} metadata. */
    FINALIZATION,
    /** Stage failure carrying an error message. */
    ERROR,
    /** Transition forced by the cleanup sweeper. */
    SWEEP
}
