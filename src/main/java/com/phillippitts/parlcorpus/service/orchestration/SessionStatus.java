package com.phillippitts.parlcorpus.service.orchestration;

/**
 * Terminal state of one session run.
 */
public enum SessionStatus {
    COMPLETED,
    FAILED,
    /** Cancelled at the barrier; the session's files were not written by this run. */
    TIMED_OUT
}
