package com.phillippitts.parlcorpus.service.orchestration;

import com.phillippitts.parlcorpus.domain.SessionId;

import java.util.List;

/**
 * Processes independent sessions concurrently.
 * Implementations never let one session's failure affect another.
 */
public interface ParallelSessionService {

    /**
     * Processes all sessions and waits until each has reached a terminal state. Sessions still
     * running when the timeout expires are cancelled, and the call returns only after their
     * tasks have stopped (or a bounded grace period has passed).
     *
     * @param sessions  sessions to process
     * @param timeoutMs overall timeout in milliseconds (use 0 for the default)
     * @return one report per session, in input order; failed sessions are reported as FAILED,
     *         cancelled ones as TIMED_OUT
     */
    List<SessionReport> processAll(List<SessionId> sessions, long timeoutMs);
}
