package com.phillippitts.parlcorpus.service.orchestration;

import com.phillippitts.parlcorpus.domain.DropReason;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.service.labeling.SessionLabels;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-session counts of one pipeline run.
 *
 * @param session         session id
 * @param status          completed, failed or timed out
 * @param kept            kept candidates
 * @param dropped         dropped candidates
 * @param queued          candidates queued for realignment
 * @param unresolved      kept records attributed to the unresolved-speaker sentinel
 * @param skippedTurns    malformed statements skipped by the parser
 * @param droppedByReason dropped candidates per reason
 * @param failureReason   reason of a failed session, null when completed
 * @param durationMs      processing time in milliseconds
 */
public record SessionReport(
        SessionId session,
        SessionStatus status,
        int kept,
        int dropped,
        int queued,
        int unresolved,
        int skippedTurns,
        Map<DropReason, Integer> droppedByReason,
        String failureReason,
        long durationMs
) {

    public SessionReport {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(status, "status");
        droppedByReason = droppedByReason.isEmpty()
                ? Map.of() : Map.copyOf(new EnumMap<>(droppedByReason));
    }

    static SessionReport completed(SessionLabels labels, int skippedTurns, long durationMs) {
        return new SessionReport(labels.session(), SessionStatus.COMPLETED, labels.keptCount(),
                labels.droppedCount(), labels.queuedCount(), labels.unresolvedCount(), skippedTurns,
                labels.droppedByReason(), null, durationMs);
    }

    public static SessionReport failed(SessionId session, String reason, long durationMs) {
        return new SessionReport(session, SessionStatus.FAILED, 0, 0, 0, 0, 0, Map.of(),
                reason == null ? "unknown" : reason, durationMs);
    }

    static SessionReport timedOut(SessionId session, long timeoutMs) {
        return new SessionReport(session, SessionStatus.TIMED_OUT, 0, 0, 0, 0, 0, Map.of(),
                "not finished within " + timeoutMs + " ms", timeoutMs);
    }

    /**
     * True for every session that did not complete, timed out ones included.
     */
    public boolean isFailed() {
        return status != SessionStatus.COMPLETED;
    }

    public boolean isTimedOut() {
        return status == SessionStatus.TIMED_OUT;
    }
}
