package com.phillippitts.parlcorpus.domain;

import java.util.Objects;

/**
 * Terminal labeling decision for one candidate segment.
 *
 * <p>Exactly one of {@code record} (kept), {@code dropReason} (dropped) or {@code retry} (queued)
 * is set, matching {@code state}.
 *
 * @param candidate  labeled candidate
 * @param state      terminal state
 * @param dropReason reason for a dropped candidate, null otherwise
 * @param record     corpus record for a kept candidate, null otherwise
 * @param retry      retry entry for a queued candidate, null otherwise
 * @param editRate   edit rate from reconciliation
 */
public record SegmentDecision(
        CandidateSegment candidate,
        DecisionState state,
        DropReason dropReason,
        CorpusRecord record,
        RetryEntry retry,
        double editRate
) {

    public SegmentDecision {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(state, "state");
        if (!DecisionState.PENDING.canTransitionTo(state)) {
            throw new IllegalArgumentException("Decision must be terminal, got: " + state);
        }
        if ((state == DecisionState.KEPT) != (record != null)) {
            throw new IllegalArgumentException("Kept decisions carry a record and only they do");
        }
        if ((state == DecisionState.DROPPED) != (dropReason != null)) {
            throw new IllegalArgumentException("Dropped decisions carry a reason and only they do");
        }
        if ((state == DecisionState.QUEUED_FOR_REALIGNMENT) != (retry != null)) {
            throw new IllegalArgumentException("Queued decisions carry a retry entry and only they do");
        }
    }

    public static SegmentDecision kept(CandidateSegment candidate, CorpusRecord record, double editRate) {
        return new SegmentDecision(candidate, DecisionState.KEPT, null, record, null, editRate);
    }

    public static SegmentDecision dropped(CandidateSegment candidate, DropReason reason, double editRate) {
        return new SegmentDecision(candidate, DecisionState.DROPPED, reason, null, null, editRate);
    }

    public static SegmentDecision queued(CandidateSegment candidate, RetryEntry retry, double editRate) {
        return new SegmentDecision(candidate, DecisionState.QUEUED_FOR_REALIGNMENT, null, null, retry, editRate);
    }
}
