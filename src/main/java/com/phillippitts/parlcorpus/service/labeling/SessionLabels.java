package com.phillippitts.parlcorpus.service.labeling;

import com.phillippitts.parlcorpus.domain.CorpusRecord;
import com.phillippitts.parlcorpus.domain.DecisionState;
import com.phillippitts.parlcorpus.domain.DropReason;
import com.phillippitts.parlcorpus.domain.RetryEntry;
import com.phillippitts.parlcorpus.domain.SegmentDecision;
import com.phillippitts.parlcorpus.domain.SessionId;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Labeling decisions of one session.
 *
 * @param session   session id
 * @param decisions one terminal decision per candidate, in candidate time order
 */
public record SessionLabels(SessionId session, List<SegmentDecision> decisions) {

    public SessionLabels {
        Objects.requireNonNull(session, "session");
        decisions = List.copyOf(decisions);
    }

    /** Records of kept candidates, ordered by start time. */
    public List<CorpusRecord> keptRecords() {
        return decisions.stream()
                .filter(d -> d.state() == DecisionState.KEPT)
                .map(SegmentDecision::record)
                .toList();
    }

    public List<RetryEntry> retries() {
        return decisions.stream()
                .filter(d -> d.state() == DecisionState.QUEUED_FOR_REALIGNMENT)
                .map(SegmentDecision::retry)
                .toList();
    }

    public List<SegmentDecision> dropped() {
        return decisions.stream().filter(d -> d.state() == DecisionState.DROPPED).toList();
    }

    public int keptCount() {
        return count(DecisionState.KEPT);
    }

    public int droppedCount() {
        return count(DecisionState.DROPPED);
    }

    public int queuedCount() {
        return count(DecisionState.QUEUED_FOR_REALIGNMENT);
    }

    /** Kept records attributed to the unresolved-speaker sentinel. */
    public int unresolvedCount() {
        return (int) keptRecords().stream().filter(r -> !r.speakerId().isResolved()).count();
    }

    public Map<DropReason, Integer> droppedByReason() {
        Map<DropReason, Integer> counts = new EnumMap<>(DropReason.class);
        for (SegmentDecision d : decisions) {
            if (d.state() == DecisionState.DROPPED) {
                counts.merge(d.dropReason(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private int count(DecisionState state) {
        return (int) decisions.stream().filter(d -> d.state() == state).count();
    }
}
