package com.phillippitts.parlcorpus.service.reconcile.impl;

import com.phillippitts.parlcorpus.domain.CandidateSegment;
import com.phillippitts.parlcorpus.service.reconcile.AbstractAlignmentReconciler;
import com.phillippitts.parlcorpus.service.reconcile.SpanMatch;
import com.phillippitts.parlcorpus.service.reconcile.WordEditDistance;
import com.phillippitts.parlcorpus.service.text.TextNormalizer;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds the reference span with the lowest word edit rate inside a window around the cursor.
 *
 * <p>Span starts range over {@code [cursor - backward, cursor + forward]} and span lengths over
 * the hypothesis length ± {@code lengthSlack}. One dynamic-programming pass per start yields the
 * distances for all lengths.
 *
 * <p>Ties on edit rate go to the start closest to the cursor, then the smaller start, then the
 * length closest to the hypothesis length, then the shorter length. Starts are visited in that
 * preference order, so the scan stops at the first exact match.
 *
 * <p>Decoder markup tokens such as {@code <UNK>} and {@code <eps>} are removed from the
 * hypothesis before normalization.
 */
public final class EditDistanceAlignmentReconciler extends AbstractAlignmentReconciler {

    private static final Pattern DECODER_MARKUP = Pattern.compile("<[^>\\s]*>");

    private final TextNormalizer normalizer;
    private final int windowBackward;
    private final int windowForward;
    private final int lengthSlack;

    /**
     * Creates an edit-distance reconciler.
     *
     * @param normalizer       normalizer applied to hypotheses
     * @param realignThreshold highest edit rate still eligible for realignment (0.0 to 1.0)
     * @param windowBackward   reference words searched before the cursor
     * @param windowForward    reference words searched after the cursor
     * @param lengthSlack      span length deviation from the hypothesis length
     * @throws IllegalArgumentException if a window or the slack is negative
     */
    public EditDistanceAlignmentReconciler(TextNormalizer normalizer, double realignThreshold,
                                           int windowBackward, int windowForward, int lengthSlack) {
        super(realignThreshold);
        if (windowBackward < 0 || windowForward < 0 || lengthSlack < 0) {
            throw new IllegalArgumentException("windows and slack must not be negative");
        }
        this.normalizer = normalizer;
        this.windowBackward = windowBackward;
        this.windowForward = windowForward;
        this.lengthSlack = lengthSlack;
    }

    @Override
    protected List<String> hypothesisWords(CandidateSegment candidate) {
        return normalizer.words(DECODER_MARKUP.matcher(candidate.hypothesis()).replaceAll(" "));
    }

    @Override
    protected SpanMatch findBestSpan(List<String> reference, List<String> hypothesis, int cursor) {
        int lo = Math.max(0, cursor - windowBackward);
        int hi = Math.min(reference.size() - 1, cursor + windowForward);
        if (lo > hi) {
            return null;
        }
        int m = hypothesis.size();
        int minLength = Math.max(1, m - lengthSlack);
        int maxLength = m + lengthSlack;
        int reach = Math.max(cursor - lo, hi - cursor);

        SpanMatch best = null;
        for (int d = 0; d <= reach; d++) {
            int[] starts = d == 0 ? new int[] {cursor} : new int[] {cursor - d, cursor + d};
            for (int start : starts) {
                if (start < lo || start > hi) {
                    continue;
                }
                int[] distances = WordEditDistance.prefixDistances(reference, start, maxLength, hypothesis);
                for (int length = minLength; length < distances.length; length++) {
                    SpanMatch candidate = new SpanMatch(start, length, distances[length]);
                    if (best == null || isBetter(candidate, best, cursor, m)) {
                        best = candidate;
                    }
                }
                if (best != null && best.distance() == 0) {
                    return best;
                }
            }
        }
        return best;
    }

    static boolean isBetter(SpanMatch a, SpanMatch b, int cursor, int hypothesisLength) {
        long lhs = (long) a.distance() * b.length();
        long rhs = (long) b.distance() * a.length();
        if (lhs != rhs) {
            return lhs < rhs;
        }
        int da = Math.abs(a.start() - cursor);
        int db = Math.abs(b.start() - cursor);
        if (da != db) {
            return da < db;
        }
        if (a.start() != b.start()) {
            return a.start() < b.start();
        }
        int la = Math.abs(a.length() - hypothesisLength);
        int lb = Math.abs(b.length() - hypothesisLength);
        if (la != lb) {
            return la < lb;
        }
        return a.length() < b.length();
    }
}
