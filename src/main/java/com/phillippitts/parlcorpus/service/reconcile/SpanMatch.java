package com.phillippitts.parlcorpus.service.reconcile;

/**
 * A contiguous reference span and its word edit distance to a hypothesis.
 *
 * @param start    index of the first reference word
 * @param length   number of reference words, at least 1
 * @param distance word edit distance between span and hypothesis
 */
public record SpanMatch(int start, int length, int distance) {

    public SpanMatch {
        if (start < 0 || length < 1 || distance < 0) {
            throw new IllegalArgumentException("Invalid span " + start + "+" + length + " d=" + distance);
        }
    }

    /** Edit distance divided by span length. */
    public double editRate() {
        return (double) distance / length;
    }

    public int end() {
        return start + length;
    }
}
