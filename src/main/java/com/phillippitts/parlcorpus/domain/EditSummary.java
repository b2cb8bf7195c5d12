package com.phillippitts.parlcorpus.domain;

import java.util.List;

/**
 * Counts of word-level edit operations between a hypothesis and a reference.
 *
 * @param matches       words equal in both
 * @param substitutions reference words replaced in the hypothesis
 * @param insertions    hypothesis words absent from the reference
 * @param deletions     reference words absent from the hypothesis
 */
public record EditSummary(int matches, int substitutions, int insertions, int deletions) {

    public static final EditSummary NONE = new EditSummary(0, 0, 0, 0);

    public EditSummary {
        if (matches < 0 || substitutions < 0 || insertions < 0 || deletions < 0) {
            throw new IllegalArgumentException("Edit counts must not be negative");
        }
    }

    /**
     * Tallies an operation sequence.
     */
    public static EditSummary of(List<EditOperation> operations) {
        int m = 0;
        int s = 0;
        int i = 0;
        int d = 0;
        for (EditOperation op : operations) {
            switch (op) {
                case MATCH -> m++;
                case SUBSTITUTION -> s++;
                case INSERTION -> i++;
                case DELETION -> d++;
            }
        }
        return new EditSummary(m, s, i, d);
    }

    /** Total number of edits (substitutions + insertions + deletions). */
    public int edits() {
        return substitutions + insertions + deletions;
    }

    /** Number of reference words (matches + substitutions + deletions). */
    public int referenceLength() {
        return matches + substitutions + deletions;
    }
}
