package com.phillippitts.parlcorpus.domain;

import java.util.Objects;

/**
 * Reconciliation outcome for a single candidate segment.
 *
 * @param candidate      reconciled candidate
 * @param classification accurate, needs realignment or unrecoverable
 * @param editRate       word edit distance divided by reference span length; 1.0 when no span was found
 * @param spanStart      first reference word of the matched span, -1 when none
 * @param spanLength     number of reference words in the span, 0 when none
 * @param referenceText  canonical transcript text of the span
 * @param edits          edit operations between hypothesis and span
 * @param attempt        number of realignment passes the span has already been queued for
 */
public record ReconciliationResult(
        CandidateSegment candidate,
        Classification classification,
        double editRate,
        int spanStart,
        int spanLength,
        String referenceText,
        EditSummary edits,
        int attempt
) {

    public ReconciliationResult {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(classification, "classification");
        if (editRate < 0.0) {
            throw new IllegalArgumentException("Edit rate must not be negative, got: " + editRate);
        }
        if (classification == Classification.ACCURATE && editRate != 0.0) {
            throw new IllegalArgumentException("Accurate results must have edit rate 0, got: " + editRate);
        }
        referenceText = referenceText == null ? "" : referenceText;
        edits = edits == null ? EditSummary.NONE : edits;
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must not be negative");
        }
    }

    /**
     * Result for a candidate with no plausible reference span.
     */
    public static ReconciliationResult unrecoverable(CandidateSegment candidate, int attempt) {
        return new ReconciliationResult(candidate, Classification.UNRECOVERABLE, 1.0, -1, 0, "",
                EditSummary.NONE, attempt);
    }

    public boolean hasSpan() {
        return spanStart >= 0 && spanLength > 0;
    }
}
