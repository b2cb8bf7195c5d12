package com.phillippitts.parlcorpus.domain;

import java.util.Objects;

/**
 * Time-bounded audio span produced by the forced-alignment decoder.
 *
 * <p>Times are audio offsets in centiseconds. {@code reference} is the transcript text the decoder
 * aligned against (may be empty) and {@code edits} summarizes the decoder's own comparison of
 * hypothesis and reference.
 *
 * @param session    session the audio belongs to
 * @param start      start offset in centiseconds (inclusive)
 * @param end        end offset in centiseconds (exclusive)
 * @param hypothesis decoder hypothesis text
 * @param reference  decoder reference text, empty if the decoder did not emit one
 * @param edits      decoder edit operations against {@code reference}
 */
public record CandidateSegment(
        SessionId session,
        long start,
        long end,
        String hypothesis,
        String reference,
        EditSummary edits
) {

    public CandidateSegment {
        Objects.requireNonNull(session, "session");
        if (start < 0) {
            throw new IllegalArgumentException("Start must not be negative, got: " + start);
        }
        if (start >= end) {
            throw new IllegalArgumentException("Start must be before end, got: " + start + " >= " + end);
        }
        hypothesis = hypothesis == null ? "" : hypothesis;
        reference = reference == null ? "" : reference;
        edits = edits == null ? EditSummary.NONE : edits;
    }

    /**
     * Creates a candidate without decoder reference text.
     */
    public static CandidateSegment of(SessionId session, long start, long end, String hypothesis) {
        return new CandidateSegment(session, start, end, hypothesis, "", EditSummary.NONE);
    }

    public long durationCs() {
        return end - start;
    }

    /**
     * True when the two candidates share any audio.
     */
    public boolean overlaps(long otherStart, long otherEnd) {
        return start < otherEnd && otherStart < end;
    }
}
