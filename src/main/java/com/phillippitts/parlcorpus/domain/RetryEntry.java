package com.phillippitts.parlcorpus.domain;

import java.util.Objects;

/**
 * A session time span queued for another alignment pass.
 *
 * @param session session id
 * @param start   start offset in centiseconds
 * @param end     end offset in centiseconds
 * @param attempt number of the pass this span is queued for, starting at 1
 */
public record RetryEntry(SessionId session, long start, long end, int attempt) {

    public RetryEntry {
        Objects.requireNonNull(session, "session");
        if (start < 0 || start >= end) {
            throw new IllegalArgumentException("Invalid retry span " + start + ".." + end);
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("Retry attempt must be at least 1, got: " + attempt);
        }
    }

    public boolean overlaps(CandidateSegment candidate) {
        return session.equals(candidate.session()) && candidate.overlaps(start, end);
    }

    /** Line form {@code session start end attempt}. */
    public String toLine() {
        return session + " " + start + " " + end + " " + attempt;
    }
}
