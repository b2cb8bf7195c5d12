package com.phillippitts.parlcorpus.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * A validated, persisted training example: one speaker-attributed audio span with its text.
 *
 * <p>The utterance id is derived from the session and the time offsets, so two records with the
 * same id describe the same audio span. Records order by utterance id.
 *
 * @param uttId     {@code {session}-{start:08}-{end:08}}
 * @param session   session the audio belongs to
 * @param start     start offset in centiseconds
 * @param end       end offset in centiseconds, greater than {@code start}
 * @param speakerId resolved speaker or {@link SpeakerId#UNRESOLVED}
 * @param text      canonical text
 */
public record CorpusRecord(
        String uttId,
        SessionId session,
        long start,
        long end,
        SpeakerId speakerId,
        String text
) implements Comparable<CorpusRecord> {

    private static final Comparator<CorpusRecord> ORDER = Comparator
            .comparing(CorpusRecord::uttId)
            .thenComparing(r -> r.speakerId().value())
            .thenComparing(CorpusRecord::text);

    public CorpusRecord {
        Objects.requireNonNull(uttId, "uttId");
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(speakerId, "speakerId");
        Objects.requireNonNull(text, "text");
        if (start < 0) {
            throw new IllegalArgumentException("Start must not be negative, got: " + start);
        }
        if (start >= end) {
            throw new IllegalArgumentException("Start must be before end for " + uttId + ": "
                    + start + " >= " + end);
        }
        if (text.isBlank()) {
            throw new IllegalArgumentException("Text must not be blank for " + uttId);
        }
        String expected = utteranceId(session, start, end);
        if (!expected.equals(uttId)) {
            throw new IllegalArgumentException("Utterance id " + uttId + " does not match " + expected);
        }
    }

    /**
     * Creates a record, deriving the utterance id.
     */
    public static CorpusRecord of(SessionId session, long start, long end, SpeakerId speakerId, String text) {
        return new CorpusRecord(utteranceId(session, start, end), session, start, end, speakerId, text);
    }

    /**
     * Deterministic utterance id for a session time span.
     */
    public static String utteranceId(SessionId session, long start, long end) {
        return String.format("%s-%08d-%08d", session, start, end);
    }

    /** Sorts by utterance id, then by the remaining fields so conflicting variants stay adjacent. */
    @Override
    public int compareTo(CorpusRecord other) {
        return ORDER.compare(this, other);
    }
}
