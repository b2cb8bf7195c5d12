package com.phillippitts.parlcorpus.domain;

import java.util.List;
import java.util.Objects;

/**
 * Ordered speech turns of one session together with the flattened reference word index.
 *
 * @param session      session id
 * @param turns        turns in transcript order
 * @param skippedTurns number of malformed statements the parser skipped
 */
public record SessionTranscript(SessionId session, List<SpeechTurn> turns, int skippedTurns) {

    public SessionTranscript {
        Objects.requireNonNull(session, "session");
        turns = List.copyOf(Objects.requireNonNull(turns, "turns"));
        if (skippedTurns < 0) {
            throw new IllegalArgumentException("skippedTurns must not be negative");
        }
    }

    /**
     * Returns a copy holding the given turns, keeping the session and skip count.
     */
    public SessionTranscript withTurns(List<SpeechTurn> updated) {
        return new SessionTranscript(session, updated, skippedTurns);
    }

    /**
     * Builds the reference word index over the canonical text of all turns.
     */
    public ReferenceWords referenceWords() {
        return ReferenceWords.of(turns);
    }
}
