package com.phillippitts.parlcorpus.domain;

/**
 * Canonical speaker identifier taken from the speaker lookup table.
 *
 * <p>Real ids are strictly positive. {@link #UNRESOLVED} (value 0) marks turns whose printed name
 * could not be mapped; it is kept in the corpus so those utterances can be reviewed manually and
 * can never be confused with a resolved speaker.
 *
 * @param value numeric id, 0 only for the sentinel
 */
public record SpeakerId(int value) {

    /** Sentinel for speakers that could not be resolved. */
    public static final SpeakerId UNRESOLVED = new SpeakerId(0);

    public SpeakerId {
        if (value < 0) {
            throw new IllegalArgumentException("Speaker id must not be negative, got: " + value);
        }
    }

    /**
     * Creates a resolved speaker id.
     *
     * @param value positive id from the lookup table
     * @return resolved speaker id
     * @throws IllegalArgumentException if value is not positive
     */
    public static SpeakerId of(int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Resolved speaker id must be positive, got: " + value);
        }
        return new SpeakerId(value);
    }

    /**
     * Parses the rendered form ({@code 01234} or {@code 1234}).
     */
    public static SpeakerId parse(String text) {
        try {
            return new SpeakerId(Integer.parseInt(text.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a speaker id: '" + text + "'", e);
        }
    }

    public boolean isResolved() {
        return value > 0;
    }

    @Override
    public String toString() {
        return String.format("%05d", value);
    }
}
