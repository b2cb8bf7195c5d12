package com.phillippitts.parlcorpus.exception;

/**
 * Thrown when the speaker lookup table exists but cannot be read or has no usable header.
 */
public class SpeakerTableException extends ParlCorpusException {

    private final String tablePath;

    public SpeakerTableException(String tablePath, Throwable cause) {
        super("Cannot read speaker table: " + tablePath, cause);
        this.tablePath = tablePath;
    }

    public SpeakerTableException(String tablePath, String reason) {
        super("Invalid speaker table " + tablePath + ": " + reason);
        this.tablePath = tablePath;
    }

    public String getTablePath() {
        return tablePath;
    }
}
