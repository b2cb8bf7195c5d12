package com.phillippitts.parlcorpus.exception;

/**
 * Thrown when a session transcript document cannot be read as a whole.
 * Individual malformed statements are skipped instead.
 */
public class TranscriptParseException extends ParlCorpusException {

    private final String session;

    public TranscriptParseException(String session, String message) {
        super("Unreadable transcript for session " + session + ": " + message);
        this.session = session;
    }

    public TranscriptParseException(String session, String message, Throwable cause) {
        super("Unreadable transcript for session " + session + ": " + message, cause);
        this.session = session;
    }

    public String getSession() {
        return session;
    }
}
