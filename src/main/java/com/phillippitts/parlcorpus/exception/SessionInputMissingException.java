package com.phillippitts.parlcorpus.exception;

/**
 * Thrown when a session lacks its transcript or its decoder output.
 * Aborts that session only.
 */
public class SessionInputMissingException extends ParlCorpusException {

    private final String session;
    private final String missingPath;

    public SessionInputMissingException(String session, String missingPath) {
        super("Missing input for session " + session + ": " + missingPath);
        this.session = session;
        this.missingPath = missingPath;
    }

    public String getSession() {
        return session;
    }

    public String getMissingPath() {
        return missingPath;
    }
}
