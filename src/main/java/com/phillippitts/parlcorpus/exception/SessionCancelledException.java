package com.phillippitts.parlcorpus.exception;

/**
 * Thrown inside a session task that was cancelled (its worker thread interrupted) before it
 * wrote its intermediate files. The session's files from earlier runs are left untouched.
 */
public class SessionCancelledException extends ParlCorpusException {

    private final String session;

    public SessionCancelledException(String session) {
        super("Session " + session + " cancelled before writing its results");
        this.session = session;
    }

    public String getSession() {
        return session;
    }
}
