package com.phillippitts.parlcorpus.exception;

/**
 * Base exception for all parl-corpus application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ParlCorpusException extends RuntimeException {

    public ParlCorpusException(String message) {
        super(message);
    }

    public ParlCorpusException(String message, Throwable cause) {
        super(message, cause);
    }

    public ParlCorpusException(Throwable cause) {
        super(cause);
    }
}
