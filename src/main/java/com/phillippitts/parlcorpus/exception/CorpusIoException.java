package com.phillippitts.parlcorpus.exception;

import java.io.IOException;

/**
 * Thrown when a pipeline file cannot be read or written.
 */
public class CorpusIoException extends ParlCorpusException {

    private final String path;

    public CorpusIoException(String action, Object path, IOException cause) {
        super("Failed to " + action + " " + path + ": " + cause.getMessage(), cause);
        this.path = String.valueOf(path);
    }

    public String getPath() {
        return path;
    }
}
