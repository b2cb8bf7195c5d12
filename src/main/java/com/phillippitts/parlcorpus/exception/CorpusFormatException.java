package com.phillippitts.parlcorpus.exception;

/**
 * Thrown when a line of a pipeline file (decoder output, intermediate records, corpus tables)
 * does not follow its format.
 */
public class CorpusFormatException extends ParlCorpusException {

    private final String file;
    private final int lineNumber;

    public CorpusFormatException(String file, int lineNumber, String reason) {
        super(file + ":" + lineNumber + ": " + reason);
        this.file = file;
        this.lineNumber = lineNumber;
    }

    public CorpusFormatException(String file, int lineNumber, String reason, Throwable cause) {
        super(file + ":" + lineNumber + ": " + reason, cause);
        this.file = file;
        this.lineNumber = lineNumber;
    }

    public String getFile() {
        return file;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
