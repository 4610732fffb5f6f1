package com.jreinhal.annotator.store;

public class InterchangeFormatException extends RecordStoreException {
    private final int lineNumber;

    public InterchangeFormatException(int lineNumber, String message, Throwable cause) {
        super("Line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return this.lineNumber;
    }
}
