package com.jreinhal.annotator.store;

public class ExportFailedException extends RecordStoreException {
    public enum Reason {
        PERMISSION_DENIED,
        IO_ERROR
    }

    private final Reason reason;

    public ExportFailedException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return this.reason;
    }
}
