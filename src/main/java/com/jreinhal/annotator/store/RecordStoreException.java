package com.jreinhal.annotator.store;

public class RecordStoreException extends RuntimeException {
    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
