package com.jreinhal.annotator.store;

/**
 * The backing medium could not be read or written. Fatal for the current operation and
 * never retried automatically.
 */
public class StoreUnavailableException extends RecordStoreException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
