package com.jreinhal.annotator.store;

/**
 * Outcome of {@link RecordStore#save}. Failures are values, not exceptions, so callers
 * cannot lose track of a rejected write.
 */
public record SaveResult(Status status, String recordId, String message) {
    public enum Status {
        SAVED,
        NOT_FOUND,
        CONFLICT,
        IO_ERROR
    }

    public static SaveResult saved(String recordId) {
        return new SaveResult(Status.SAVED, recordId, "Saved record " + recordId);
    }

    public static SaveResult notFound(String recordId) {
        return new SaveResult(Status.NOT_FOUND, recordId, "Record " + recordId + " no longer exists");
    }

    public static SaveResult conflict(String recordId, String message) {
        return new SaveResult(Status.CONFLICT, recordId, message);
    }

    public static SaveResult ioError(String recordId, String message) {
        return new SaveResult(Status.IO_ERROR, recordId, message);
    }

    public boolean isSuccess() {
        return status == Status.SAVED;
    }
}
