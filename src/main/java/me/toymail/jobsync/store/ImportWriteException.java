package me.toymail.jobsync.store;

/**
 * A single record could not be written. The surrounding import continues.
 */
public class ImportWriteException extends RuntimeException {
    public ImportWriteException(String message) {
        super(message);
    }

    public ImportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
