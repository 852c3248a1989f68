package io.fieldsync.storage;

/**
 * An I/O failure in the local data store. Never swallowed: the operation that hit
 * it did not take effect.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
