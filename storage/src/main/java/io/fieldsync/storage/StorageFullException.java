package io.fieldsync.storage;

import io.fieldsync.core.Priority;

/**
 * The quota cannot hold an incoming record even after evicting everything the
 * record is allowed to displace. Fatal for that record only.
 */
public class StorageFullException extends RuntimeException {
    private final Priority priority;
    private final long requiredBytes;

    public StorageFullException(Priority priority, long requiredBytes, long usedBytes, long quotaBytes) {
        super("storage full: cannot fit " + requiredBytes + " bytes of " + priority
                + " (used " + usedBytes + " of " + quotaBytes + ")");
        this.priority = priority;
        this.requiredBytes = requiredBytes;
    }

    public Priority priority() {
        return priority;
    }

    public long requiredBytes() {
        return requiredBytes;
    }
}
