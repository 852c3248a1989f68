package io.fieldsync.node.alert;

import java.util.logging.Level;

/**
 * Operational conditions surfaced to the operator, with the log level the
 * default alert path uses for each.
 */
public enum AlertKind {
    STORAGE_FULL(Level.SEVERE),
    CHAIN_INTEGRITY(Level.SEVERE),
    AUTHENTICATION_FAILED(Level.WARNING),
    CLOCK_DRIFT(Level.WARNING),
    PERSISTENT_SEND_FAILURE(Level.WARNING),
    INGEST_OVERFLOW(Level.WARNING),
    DATA_EVICTED(Level.WARNING);

    private final Level level;

    AlertKind(Level level) {
        this.level = level;
    }

    public Level level() {
        return level;
    }
}
