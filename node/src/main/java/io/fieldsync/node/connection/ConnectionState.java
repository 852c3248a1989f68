package io.fieldsync.node.connection;

import java.util.Optional;

/**
 * Link state as seen by the sync engine.
 * <p>
 * Owned by {@link ConnectionManager}; every other component only reads it.
 */
public sealed interface ConnectionState
        permits ConnectionState.Disconnected,
                ConnectionState.Connecting,
                ConnectionState.Connected,
                ConnectionState.Authenticated,
                ConnectionState.Degraded {

    record Disconnected() implements ConnectionState {
    }

    /** {@code attempts} counts the attempt in progress, starting at 1. */
    record Connecting(int attempts) implements ConnectionState {
        public Connecting {
            if (attempts < 1) {
                throw new IllegalArgumentException("attempts must be >= 1, got " + attempts);
            }
        }
    }

    record Connected() implements ConnectionState {
    }

    record Authenticated(String sessionId) implements ConnectionState {
    }

    /** Authenticated, but link quality is below the degrade threshold. */
    record Degraded(String sessionId, double quality) implements ConnectionState {
    }

    /** True when records may be sent (Authenticated or Degraded). */
    default boolean canSend() {
        return this instanceof Authenticated || this instanceof Degraded;
    }

    default Optional<String> session() {
        if (this instanceof Authenticated a) return Optional.of(a.sessionId());
        if (this instanceof Degraded d) return Optional.of(d.sessionId());
        return Optional.empty();
    }

    /** Short name for logs and status output. */
    default String label() {
        return getClass().getSimpleName().toUpperCase();
    }
}
