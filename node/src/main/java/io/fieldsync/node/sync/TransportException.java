package io.fieldsync.node.sync;

/**
 * Connect, handshake or downlink call failed at the transport level.
 * {@link #sessionRejected()} is set when the gateway no longer knows the session.
 */
public class TransportException extends RuntimeException {
    private final boolean sessionRejected;

    public TransportException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public TransportException(String message, Throwable cause, boolean sessionRejected) {
        super(message, cause);
        this.sessionRejected = sessionRejected;
    }

    public boolean sessionRejected() {
        return sessionRejected;
    }
}
