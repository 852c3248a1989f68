package io.fieldsync.core.wire;

/** Bytes that do not decode into a well-formed record. */
public class WireFormatException extends RuntimeException {

    public WireFormatException(String message) {
        super(message);
    }

    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
