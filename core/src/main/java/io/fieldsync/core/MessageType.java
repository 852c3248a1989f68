package io.fieldsync.core;

/**
 * Routing discriminator carried by every record.
 * <p>
 * The sync path treats it as an opaque tag; only the cloud side routes on it.
 * Downlink types (gateway to node) have a fixed priority that a received record
 * must declare.
 */
public enum MessageType {
    // uplink
    EVIDENCE((byte) 0x01, null),
    DETECTION((byte) 0x02, null),
    HEALTH((byte) 0x03, null),
    ALERT((byte) 0x04, null),
    TRACK((byte) 0x05, null),
    TELEMETRY((byte) 0x06, null),
    DEBUG_LOG((byte) 0x07, null),
    GENERIC((byte) 0x0F, null),

    // downlink
    MODEL_UPDATE((byte) 0x20, Priority.P2),
    CONFIG_CHANGE((byte) 0x21, Priority.P1),
    THREAT_INTEL((byte) 0x22, Priority.P1),
    TIME_SYNC((byte) 0x23, Priority.P3),
    OPERATOR_COMMAND((byte) 0x24, Priority.P0);

    private final byte tag;
    private final Priority downlinkPriority;

    MessageType(byte tag, Priority downlinkPriority) {
        this.tag = tag;
        this.downlinkPriority = downlinkPriority;
    }

    public byte tag() { return tag; }

    public boolean isDownlink() { return downlinkPriority != null; }

    /** @return the table priority of a downlink type, or null for uplink types. */
    public Priority downlinkPriority() { return downlinkPriority; }

    public static MessageType fromTag(byte tag) {
        for (MessageType t : values()) {
            if (t.tag == tag) return t;
        }
        throw new IllegalArgumentException("unknown message type tag: 0x" + Integer.toHexString(tag & 0xFF));
    }

    /** Lenient name lookup used by the admin API ("detection", "DEBUG_LOG", ...). */
    public static MessageType fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("msgType must not be empty");
        }
        String normalized = raw.trim().replace('-', '_');
        for (MessageType t : values()) {
            if (t.name().equalsIgnoreCase(normalized)) return t;
        }
        throw new IllegalArgumentException("unknown msgType: " + raw);
    }
}
