package io.fieldsync.node.sync;

/**
 * Result of one push. Network problems are values here, not exceptions, so the
 * sync loop handles every case in one place.
 */
public sealed interface PushOutcome
        permits PushOutcome.Acked, PushOutcome.Rejected, PushOutcome.TimedOut, PushOutcome.Failed {

    /** Positive ack for exactly the record that was sent. */
    record Acked(long latencyMillis) implements PushOutcome {
    }

    record Rejected(RejectReason reason, String detail) implements PushOutcome {
    }

    /** No answer within the ack timeout. */
    record TimedOut() implements PushOutcome {
    }

    /** Transport-level failure: channel down, unexpected status, ack for another id. */
    record Failed(String message, Throwable cause) implements PushOutcome {
    }
}
