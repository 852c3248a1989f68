package io.fieldsync.node.ingest;

import java.util.UUID;

/**
 * Answer to a producer submit. {@code id} is assigned even when the record is refused,
 * so the producer can log it.
 */
public record SubmitResult(UUID id, boolean accepted, String reason) {

    static SubmitResult accepted(UUID id) {
        return new SubmitResult(id, true, null);
    }

    static SubmitResult refused(UUID id, String reason) {
        return new SubmitResult(id, false, reason);
    }
}
