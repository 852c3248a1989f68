package io.fieldsync.node.downlink;

import io.fieldsync.core.SyncRecord;

/** Consumer of one downlink message type (model updates, config changes, ...). */
@FunctionalInterface
public interface DownlinkHandler {
    void handle(SyncRecord record);
}
