package io.fieldsync.node.alert;

import java.util.Map;

/**
 * External alert path for conditions an operator has to know about.
 * <p>
 * Implementations must not throw and must be callable from any thread; alerts
 * are raised from the ingest worker, the sync loop and the storage eviction hook.
 */
public interface OperationalAlerts {

    void raise(AlertKind kind, String message);

    /** Alerts raised so far, per kind. */
    Map<AlertKind, Long> counts();
}
