package io.fieldsync.node.alert;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Default alert path: one log line per alert at the kind's level, plus a
 * per-kind counter reported through /admin/status.
 */
public final class LoggingAlerts implements OperationalAlerts {
    private static final Logger log = Logger.getLogger(LoggingAlerts.class.getName());

    private final ConcurrentHashMap<AlertKind, AtomicLong> counts = new ConcurrentHashMap<>();

    @Override
    public void raise(AlertKind kind, String message) {
        counts.computeIfAbsent(kind, k -> new AtomicLong()).incrementAndGet();
        log.log(kind.level(), "ALERT " + kind + ": " + message);
    }

    @Override
    public Map<AlertKind, Long> counts() {
        Map<AlertKind, Long> out = new EnumMap<>(AlertKind.class);
        counts.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }

    public long count(AlertKind kind) {
        AtomicLong c = counts.get(kind);
        return c == null ? 0L : c.get();
    }
}
