// file: node/src/main/java/io/fieldsync/node/RequestLogger.java
package io.fieldsync.node;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the admin API.
 *
 * Responsibilities:
 *  - Central place to log method/path/status and latency.
 *  - Warn on 5xx, with the exception when there is one.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param error       optional exception, null if none
     */
    public static void logRequest(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s -> %d (%dms)", method, path, status, totalMillis);

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 400) {
            log.log(Level.INFO, error == null ? msg : msg + ": " + error.getMessage());
        } else {
            log.log(Level.FINE, msg);
        }
    }
}
