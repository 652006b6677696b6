package io.lslite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the admin HTTP surface.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed admin request. Server errors go out at WARNING with the
     * cause attached; everything else at FINE, since monitoring polls these
     * endpoints constantly.
     *
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param error       exception behind a 5xx, null if none
     */
    public static void logRequest(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s -> %d (%dms)", method, path, status, totalMillis);
        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else {
            log.log(Level.FINE, msg);
        }
    }
}
