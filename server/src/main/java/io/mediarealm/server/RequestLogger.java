package io.mediarealm.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log every HTTP request once: method, path, status and latency.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method        HTTP method
     * @param path          request path
     * @param user          caller username, or null for anonymous
     * @param status        HTTP status code
     * @param totalMillis   wall-clock latency for the whole request
     * @param storageMillis time spent in the stores / services, or -1 if not measured
     * @param error         exception behind a 5xx, null if none
     */
    public static void logRequest(
            String method,
            String path,
            String user,
            int status,
            long totalMillis,
            long storageMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s [%s] -> %d (total=%dms%s)",
                method,
                path,
                user == null ? "anonymous" : user,
                status,
                totalMillis,
                storageMillis >= 0 ? ", storage=" + storageMillis + "ms" : ""
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else if (status >= 400) {
            log.log(Level.FINE, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
