// file: server/src/main/java/io/treekv/server/RequestLogger.java
package io.treekv.server;

import io.treekv.server.http.ResourceResponse;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Access log: one line per HTTP exchange, e.g.
 * {@code HTTP PUT /a/b -> 201 (total=3ms, storage=2ms)}.
 * Server errors are logged at WARNING together with their cause.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
    }

    /** Exchange answered by the dispatcher. */
    public static void served(String method, String path, ResourceResponse resp, long totalMillis) {
        write(resp.status(), line(method, path, resp.status(), totalMillis, resp.storageMillis()), resp.cause());
    }

    /** Exchange answered before reaching the dispatcher (no storage time). */
    public static void rejected(String method, String path, int status) {
        write(status, line(method, path, status, 0, -1), null);
    }

    static String line(String method, String path, int status, long totalMillis, long storageMillis) {
        StringBuilder sb = new StringBuilder("HTTP ").append(method).append(' ').append(path)
                .append(" -> ").append(status)
                .append(" (total=").append(totalMillis).append("ms");
        if (storageMillis >= 0) {
            sb.append(", storage=").append(storageMillis).append("ms");
        }
        return sb.append(')').toString();
    }

    private static void write(int status, String line, Throwable error) {
        Level level = status >= 500 ? Level.WARNING : Level.INFO;
        if (log.isLoggable(level)) {
            log.log(level, line, error);
        }
    }
}
