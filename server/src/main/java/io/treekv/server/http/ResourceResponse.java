// file: server/src/main/java/io/treekv/server/http/ResourceResponse.java
package io.treekv.server.http;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response produced by {@link ResourceDispatcher}, written to the wire by the
 * HTTP adapter. Headers keep insertion order; the body may be empty.
 */
public final class ResourceResponse {
    public static final String TEXT_PLAIN = "text/plain; charset=utf-8";

    private int status;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private byte[] body = new byte[0];
    private long storageMillis = -1L;
    private Throwable cause;

    public ResourceResponse(int status) {
        this.status = status;
    }

    public static ResourceResponse failure(HttpException e) {
        ResourceResponse r = new ResourceResponse(e.status())
                .header("Content-Type", TEXT_PLAIN)
                .header("X-Content-Type-Options", "nosniff")
                .body((e.getMessage() + "\n").getBytes(StandardCharsets.UTF_8));
        e.decorate(r);
        return r.cause(e);
    }

    public ResourceResponse status(int status) {
        this.status = status;
        return this;
    }

    public ResourceResponse header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public ResourceResponse headers(Map<String, String> more) {
        headers.putAll(more);
        return this;
    }

    public ResourceResponse body(byte[] body) {
        this.body = body;
        return this;
    }

    /** Time spent inside the store transaction, or -1 if none was opened. */
    public ResourceResponse storageMillis(long millis) {
        this.storageMillis = millis;
        return this;
    }

    /** Failure behind an error response, kept for request logging. */
    public ResourceResponse cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public int status() {
        return status;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public String header(String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    public byte[] body() {
        return body;
    }

    public long storageMillis() {
        return storageMillis;
    }

    public Throwable cause() {
        return cause;
    }
}
