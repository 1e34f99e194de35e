// file: server/src/main/java/io/treekv/server/http/ResourceRequest.java
package io.treekv.server.http;

import java.io.InputStream;

/**
 * Transport-independent view of one HTTP request.
 *
 * @param method        request verb, upper case
 * @param escapedPath   path exactly as sent, percent-escapes intact
 * @param headers       request headers
 * @param contentLength declared Content-Length, or -1 when absent
 * @param body          request body stream; read at most once
 */
public record ResourceRequest(
        String method,
        String escapedPath,
        RequestHeaders headers,
        long contentLength,
        InputStream body
) {
    /** True when a body is being sent without a length (chunked transfer). */
    public boolean chunked() {
        String te = headers.first("Transfer-Encoding");
        return contentLength < 0 && te != null && !te.isBlank() && !"identity".equalsIgnoreCase(te.trim());
    }

    /** Request without a body. */
    public static ResourceRequest of(String method, String path, RequestHeaders headers) {
        return new ResourceRequest(method, path, headers, -1, InputStream.nullInputStream());
    }
}
