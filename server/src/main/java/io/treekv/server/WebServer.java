// file: server/src/main/java/io/treekv/server/WebServer.java
package io.treekv.server;

import io.treekv.server.auth.CsrfHandler;
import io.treekv.server.http.RequestHeaders;
import io.treekv.server.http.ResourceDispatcher;
import io.treekv.server.http.ResourceRequest;
import io.treekv.server.http.ResourceResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.HeaderValues;
import io.undertow.util.HttpString;

import java.nio.ByteBuffer;

/**
 * Thin Undertow adapter over {@link ResourceDispatcher}.
 *
 * Responsibilities:
 *  - Hand each request to a worker thread (blocking body reads).
 *  - Convert the exchange into a {@link ResourceRequest}, keeping the path
 *    in its escaped form.
 *  - Write the {@link ResourceResponse} back and log the request.
 *  - Optionally wrap everything in {@link CsrfHandler}.
 */
public final class WebServer {
    private final Undertow server;

    public WebServer(String host, int port, ResourceDispatcher dispatcher) {
        this(host, port, dispatcher, null);
    }

    /**
     * @param csrfKey 32-byte CSRF signing key, or null to serve without CSRF protection
     */
    public WebServer(String host, int port, ResourceDispatcher dispatcher, byte[] csrfKey) {
        HttpHandler core = new BlockingHandler(exchange -> serve(exchange, dispatcher));
        HttpHandler root = csrfKey == null ? core : new CsrfHandler(core, csrfKey);

        this.server = Undertow.builder()
                .addHttpListener(port, host)
                .setHandler(root)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private static void serve(HttpServerExchange exchange, ResourceDispatcher dispatcher) {
        long start = System.nanoTime();
        String method = exchange.getRequestMethod().toString();
        String path = escapedPath(exchange.getRequestURI());

        RequestHeaders headers = new RequestHeaders();
        for (HeaderValues values : exchange.getRequestHeaders()) {
            String name = values.getHeaderName().toString();
            for (String v : values) {
                headers.add(name, v);
            }
        }

        ResourceResponse resp = dispatcher.handle(new ResourceRequest(
                method, path, headers, exchange.getRequestContentLength(), exchange.getInputStream()));

        boolean head = "HEAD".equals(method);
        exchange.setStatusCode(resp.status());
        resp.headers().forEach((name, value) -> {
            // Undertow sizes the body itself; only HEAD echoes the stored length
            if (head || !"Content-Length".equalsIgnoreCase(name)) {
                exchange.getResponseHeaders().put(new HttpString(name), value);
            }
        });
        if (!head && resp.body().length > 0) {
            exchange.getResponseSender().send(ByteBuffer.wrap(resp.body()));
        }

        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.served(method, path, resp, totalMs);
    }

    /** Strip scheme and authority from an absolute-form request target. */
    static String escapedPath(String requestUri) {
        int scheme = requestUri.indexOf("://");
        if (scheme < 0 || requestUri.startsWith("/")) {
            return requestUri;
        }
        int slash = requestUri.indexOf('/', scheme + 3);
        return slash < 0 ? "/" : requestUri.substring(slash);
    }
}
