// file: client/src/test/java/io/treekv/client/CliTest.java
package io.treekv.client;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    private HttpServer server;
    private String baseUrl;
    private final List<String> seen = new CopyOnWriteArrayList<>();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            String ifMatch = ex.getRequestHeaders().getFirst("If-Match");
            byte[] in = ex.getRequestBody().readAllBytes();
            seen.add(ex.getRequestMethod() + " " + ex.getRequestURI().getRawPath()
                    + (ifMatch != null ? " if-match=" + ifMatch : "")
                    + (in.length > 0 ? " body=" + new String(in, StandardCharsets.UTF_8) : ""));
            String path = ex.getRequestURI().getRawPath();
            switch (ex.getRequestMethod() + " " + path) {
                case "GET /notes" -> reply(ex, 200, "today\ntomorrow\n");
                case "GET /notes/today" -> reply(ex, 200, "buy milk");
                case "HEAD /notes/today" -> {
                    ex.getResponseHeaders().add("ETag", "abc=");
                    ex.getResponseHeaders().add("Content-Type", "text/plain");
                    ex.sendResponseHeaders(200, -1);
                    ex.close();
                }
                case "PUT /notes/today" -> {
                    ex.getResponseHeaders().add("ETag", "xyz=");
                    ex.sendResponseHeaders(201, -1);
                    ex.close();
                }
                case "PUT /photos" -> reply(ex, 200, "");
                case "DELETE /notes/today" -> {
                    ex.sendResponseHeaders(204, -1);
                    ex.close();
                }
                default -> reply(ex, 404, "Not found\n");
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private static void reply(com.sun.net.httpserver.HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            ex.getResponseBody().write(bytes);
        }
        ex.close();
    }

    private record Result(int code, String out, String err) {}

    private Result cli(String... args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        String[] full = new String[args.length + 2];
        full[0] = "--base-url";
        full[1] = baseUrl;
        System.arraycopy(args, 0, full, 2, args.length);
        int code = Cli.run(full, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    @Test
    void ls_prints_listing() {
        Result r = cli("ls", "/notes");
        assertEquals(0, r.code());
        assertEquals("today\ntomorrow\n", r.out());
    }

    @Test
    void get_prints_value_bytes() {
        Result r = cli("get", "notes/today");
        assertEquals(0, r.code());
        assertEquals("buy milk", r.out());
        assertEquals("GET /notes/today", seen.get(0));
    }

    @Test
    void head_prints_selected_headers() {
        Result r = cli("head", "/notes/today");
        assertEquals(0, r.code());
        assertTrue(r.out().contains("ETag: abc="));
        assertTrue(r.out().contains("Content-Type: text/plain"));
    }

    @Test
    void put_sends_body_and_reports_etag() {
        Result r = cli("put", "--type", "text/plain", "/notes/today", "buy milk");
        assertEquals(0, r.code());
        assertEquals("created xyz=\n", r.out());
        assertEquals("PUT /notes/today body=buy milk", seen.get(0));
    }

    @Test
    void mkdir_and_rm_with_if_match() {
        assertEquals(0, cli("mkdir", "/photos").code());
        Result r = cli("rm", "--if-match", "abc=", "/notes/today");
        assertEquals(0, r.code());
        assertEquals("OK\n", r.out());
        assertEquals("DELETE /notes/today if-match=abc=", seen.get(1));
    }

    @Test
    void non_2xx_is_reported_with_status_and_body() {
        Result r = cli("get", "/missing");
        assertEquals(1, r.code());
        assertEquals("error: get failed (404): Not found\n", r.err());
    }

    @Test
    void usage_errors_exit_1_without_contacting_server() {
        Result missing = cli();
        assertEquals(1, missing.code());
        assertTrue(missing.err().startsWith("error: missing command"));

        Result unknown = cli("frobnicate", "/x");
        assertEquals(1, unknown.code());
        assertTrue(unknown.err().contains("unknown command: frobnicate"));

        Result badPut = cli("put", "/only-path");
        assertEquals(1, badPut.code());
        assertTrue(seen.isEmpty());
    }
}
