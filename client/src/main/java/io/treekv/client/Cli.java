// file: client/src/main/java/io/treekv/client/Cli.java
package io.treekv.client;

import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Simple CLI for interacting with a running treekv server over HTTP.
 *
 * Usage:
 *   treekv-cli [--base-url http://host:port] ls <path>
 *   treekv-cli [--base-url http://host:port] get <path>
 *   treekv-cli [--base-url http://host:port] head <path>
 *   treekv-cli [--base-url http://host:port] put [--type <content-type>] <path> <value>
 *   treekv-cli [--base-url http://host:port] mkdir <path>
 *   treekv-cli [--base-url http://host:port] rm [--if-match <etag>] <path>
 *
 * Examples:
 *   treekv-cli mkdir /photos
 *   treekv-cli put --type text/plain /notes/today "buy milk"
 *   treekv-cli ls /notes
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    private static final String DEFAULT_TYPE = "text/plain; charset=utf-8";
    private static final String[] SHOWN_HEADERS = {"Content-Type", "Content-Length", "ETag", "Last-Modified"};

    private static final String USAGE = """
            Usage:
              treekv-cli [--base-url http://host:port] ls <path>
              treekv-cli [--base-url http://host:port] get <path>
              treekv-cli [--base-url http://host:port] head <path>
              treekv-cli [--base-url http://host:port] put [--type <content-type>] <path> <value>
              treekv-cli [--base-url http://host:port] mkdir <path>
              treekv-cli [--base-url http://host:port] rm [--if-match <etag>] <path>
            """;

    private final HttpClient http;
    private final String baseUrl;
    private final PrintStream out;

    Cli(String baseUrl, HttpClient http, PrintStream out) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Run one command; returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            Parsed p = Parsed.from(args);
            Cli cli = new Cli(p.baseUrl, HttpClient.newHttpClient(), out);
            cli.execute(p);
            return 0;
        } catch (UsageException e) {
            err.println("error: " + e.getMessage());
            err.print(USAGE);
            return 1;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("error: request failed: " + e.getMessage());
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("error: interrupted");
            return 2;
        }
    }

    void execute(Parsed p) throws IOException, InterruptedException {
        switch (p.command) {
            case "ls" -> ls(p.arg(0, "ls requires <path>"));
            case "get" -> get(p.arg(0, "get requires <path>"));
            case "head" -> head(p.arg(0, "head requires <path>"));
            case "put" -> {
                if (p.args.size() != 2) throw new UsageException("put requires <path> <value>");
                put(p.args.get(0), p.args.get(1), p.type != null ? p.type : DEFAULT_TYPE);
            }
            case "mkdir" -> mkdir(p.arg(0, "mkdir requires <path>"));
            case "rm" -> rm(p.arg(0, "rm requires <path>"), p.ifMatch);
            default -> throw new UsageException("unknown command: " + p.command);
        }
    }

    // ---------- commands ----------

    private void ls(String path) throws IOException, InterruptedException {
        HttpResponse<String> resp = send("ls", request(path).header("Accept", "text/plain").GET(),
                HttpResponse.BodyHandlers.ofString());
        out.print(resp.body());
    }

    private void get(String path) throws IOException, InterruptedException {
        HttpResponse<byte[]> resp = send("get", request(path).GET(), HttpResponse.BodyHandlers.ofByteArray());
        out.write(resp.body(), 0, resp.body().length);
        out.flush();
    }

    private void head(String path) throws IOException, InterruptedException {
        HttpResponse<Void> resp = send("head",
                request(path).method("HEAD", HttpRequest.BodyPublishers.noBody()),
                HttpResponse.BodyHandlers.discarding());
        for (String name : SHOWN_HEADERS) {
            resp.headers().firstValue(name).ifPresent(v -> out.println(name + ": " + v));
        }
    }

    private void put(String path, String value, String type) throws IOException, InterruptedException {
        HttpResponse<String> resp = send("put",
                request(path).header("Content-Type", type)
                        .PUT(HttpRequest.BodyPublishers.ofString(value, StandardCharsets.UTF_8)),
                HttpResponse.BodyHandlers.ofString());
        out.println((resp.statusCode() == 201 ? "created " : "updated ")
                + resp.headers().firstValue("ETag").orElse(""));
    }

    private void mkdir(String path) throws IOException, InterruptedException {
        send("mkdir", request(path).PUT(HttpRequest.BodyPublishers.noBody()), HttpResponse.BodyHandlers.ofString());
        out.println("OK");
    }

    private void rm(String path, String ifMatch) throws IOException, InterruptedException {
        HttpRequest.Builder b = request(path).DELETE();
        if (ifMatch != null) {
            b.header("If-Match", ifMatch);
        }
        send("rm", b, HttpResponse.BodyHandlers.ofString());
        out.println("OK");
    }

    // ---------- helpers ----------

    private HttpRequest.Builder request(String path) {
        String p = path.startsWith("/") ? path : "/" + path;
        return HttpRequest.newBuilder().uri(URI.create(baseUrl + p));
    }

    /** Send and fail with the status and body on any non-2xx response. */
    private <T> HttpResponse<T> send(String cmd, HttpRequest.Builder b, HttpResponse.BodyHandler<T> handler)
            throws IOException, InterruptedException {
        HttpResponse<T> resp = http.send(b.build(), handler);
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            Object body = resp.body();
            String text = body instanceof byte[] bytes ? new String(bytes, StandardCharsets.UTF_8)
                    : body == null ? "" : body.toString();
            throw new CliException(cmd + " failed (" + status + "): " + text.strip());
        }
        return resp;
    }

    /** Command line after flag extraction. */
    static final class Parsed {
        String baseUrl = DEFAULT_BASE_URL;
        String command;
        String type;
        String ifMatch;
        final List<String> args = new ArrayList<>();

        static Parsed from(String[] argv) {
            Parsed p = new Parsed();
            for (int i = 0; i < argv.length; i++) {
                switch (argv[i]) {
                    case "--base-url" -> p.baseUrl = value(argv, ++i, "--base-url");
                    case "--type" -> p.type = value(argv, ++i, "--type");
                    case "--if-match" -> p.ifMatch = value(argv, ++i, "--if-match");
                    default -> {
                        if (p.command == null) p.command = argv[i];
                        else p.args.add(argv[i]);
                    }
                }
            }
            if (p.command == null) {
                throw new UsageException("missing command");
            }
            return p;
        }

        String arg(int index, String usage) {
            if (args.size() != index + 1) throw new UsageException(usage);
            return args.get(index);
        }

        private static String value(String[] argv, int i, String flag) {
            if (i >= argv.length) throw new UsageException(flag + " requires a value");
            return argv[i];
        }
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }

    static final class UsageException extends RuntimeException {
        UsageException(String msg) {
            super(msg);
        }
    }
}
