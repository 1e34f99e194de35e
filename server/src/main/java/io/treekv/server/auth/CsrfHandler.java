// file: server/src/main/java/io/treekv/server/auth/CsrfHandler.java
package io.treekv.server.auth;

import io.treekv.server.RequestLogger;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.Cookie;
import io.undertow.server.handlers.CookieImpl;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Set;

/**
 * Double-submit CSRF protection wrapped around the resource handler.
 * <p>
 * Responsibilities:
 *  - Keep a random 32-byte token in the "_csrf" cookie, signed with HMAC-SHA256
 *    under the configured key ("base64url(token).base64url(mac)").
 *  - On safe methods (GET, HEAD, OPTIONS, TRACE): issue the cookie if it is
 *    missing or forged, and expose a masked copy of the token in the
 *    X-CSRF-Token response header. The mask is a fresh one-time pad per
 *    response: base64(pad || pad XOR token).
 *  - On every other method: require the X-CSRF-Token request header to unmask
 *    to the cookie's token, otherwise answer 403 without calling the next handler.
 */
public final class CsrfHandler implements HttpHandler {
    public static final String COOKIE = "_csrf";
    public static final HttpString HEADER = new HttpString("X-CSRF-Token");
    public static final int TOKEN_BYTES = 32;

    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");
    private static final String HMAC = "HmacSHA256";
    private static final String FORBIDDEN = "Forbidden - CSRF token invalid\n";

    private final HttpHandler next;
    private final byte[] key;
    private final SecureRandom random = new SecureRandom();

    public CsrfHandler(HttpHandler next, byte[] key) {
        if (key.length != TOKEN_BYTES) {
            throw new IllegalArgumentException("CSRF key must be " + TOKEN_BYTES + " bytes, got " + key.length);
        }
        this.next = next;
        this.key = key.clone();
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String method = exchange.getRequestMethod().toString();
        byte[] token = tokenFromCookie(exchange.getRequestCookie(COOKIE));

        if (SAFE_METHODS.contains(method)) {
            if (token == null) {
                token = new byte[TOKEN_BYTES];
                random.nextBytes(token);
                exchange.setResponseCookie(new CookieImpl(COOKIE, sign(token))
                        .setPath("/")
                        .setHttpOnly(true));
            }
            exchange.getResponseHeaders().put(HEADER, mask(token));
            next.handleRequest(exchange);
            return;
        }

        byte[] sent = unmask(exchange.getRequestHeaders().getFirst(HEADER));
        if (token == null || sent == null || !MessageDigest.isEqual(token, sent)) {
            exchange.setStatusCode(403);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send(FORBIDDEN);
            RequestLogger.rejected(method, exchange.getRequestPath(), 403);
            return;
        }
        next.handleRequest(exchange);
    }

    // ---------- token encoding ----------

    String sign(byte[] token) {
        Base64.Encoder b64 = Base64.getUrlEncoder().withoutPadding();
        return b64.encodeToString(token) + "." + b64.encodeToString(hmacSHA256(key, token));
    }

    /** Token carried by a correctly signed cookie, else null. */
    byte[] tokenFromCookie(Cookie cookie) {
        if (cookie == null || cookie.getValue() == null) return null;
        String value = cookie.getValue();
        int dot = value.indexOf('.');
        if (dot < 0) return null;
        try {
            byte[] token = Base64.getUrlDecoder().decode(value.substring(0, dot));
            byte[] mac = Base64.getUrlDecoder().decode(value.substring(dot + 1));
            if (token.length != TOKEN_BYTES || !MessageDigest.isEqual(mac, hmacSHA256(key, token))) {
                return null;
            }
            return token;
        } catch (IllegalArgumentException badBase64) {
            return null;
        }
    }

    String mask(byte[] token) {
        byte[] pad = new byte[TOKEN_BYTES];
        random.nextBytes(pad);
        byte[] out = new byte[TOKEN_BYTES * 2];
        for (int i = 0; i < TOKEN_BYTES; i++) {
            out[i] = pad[i];
            out[TOKEN_BYTES + i] = (byte) (pad[i] ^ token[i]);
        }
        return Base64.getEncoder().encodeToString(out);
    }

    /** Reverse of {@link #mask}; null if the header is missing or malformed. */
    static byte[] unmask(String header) {
        if (header == null) return null;
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(header.trim().getBytes(StandardCharsets.US_ASCII));
        } catch (IllegalArgumentException badBase64) {
            return null;
        }
        if (raw.length != TOKEN_BYTES * 2) return null;
        byte[] token = new byte[TOKEN_BYTES];
        for (int i = 0; i < TOKEN_BYTES; i++) {
            token[i] = (byte) (raw[i] ^ raw[TOKEN_BYTES + i]);
        }
        return token;
    }

    private static byte[] hmacSHA256(byte[] key, byte[] data) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(key, HMAC));
            return mac.doFinal(data);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 failed", e);
        }
    }
}
