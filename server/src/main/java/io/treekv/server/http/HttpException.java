// file: server/src/main/java/io/treekv/server/http/HttpException.java
package io.treekv.server.http;

/**
 * Superclass for failures that translate directly into an HTTP status and a
 * short plain-text message. Thrown anywhere inside request handling (including
 * inside a transaction callback, which rolls the transaction back) and mapped
 * once by {@link ResourceDispatcher}.
 */
public abstract class HttpException extends RuntimeException {

    protected HttpException(String message) {
        super(message);
    }

    protected HttpException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract int status();

    /** Extra response headers for this failure; none by default. */
    public void decorate(ResourceResponse response) {
    }
}
