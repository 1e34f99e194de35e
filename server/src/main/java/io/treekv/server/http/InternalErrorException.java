// file: server/src/main/java/io/treekv/server/http/InternalErrorException.java
package io.treekv.server.http;

/**
 * Broken server-side invariant (for example a value without its metadata record).
 * Logged by the dispatcher with its cause; the client only sees the message.
 */
public class InternalErrorException extends HttpException {
    public InternalErrorException(String message) {
        super(message);
    }

    public InternalErrorException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int status() {
        return 500;
    }
}
