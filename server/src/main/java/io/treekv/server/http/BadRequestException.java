// file: server/src/main/java/io/treekv/server/http/BadRequestException.java
package io.treekv.server.http;

public class BadRequestException extends HttpException {
    public BadRequestException() {
        this("Bad request.");
    }

    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int status() {
        return 400;
    }
}
