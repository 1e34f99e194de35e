// file: server/src/main/java/io/treekv/server/http/ConflictException.java
package io.treekv.server.http;

public class ConflictException extends HttpException {
    public ConflictException() {
        this("Conflict.");
    }

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public int status() {
        return 409;
    }
}
