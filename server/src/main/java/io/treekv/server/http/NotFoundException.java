// file: server/src/main/java/io/treekv/server/http/NotFoundException.java
package io.treekv.server.http;

public class NotFoundException extends HttpException {
    public NotFoundException() {
        this("Not found");
    }

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public int status() {
        return 404;
    }
}
