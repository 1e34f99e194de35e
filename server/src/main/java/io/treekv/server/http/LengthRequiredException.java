// file: server/src/main/java/io/treekv/server/http/LengthRequiredException.java
package io.treekv.server.http;

public class LengthRequiredException extends HttpException {
    public LengthRequiredException() {
        this("Length required.");
    }

    public LengthRequiredException(String message) {
        super(message);
    }

    @Override
    public int status() {
        return 411;
    }
}
