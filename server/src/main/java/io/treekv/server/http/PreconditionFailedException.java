// file: server/src/main/java/io/treekv/server/http/PreconditionFailedException.java
package io.treekv.server.http;

public class PreconditionFailedException extends HttpException {
    public PreconditionFailedException() {
        this("Precondition failed.");
    }

    public PreconditionFailedException(String message) {
        super(message);
    }

    @Override
    public int status() {
        return 412;
    }
}
