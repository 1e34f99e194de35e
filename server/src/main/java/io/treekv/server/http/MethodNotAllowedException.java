// file: server/src/main/java/io/treekv/server/http/MethodNotAllowedException.java
package io.treekv.server.http;

/** Unsupported verb. The response still advertises the supported ones. */
public class MethodNotAllowedException extends HttpException {
    public MethodNotAllowedException() {
        super("Method not allowed.");
    }

    @Override
    public int status() {
        return 405;
    }

    @Override
    public void decorate(ResourceResponse response) {
        response.header("Allow", ResourceDispatcher.ALLOW);
    }
}
