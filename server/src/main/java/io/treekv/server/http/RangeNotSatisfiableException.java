// file: server/src/main/java/io/treekv/server/http/RangeNotSatisfiableException.java
package io.treekv.server.http;

import io.treekv.core.Ranges;

/** Range header that selects nothing inside the stored value. */
public class RangeNotSatisfiableException extends HttpException {
    private final long contentLength;

    public RangeNotSatisfiableException(long contentLength, Throwable cause) {
        super("Requested range not satisfiable.", cause);
        this.contentLength = contentLength;
    }

    @Override
    public int status() {
        return 416;
    }

    @Override
    public void decorate(ResourceResponse response) {
        response.header("Content-Range", Ranges.unsatisfiedContentRange(contentLength));
    }
}
