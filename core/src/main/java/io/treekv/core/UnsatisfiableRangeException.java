// file: core/src/main/java/io/treekv/core/UnsatisfiableRangeException.java
package io.treekv.core;

/**
 * Thrown when a well-formed Range header selects nothing inside the value.
 * Maps to 416 Requested Range Not Satisfiable.
 */
public final class UnsatisfiableRangeException extends RuntimeException {
    private final long contentLength;

    public UnsatisfiableRangeException(String message, long contentLength) {
        super(message);
        this.contentLength = contentLength;
    }

    public long contentLength() {
        return contentLength;
    }
}
