// file: core/src/main/java/io/treekv/core/ByteRange.java
package io.treekv.core;

/**
 * One satisfiable span of a Range request, both ends inclusive.
 */
public record ByteRange(long start, long end) {
    public ByteRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span " + start + "-" + end);
        }
    }

    public long length() {
        return end - start + 1;
    }
}
