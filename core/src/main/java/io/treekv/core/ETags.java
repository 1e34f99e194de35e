// file: core/src/main/java/io/treekv/core/ETags.java
package io.treekv.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;

/**
 * Content fingerprints used as HTTP entity tags.
 *
 * An ETag is the standard Base64 encoding of the big-endian 64-bit FNV-1a
 * hash of the value bytes (always 12 characters). It depends only on the
 * bytes, so rewriting identical content yields the identical tag.
 */
public final class ETags {
    private static final long FNV64_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV64_PRIME = 0x100000001b3L;

    private ETags() {
        // utility
    }

    /** Compute the ETag for a value. */
    public static String of(byte[] value) {
        long h = fnv1a64(value);
        byte[] sum = ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN).putLong(h).array();
        return Base64.getEncoder().encodeToString(sum);
    }

    static long fnv1a64(byte[] data) {
        long h = FNV64_OFFSET_BASIS;
        for (byte b : data) {
            h ^= (b & 0xff);
            h *= FNV64_PRIME;
        }
        return h;
    }
}
