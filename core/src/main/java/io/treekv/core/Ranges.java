// file: core/src/main/java/io/treekv/core/Ranges.java
package io.treekv.core;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Parser and slicer for "Range: bytes=..." requests.
 *
 * Accepted span forms (comma separated):
 *   - "a-b"  bytes a..b inclusive
 *   - "a-"   byte a to the end
 *   - "-n"   the last n bytes
 *
 * Failure modes:
 *   - unit other than "bytes", non-numeric bounds, a > b
 *       -> IllegalArgumentException (client error, 400)
 *   - no spans, any start >= length, any explicit end >= length, "-0"
 *       -> UnsatisfiableRangeException (416)
 *
 * Spans are returned in header order; overlapping or repeated spans are
 * kept as written and never merged.
 */
public final class Ranges {
    private static final String BYTES_UNIT = "bytes";

    private Ranges() {
        // utility
    }

    public static List<ByteRange> parse(String header, long length) {
        if (header == null) {
            throw new IllegalArgumentException("missing Range header");
        }
        int eq = header.indexOf('=');
        if (eq < 0) {
            throw new IllegalArgumentException("malformed Range header: " + header);
        }
        String unit = header.substring(0, eq).trim();
        if (!BYTES_UNIT.equalsIgnoreCase(unit)) {
            throw new IllegalArgumentException("unsupported range unit: " + unit);
        }

        List<ByteRange> spans = new ArrayList<>();
        for (String raw : header.substring(eq + 1).split(",")) {
            String spec = raw.trim();
            if (spec.isEmpty()) continue;
            spans.add(parseSpan(spec, length));
        }
        if (spans.isEmpty()) {
            throw new UnsatisfiableRangeException("no ranges requested", length);
        }
        return List.copyOf(spans);
    }

    /** Concatenate the requested spans of 'value' in order. */
    public static byte[] slice(byte[] value, List<ByteRange> spans) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (ByteRange r : spans) {
            out.write(value, (int) r.start(), (int) r.length());
        }
        return out.toByteArray();
    }

    /** Content-Range value for a single span, e.g. "bytes 0-2/9". */
    public static String contentRange(ByteRange r, long length) {
        return BYTES_UNIT + " " + r.start() + "-" + r.end() + "/" + length;
    }

    /** Content-Range value sent alongside a 416. */
    public static String unsatisfiedContentRange(long length) {
        return BYTES_UNIT + " */" + length;
    }

    private static ByteRange parseSpan(String spec, long length) {
        int dash = spec.indexOf('-');
        if (dash < 0) {
            throw new IllegalArgumentException("malformed range spec: " + spec);
        }
        String first = spec.substring(0, dash).trim();
        String second = spec.substring(dash + 1).trim();

        if (first.isEmpty()) {
            long suffix = number(second, spec);
            if (suffix == 0 || length == 0) {
                throw new UnsatisfiableRangeException("empty suffix range: " + spec, length);
            }
            return new ByteRange(Math.max(0, length - suffix), length - 1);
        }

        long start = number(first, spec);
        if (second.isEmpty()) {
            if (start >= length) {
                throw new UnsatisfiableRangeException("range start beyond content: " + spec, length);
            }
            return new ByteRange(start, length - 1);
        }

        long end = number(second, spec);
        if (start > end) {
            throw new IllegalArgumentException("range start after end: " + spec);
        }
        if (start >= length || end >= length) {
            throw new UnsatisfiableRangeException("range beyond content: " + spec, length);
        }
        return new ByteRange(start, end);
    }

    private static long number(String s, String spec) {
        if (s.isEmpty()) {
            throw new IllegalArgumentException("malformed range spec: " + spec);
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("malformed range spec: " + spec);
            }
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("malformed range spec: " + spec, e);
        }
    }
}
