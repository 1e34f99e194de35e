// file: core/src/main/java/io/treekv/core/PathResolver.java
package io.treekv.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits request paths into bucket segments.
 *
 * Properties:
 *  - Pure: no I/O, no storage access.
 *  - The first segment is always the synthetic root "/".
 *  - Empty components (leading, trailing or repeated slashes) are dropped.
 *  - Segments are kept in their escaped form, so "/a/b%2fc" has two
 *    non-root segments: "a" and "b%2fc".
 */
public final class PathResolver {

    /** Name of the root bucket, and the first element of every split path. */
    public static final String ROOT = "/";

    private PathResolver() {
        // utility
    }

    /**
     * Split an escaped path into ["/", seg1, seg2, ...].
     *
     * @param escapedPath raw request path, e.g. "/foo/bar"; null or "" means root
     */
    public static List<String> split(String escapedPath) {
        List<String> parts = new ArrayList<>();
        parts.add(ROOT);
        if (escapedPath == null || escapedPath.isEmpty()) {
            return List.copyOf(parts);
        }
        int start = 0;
        int len = escapedPath.length();
        for (int i = 0; i <= len; i++) {
            if (i == len || escapedPath.charAt(i) == '/') {
                if (i > start) {
                    parts.add(escapedPath.substring(start, i));
                }
                start = i + 1;
            }
        }
        return List.copyOf(parts);
    }

    /** Number of segments below the root: "/" -> 0, "/a" -> 1, "/a/b" -> 2. */
    public static int depth(List<String> segments) {
        return segments.size() - 1;
    }

    /**
     * Canonical escaped path for a split path: "/" for the root, otherwise
     * "/" + segments joined by "/". Used as the metadata key.
     */
    public static String canonical(List<String> segments) {
        if (segments.size() <= 1) {
            return ROOT;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < segments.size(); i++) {
            sb.append('/').append(segments.get(i));
        }
        return sb.toString();
    }

    /** Segments of the enclosing bucket (all but the last); the root stays the root. */
    public static List<String> parent(List<String> segments) {
        if (segments.size() <= 1) {
            return segments;
        }
        return segments.subList(0, segments.size() - 1);
    }

    /** Last segment, or "/" for the root. */
    public static String last(List<String> segments) {
        return segments.get(segments.size() - 1);
    }
}
