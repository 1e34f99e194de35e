// file: core/src/main/java/io/treekv/core/Preconditions.java
package io.treekv.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluation of If-Match / If-None-Match against the stored metadata record.
 *
 * Both checks run against what is currently stored for the target path,
 * never against the value a client is about to write. Callers must evaluate
 * them inside the same transaction as the read or mutation they guard.
 *
 * Header values are passed as the raw header lines; each line may hold a
 * comma-separated list. A null or empty list means the header was absent.
 */
public final class Preconditions {

    public static final String ANY = "*";

    private Preconditions() {
        // utility
    }

    /**
     * Read path. True when the request should be answered "not modified":
     * a record exists and some listed tag is "*" or equals the stored ETag.
     */
    public static boolean ifNoneMatchHits(MetadataRecord stored, List<String> ifNoneMatch) {
        if (stored == null) {
            return false;
        }
        for (String tag : tokens(ifNoneMatch)) {
            if (ANY.equals(tag) || tag.equals(stored.etag())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Write/delete path. True when the mutation may proceed.
     *
     *  - No stored record: holds unless some listed tag is "*"
     *    ("*" requires an existing resource).
     *  - Stored record: holds when the header is absent, or some listed tag
     *    is "*" or equals the stored ETag exactly.
     */
    public static boolean ifMatchHolds(MetadataRecord stored, List<String> ifMatch) {
        List<String> tags = tokens(ifMatch);
        if (stored == null) {
            return !tags.contains(ANY);
        }
        if (ifMatch == null || ifMatch.isEmpty()) {
            return true;
        }
        for (String tag : tags) {
            if (ANY.equals(tag) || tag.equals(stored.etag())) {
                return true;
            }
        }
        return false;
    }

    /** Flatten header lines into trimmed, non-empty entity-tag tokens. */
    static List<String> tokens(List<String> headerLines) {
        if (headerLines == null || headerLines.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String line : headerLines) {
            if (line == null) continue;
            for (String part : line.split(",")) {
                String t = part.trim();
                if (!t.isEmpty()) {
                    out.add(t);
                }
            }
        }
        return out;
    }
}
