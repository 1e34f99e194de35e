// file: server/src/main/java/io/treekv/server/store/NamespaceNavigator.java
package io.treekv.server.store;

import io.treekv.core.PathResolver;
import io.treekv.storage.Bucket;
import io.treekv.storage.Tx;

import java.util.List;

/**
 * Walks split paths through the bucket tree inside a caller-owned transaction.
 * <p>
 * Every path starts at the top-level bucket named "/"; the remaining segments
 * are nested buckets, except possibly the last one, which may be a value.
 */
public final class NamespaceNavigator {
    public static final String ROOT_BUCKET = PathResolver.ROOT;

    /** What a path points at. */
    public sealed interface Resolved permits Container, Value {}

    public record Container(Bucket bucket) implements Resolved {}

    public record Value(byte[] bytes) implements Resolved {}

    private NamespaceNavigator() {
        // utility
    }

    /**
     * Bucket addressed by all of 'segments', or null as soon as one step is
     * missing or is a value.
     *
     * @throws IllegalStateException if the root bucket is missing
     */
    public static Bucket resolveContainer(Tx tx, List<String> segments) {
        Bucket b = root(tx);
        for (int i = 1; i < segments.size() && b != null; i++) {
            b = b.bucket(segments.get(i));
        }
        return b;
    }

    /** Nested bucket or value stored under 'name' in 'container'; null when absent. */
    public static Resolved resolveContainerOrValue(Bucket container, String name) {
        Bucket nested = container.bucket(name);
        if (nested != null) {
            return new Container(nested);
        }
        byte[] value = container.get(name);
        return value == null ? null : new Value(value);
    }

    /** Resolve a whole path; the root path resolves to the root container. */
    public static Resolved resolve(Tx tx, List<String> segments) {
        if (PathResolver.depth(segments) == 0) {
            return new Container(root(tx));
        }
        Bucket parent = resolveContainer(tx, PathResolver.parent(segments));
        return parent == null ? null : resolveContainerOrValue(parent, PathResolver.last(segments));
    }

    /**
     * Create every missing bucket along 'segments' and return the last one.
     * Existing buckets are reused.
     *
     * @throws io.treekv.storage.StoreException INCOMPATIBLE_VALUE if a segment already holds a value
     */
    public static Bucket getOrCreateContainerChain(Tx tx, List<String> segments) {
        Bucket b = root(tx);
        for (int i = 1; i < segments.size(); i++) {
            b = b.createBucketIfNotExists(segments.get(i));
        }
        return b;
    }

    private static Bucket root(Tx tx) {
        Bucket root = tx.bucket(ROOT_BUCKET);
        if (root == null) {
            throw new IllegalStateException("root bucket missing");
        }
        return root;
    }
}
