// file: storage/src/main/java/io/treekv/storage/Node.java
package io.treekv.storage;

import java.util.TreeMap;

/**
 * One bucket in the in-memory tree.
 * <p>
 * Entries map a key to either a byte[] (value) or a nested Node (bucket).
 * A Node reachable from a committed root is never mutated again; writers
 * copy it first (see {@link CowTree}).
 */
final class Node {
    final TreeMap<String, Object> entries;

    Node() {
        this.entries = new TreeMap<>();
    }

    private Node(TreeMap<String, Object> entries) {
        this.entries = entries;
    }

    /** Shallow copy: children are shared until they are copied themselves. */
    Node copy() {
        return new Node(new TreeMap<>(entries));
    }

    Node child(String key) {
        Object e = entries.get(key);
        return e instanceof Node ? (Node) e : null;
    }
}
