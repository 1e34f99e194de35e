// file: storage/src/main/java/io/treekv/storage/CowTree.java
package io.treekv.storage;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Copy-on-write view over a committed tree.
 * <p>
 * Reads walk the shared nodes directly. The first write below a node copies
 * every node on the path from the root, so the committed tree the view
 * started from is never modified. Nodes copied by this view are tracked in
 * 'owned' and mutated in place afterwards.
 */
final class CowTree {
    private Node root;
    private final Set<Node> owned = Collections.newSetFromMap(new IdentityHashMap<>());

    CowTree(Node base) {
        this.root = base;
    }

    Node root() {
        return root;
    }

    /** Bucket node at 'path', or null if any step is missing or holds a value. */
    Node find(List<String> path) {
        Node n = root;
        for (String name : path) {
            n = n.child(name);
            if (n == null) {
                return null;
            }
        }
        return n;
    }

    /**
     * Validate and apply one mutation. A rejected mutation leaves the tree unchanged.
     */
    void apply(Mutation m) {
        if (m instanceof Mutation.CreateBucket c) {
            Node parent = writable(parentOf(c.path()));
            String name = lastOf(c.path());
            Object existing = parent.entries.get(name);
            if (existing instanceof byte[]) {
                throw incompatible(name);
            }
            if (existing == null) {
                Node created = new Node();
                owned.add(created);
                parent.entries.put(name, created);
            }
        } else if (m instanceof Mutation.DeleteBucket d) {
            Node parent = writable(parentOf(d.path()));
            String name = lastOf(d.path());
            Object existing = parent.entries.get(name);
            if (existing instanceof byte[]) {
                throw incompatible(name);
            }
            if (existing == null) {
                throw new StoreException(StoreException.Kind.BUCKET_NOT_FOUND, "bucket not found: " + d.path());
            }
            parent.entries.remove(name);
        } else if (m instanceof Mutation.Put p) {
            Node bucket = writable(p.bucket());
            if (bucket.entries.get(p.key()) instanceof Node) {
                throw incompatible(p.key());
            }
            bucket.entries.put(p.key(), p.value());
        } else if (m instanceof Mutation.Delete d) {
            Node bucket = writable(d.bucket());
            if (bucket.entries.get(d.key()) instanceof Node) {
                throw incompatible(d.key());
            }
            bucket.entries.remove(d.key());
        } else {
            throw new IllegalStateException("Unknown mutation type: " + m);
        }
    }

    /** Walk to 'path', copying shared nodes along the way. */
    private Node writable(List<String> path) {
        if (!owned.contains(root)) {
            root = root.copy();
            owned.add(root);
        }
        Node n = root;
        for (String name : path) {
            Node child = n.child(name);
            if (child == null) {
                throw new StoreException(StoreException.Kind.BUCKET_NOT_FOUND, "bucket not found: " + path);
            }
            if (!owned.contains(child)) {
                child = child.copy();
                owned.add(child);
                n.entries.put(name, child);
            }
            n = child;
        }
        return n;
    }

    private static List<String> parentOf(List<String> path) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("empty bucket path");
        }
        return path.subList(0, path.size() - 1);
    }

    private static String lastOf(List<String> path) {
        return path.get(path.size() - 1);
    }

    private static StoreException incompatible(String key) {
        return new StoreException(StoreException.Kind.INCOMPATIBLE_VALUE, "incompatible value for key: " + key);
    }
}
