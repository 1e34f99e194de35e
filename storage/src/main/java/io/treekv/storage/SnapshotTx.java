// file: storage/src/main/java/io/treekv/storage/SnapshotTx.java
package io.treekv.storage;

import java.util.ArrayList;
import java.util.List;

/**
 * Transaction over a {@link CowTree} started from the committed root.
 * Writable instances log every accepted mutation for the WAL.
 */
final class SnapshotTx implements Tx {
    private final DurableBucketStore store;
    private final CowTree tree;
    private final boolean writable;
    private final List<Mutation> log = new ArrayList<>();
    private boolean closed;

    SnapshotTx(DurableBucketStore store, Node committedRoot, boolean writable) {
        this.store = store;
        this.tree = new CowTree(committedRoot);
        this.writable = writable;
    }

    @Override
    public boolean writable() {
        return writable;
    }

    @Override
    public Bucket bucket(String name) {
        return bucketAt(List.of(name));
    }

    @Override
    public Bucket createBucketIfNotExists(String name) {
        List<String> path = List.of(name);
        mutate(new Mutation.CreateBucket(path));
        return new TxBucket(this, path);
    }

    @Override
    public void deleteBucket(String name) {
        mutate(new Mutation.DeleteBucket(List.of(name)));
    }

    @Override
    public void commit() {
        ensureOpen();
        if (!writable) {
            throw new StoreException(StoreException.Kind.TX_NOT_WRITABLE, "cannot commit a read-only transaction");
        }
        closed = true;
        try {
            store.publish(tree.root(), List.copyOf(log));
        } finally {
            store.releaseWriter();
        }
    }

    @Override
    public void rollback() {
        if (closed) {
            return;
        }
        closed = true;
        log.clear();
        if (writable) {
            store.releaseWriter();
        }
    }

    @Override
    public void close() {
        rollback();
    }

    // ---------- used by TxBucket ----------

    Bucket bucketAt(List<String> path) {
        ensureOpen();
        return tree.find(path) == null ? null : new TxBucket(this, path);
    }

    Node node(List<String> path) {
        ensureOpen();
        Node n = tree.find(path);
        if (n == null) {
            throw new StoreException(StoreException.Kind.BUCKET_NOT_FOUND, "bucket not found: " + path);
        }
        return n;
    }

    void mutate(Mutation m) {
        ensureOpen();
        if (!writable) {
            throw new StoreException(StoreException.Kind.TX_NOT_WRITABLE, "transaction is read-only");
        }
        tree.apply(m);
        log.add(m);
    }

    private void ensureOpen() {
        if (closed) {
            throw new StoreException(StoreException.Kind.TX_CLOSED, "transaction closed");
        }
    }
}
