// file: storage/src/main/java/io/treekv/storage/TxBucket.java
package io.treekv.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Bucket handle addressed by path; every call re-resolves the node through
 * its transaction, so handles stay correct across copy-on-write.
 */
final class TxBucket implements Bucket {
    private final SnapshotTx tx;
    private final List<String> path;

    TxBucket(SnapshotTx tx, List<String> path) {
        this.tx = tx;
        this.path = List.copyOf(path);
    }

    @Override
    public Bucket bucket(String key) {
        tx.node(path);
        return tx.bucketAt(childPath(key));
    }

    @Override
    public byte[] get(String key) {
        Object e = tx.node(path).entries.get(key);
        return e instanceof byte[] ? ((byte[]) e).clone() : null;
    }

    @Override
    public void put(String key, byte[] value) {
        tx.mutate(new Mutation.Put(path, key, value.clone()));
    }

    @Override
    public void delete(String key) {
        tx.mutate(new Mutation.Delete(path, key));
    }

    @Override
    public Bucket createBucketIfNotExists(String key) {
        List<String> child = childPath(key);
        tx.mutate(new Mutation.CreateBucket(child));
        return new TxBucket(tx, child);
    }

    @Override
    public void deleteBucket(String key) {
        tx.mutate(new Mutation.DeleteBucket(childPath(key)));
    }

    @Override
    public void forEach(BiConsumer<String, byte[]> visitor) {
        // iterate a copy so the visitor sees a stable view
        for (Map.Entry<String, Object> e : new ArrayList<>(tx.node(path).entries.entrySet())) {
            Object v = e.getValue();
            visitor.accept(e.getKey(), v instanceof byte[] ? ((byte[]) v).clone() : null);
        }
    }

    @Override
    public List<String> keys() {
        return List.copyOf(tx.node(path).entries.keySet());
    }

    @Override
    public List<String> path() {
        return path;
    }

    private List<String> childPath(String key) {
        List<String> p = new ArrayList<>(path.size() + 1);
        p.addAll(path);
        p.add(key);
        return p;
    }
}
