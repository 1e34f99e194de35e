// file: storage/src/main/java/io/treekv/storage/BucketStore.java
package io.treekv.storage;

/**
 * Embedded transactional store of nested buckets.
 * <p>
 * Semantics:
 *  - begin(true) blocks while another writable transaction is open.
 *  - begin(false) never blocks and observes a point-in-time snapshot.
 *  - view()/update() wrap a callback in a transaction; update() commits on
 *    normal return, both roll back and rethrow if the callback throws.
 */
public interface BucketStore extends AutoCloseable {

    Tx begin(boolean writable);

    /** Callback run inside a transaction. */
    @FunctionalInterface
    interface TxCallback<T> {
        T run(Tx tx);
    }

    default <T> T view(TxCallback<T> fn) {
        try (Tx tx = begin(false)) {
            return fn.run(tx);
        }
    }

    default <T> T update(TxCallback<T> fn) {
        try (Tx tx = begin(true)) {
            T result = fn.run(tx);
            tx.commit();
            return result;
        }
    }

    @Override
    void close();
}
