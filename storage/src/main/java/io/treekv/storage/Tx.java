// file: storage/src/main/java/io/treekv/storage/Tx.java
package io.treekv.storage;

/**
 * A unit of work against a {@link BucketStore}.
 * <p>
 * Read-only transactions see the state committed when they began, regardless
 * of later commits. Writable transactions are exclusive: only one exists at a
 * time. A transaction must end with exactly one {@link #commit()} or
 * {@link #rollback()}; {@link #close()} rolls back if neither happened.
 */
public interface Tx extends AutoCloseable {

    boolean writable();

    /** Top-level bucket, or null if it does not exist. */
    Bucket bucket(String name);

    Bucket createBucketIfNotExists(String name);

    void deleteBucket(String name);

    /**
     * Make all mutations durable and visible, then release the writer slot.
     *
     * @throws StoreException TX_NOT_WRITABLE on a read-only transaction, IO if the log append fails
     */
    void commit();

    /** Discard all mutations. Safe to call on a read-only transaction. */
    void rollback();

    @Override
    void close();
}
