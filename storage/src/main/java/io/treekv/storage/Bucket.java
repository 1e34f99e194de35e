// file: storage/src/main/java/io/treekv/storage/Bucket.java
package io.treekv.storage;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * A named container inside a transaction.
 * <p>
 * Every key in a bucket holds either a nested bucket or a value, never both.
 * A handle is only valid for the lifetime of the transaction that produced it.
 */
public interface Bucket {

    /** Nested bucket under 'key', or null if absent or if 'key' holds a value. */
    Bucket bucket(String key);

    /** Value stored under 'key', or null if absent or if 'key' holds a bucket. */
    byte[] get(String key);

    /**
     * Store a value, replacing any previous value.
     *
     * @throws StoreException INCOMPATIBLE_VALUE if 'key' holds a bucket
     */
    void put(String key, byte[] value);

    /**
     * Remove a value. Removing an absent key is a no-op.
     *
     * @throws StoreException INCOMPATIBLE_VALUE if 'key' holds a bucket
     */
    void delete(String key);

    /**
     * Return the nested bucket under 'key', creating it if needed.
     *
     * @throws StoreException INCOMPATIBLE_VALUE if 'key' holds a value
     */
    Bucket createBucketIfNotExists(String key);

    /**
     * Remove a nested bucket with its whole subtree.
     *
     * @throws StoreException BUCKET_NOT_FOUND if absent, INCOMPATIBLE_VALUE if 'key' holds a value
     */
    void deleteBucket(String key);

    /**
     * Visit every entry in key order. The value argument is null for nested buckets.
     */
    void forEach(BiConsumer<String, byte[]> visitor);

    /** All keys (values and nested buckets) in key order. */
    List<String> keys();

    /** Bucket names from the top level down to this bucket. */
    List<String> path();
}
