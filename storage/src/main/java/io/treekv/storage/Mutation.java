// file: storage/src/main/java/io/treekv/storage/Mutation.java
package io.treekv.storage;

import java.util.List;

/**
 * Logical mutation recorded by a writable transaction and replayed on recovery.
 * Bucket paths start at the top-level bucket name.
 */
sealed interface Mutation
        permits Mutation.CreateBucket, Mutation.DeleteBucket, Mutation.Put, Mutation.Delete {

    record CreateBucket(List<String> path) implements Mutation {}

    record DeleteBucket(List<String> path) implements Mutation {}

    record Put(List<String> bucket, String key, byte[] value) implements Mutation {}

    record Delete(List<String> bucket, String key) implements Mutation {}
}
