// file: storage/src/main/java/io/treekv/storage/StoreException.java
package io.treekv.storage;

/**
 * Failure raised by the bucket engine.
 * The {@link Kind} lets callers map engine errors without string matching.
 */
public class StoreException extends RuntimeException {

    public enum Kind {
        /** Key already holds the other kind of entry (bucket vs value). */
        INCOMPATIBLE_VALUE,
        /** A bucket on the requested path does not exist. */
        BUCKET_NOT_FOUND,
        /** Mutation attempted in a read-only transaction. */
        TX_NOT_WRITABLE,
        /** Transaction already committed or rolled back. */
        TX_CLOSED,
        /** Disk I/O failed (WAL or snapshot). */
        IO
    }

    private final Kind kind;

    public StoreException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
