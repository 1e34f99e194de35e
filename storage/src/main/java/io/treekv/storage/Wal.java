// file: storage/src/main/java/io/treekv/storage/Wal.java
package io.treekv.storage;

/**
 * Append-only commit log.
 * <p>
 * A record is either fully present or ignored: recovery reads records in
 * order and stops at the first one whose frame is truncated or fails its
 * checksum. {@link #append} returns only after the frame is on disk.
 */
public interface Wal extends AutoCloseable {

    /** Write one framed record (see {@code RecordCodec}) and fsync it. */
    void append(byte[] frame);

    /** Start a new segment once the active one passes the size threshold. */
    void rotateIfOversized();

    /** Start a new segment unconditionally. */
    void rotate();

    /** Remove all segments but the active one; caller guarantees a snapshot covers them. */
    void pruneInactiveSegments();

    /** Reader over every segment, oldest first. */
    Reader openReader();

    @Override
    void close();

    interface Reader extends AutoCloseable {

        /** Next record payload without its frame header; null at the end or at a damaged tail. */
        byte[] next();

        @Override
        void close();
    }
}
