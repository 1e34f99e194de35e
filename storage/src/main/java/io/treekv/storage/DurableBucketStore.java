// file: storage/src/main/java/io/treekv/storage/DurableBucketStore.java
package io.treekv.storage;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable bucket store.
 * <p>
 * Responsibilities:
 *  - Keep the committed bucket tree in memory behind a volatile root.
 *  - On commit:
 *      1) Serialize txId + mutation list to a WAL record.
 *      2) Append+fsync to WAL.
 *      3) Publish the transaction's root as the new committed root.
 *      4) Rotate WAL segment if needed.
 *      5) Possibly write a full snapshot based on SnapshotPolicy, then drop
 *         the WAL segments it covers.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any).
 *      2) Replay WAL records whose txId is above the snapshot's.
 * <p>
 * Failure:
 *  - A failed WAL append rejects that commit and every later one; reopening
 *    the store recovers from what reached the log.
 * <p>
 * Concurrency:
 *  - One writable transaction at a time (a single writer permit).
 *  - Read-only transactions never block; they keep the root they started on.
 */
public final class DurableBucketStore implements BucketStore {
    private static final Logger LOG = Logger.getLogger(DurableBucketStore.class.getName());

    static final long DEFAULT_ROTATE_BYTES = 64L * 1024 * 1024;

    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private final Semaphore writer = new Semaphore(1);

    private volatile Node root = new Node();
    private volatile boolean closed;
    // set once an append fails; the store then serves reads only
    private RuntimeException walFailure;
    // guarded by the writer permit after recovery
    private long lastTxId;

    /**
     * Open (or create) a store under 'dir', using "wal/" and "snap/" subdirectories.
     *
     * @param snapshotEvery number of commits between full snapshots
     */
    public static DurableBucketStore open(Path dir, int snapshotEvery) {
        return new DurableBucketStore(
                new FileWal(dir.resolve("wal"), DEFAULT_ROTATE_BYTES),
                new FileSnapshotter(dir.resolve("snap")),
                new SnapshotPolicy(snapshotEvery));
    }

    DurableBucketStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this.wal = wal;
        this.snaps = snaps;
        this.snapPolicy = snapPolicy;
        recover();
    }

    @Override
    public Tx begin(boolean writable) {
        ensureOpen();
        if (!writable) {
            return new SnapshotTx(this, root, false);
        }
        writer.acquireUninterruptibly();
        if (closed) {
            writer.release();
            throw new StoreException(StoreException.Kind.TX_CLOSED, "store closed");
        }
        return new SnapshotTx(this, root, true);
    }

    /** Called by the writable transaction holding the writer permit. */
    void publish(Node newRoot, List<Mutation> mutations) {
        if (mutations.isEmpty()) {
            return;
        }
        if (walFailure != null) {
            throw new StoreException(StoreException.Kind.IO, "store is read-only after a WAL failure", walFailure);
        }
        long txId = lastTxId + 1;

        // If the process crashes after append() returns, recovery replays this transaction.
        try {
            wal.append(RecordCodec.encode(txId, mutations));
        } catch (RuntimeException e) {
            // the log tail is unknown now; nothing may be acknowledged behind it
            walFailure = e;
            LOG.log(Level.SEVERE, "WAL append for tx " + txId + " failed; refusing further writes until reopened", e);
            throw e;
        }
        lastTxId = txId;
        root = newRoot;

        // from here on the commit is durable; later failures only delay housekeeping
        try {
            wal.rotateIfOversized();
        } catch (StoreException e) {
            LOG.log(Level.WARNING, "WAL rotation after tx " + txId + " failed", e);
        }
        if (snapPolicy.commitRecorded()) {
            try {
                snapshotNow();
            } catch (StoreException e) {
                LOG.log(Level.WARNING, "Snapshot after tx " + txId + " failed", e);
            }
        }
    }

    void releaseWriter() {
        writer.release();
    }

    /** Write a snapshot of the committed root and drop the WAL it supersedes. Writer permit must be held. */
    void snapshotNow() {
        String id = snaps.writeSnapshot(root, lastTxId);
        wal.rotate();
        wal.pruneInactiveSegments();
        LOG.fine(() -> "Wrote snapshot " + id);
    }

    long lastTxId() {
        return lastTxId;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        // wait for an in-flight writer to finish
        writer.acquireUninterruptibly();
        try {
            wal.close();
        } finally {
            writer.release();
        }
    }

    /**
     * Recovery procedure called from constructor:
     *  1) Seed the tree from the latest snapshot (if present).
     *  2) Replay newer WAL records in order.
     */
    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        Node base = new Node();
        if (loaded != null) {
            base = loaded.root();
            lastTxId = loaded.txId();
        }

        int replayed = 0;
        CowTree tree = new CowTree(base);
        try (Wal.Reader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                if (rec.txId() <= lastTxId) {
                    continue;
                }
                for (Mutation m : rec.mutations()) {
                    tree.apply(m);
                }
                lastTxId = rec.txId();
                replayed++;
            }
        } catch (RuntimeException e) {
            throw new StoreException(StoreException.Kind.IO, "Recovery failed", e);
        }
        root = tree.root();

        LOG.info(String.format("Recovered store: snapshot=%s, replayed=%d, lastTx=%d",
                loaded == null ? "none" : loaded.id(), replayed, lastTxId));
    }

    private void ensureOpen() {
        if (closed) {
            throw new StoreException(StoreException.Kind.TX_CLOSED, "store closed");
        }
    }
}
