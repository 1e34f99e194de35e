// file: storage/src/main/java/io/treekv/storage/SnapshotPolicy.java
package io.treekv.storage;

/**
 * Snapshot policy that triggers a full snapshot after every N commits.
 * <p>
 * Only called while the writer permit is held, so no synchronization is needed.
 */
final class SnapshotPolicy {
    private final int everyCommits;
    private int sinceLast;

    SnapshotPolicy(int everyCommits) {
        if (everyCommits <= 0) throw new IllegalArgumentException("everyCommits must be > 0");
        this.everyCommits = everyCommits;
    }

    /** Call after each durable commit. Returns true when a snapshot is due. */
    boolean commitRecorded() {
        if (++sinceLast >= everyCommits) {
            sinceLast = 0;
            return true;
        }
        return false;
    }
}
