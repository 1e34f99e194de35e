// file: storage/src/main/java/io/treekv/storage/Snapshotter.java
package io.treekv.storage;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the committed bucket tree together with the
 * id of the last transaction it contains. On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records with a higher transaction id.
 */
interface Snapshotter {

    /**
     * Persist a full copy of a committed tree.
     *
     * @param root committed (never mutated again) root node
     * @param txId id of the last transaction reflected in 'root'
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(Node root, long txId);

    /** Load the latest snapshot, or null when none exists. */
    LoadedSnapshot loadLatest();

    /** Simple holder for snapshot id and its data. */
    record LoadedSnapshot(String id, long txId, Node root) {}
}
