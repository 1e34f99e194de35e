// file: storage/src/main/java/io/treekv/storage/FileSnapshotter.java
package io.treekv.storage;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int64 txId
 *   node:
 *     int32 count
 *     repeated 'count' times (keys in ascending order):
 *       - key:  int32 len + UTF-8 bytes
 *       - kind: byte (0 = value, 1 = bucket)
 *       - value: int32 len + bytes      (kind 0)
 *       - node:  nested, same layout    (kind 1)
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<txId>.bin.tmp" first and fsync it,
 *   - then move to "snapshot-<txId>.bin" using ATOMIC_MOVE.
 * The txId is zero-padded, so lexical order of names is commit order.
 */
final class FileSnapshotter implements Snapshotter {
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";
    private static final byte KIND_VALUE = 0;
    private static final byte KIND_BUCKET = 1;

    private final Path dir;

    FileSnapshotter(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.IO, "cannot create snapshot dir " + dir, e);
        }
    }

    @Override
    public String writeSnapshot(Node root, long txId) {
        String name = PREFIX + String.format("%020d", txId) + SUFFIX;
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try {
            try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)))) {
                out.writeLong(txId);
                writeNode(out, root);
            }
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                ch.force(true);
            }
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.IO, "snapshot write failed: " + dst, e);
        }

        deleteOlderThan(name);
        return name;
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> snaps = list();
        if (snaps.isEmpty()) {
            return null;
        }
        Path snap = snaps.get(snaps.size() - 1);
        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            long txId = in.readLong();
            Node root = readNode(in);
            return new LoadedSnapshot(snap.getFileName().toString(), txId, root);
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.IO, "snapshot read failed: " + snap, e);
        }
    }

    private List<Path> list() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.IO, "cannot list snapshots in " + dir, e);
        }
    }

    private void deleteOlderThan(String keep) {
        for (Path p : list()) {
            if (p.getFileName().toString().compareTo(keep) < 0) {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new StoreException(StoreException.Kind.IO, "cannot delete old snapshot " + p, e);
                }
            }
        }
    }

    private static void writeNode(DataOutputStream out, Node node) throws IOException {
        out.writeInt(node.entries.size());
        for (Map.Entry<String, Object> e : node.entries.entrySet()) {
            writeBytes(out, e.getKey().getBytes(StandardCharsets.UTF_8));
            if (e.getValue() instanceof Node child) {
                out.writeByte(KIND_BUCKET);
                writeNode(out, child);
            } else {
                out.writeByte(KIND_VALUE);
                writeBytes(out, (byte[]) e.getValue());
            }
        }
    }

    private static Node readNode(DataInputStream in) throws IOException {
        Node node = new Node();
        int count = in.readInt();
        for (int i = 0; i < count; i++) {
            String key = new String(readBytes(in), StandardCharsets.UTF_8);
            byte kind = in.readByte();
            if (kind == KIND_BUCKET) {
                node.entries.put(key, readNode(in));
            } else if (kind == KIND_VALUE) {
                node.entries.put(key, readBytes(in));
            } else {
                throw new IOException("unknown entry kind " + kind + " for key " + key);
            }
        }
        return node;
    }

    private static void writeBytes(DataOutputStream out, byte[] v) throws IOException {
        out.writeInt(v.length);
        out.write(v);
    }

    private static byte[] readBytes(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len < 0) throw new IOException("negative length " + len);
        byte[] b = in.readNBytes(len);
        if (b.length != len) throw new EOFException("truncated snapshot entry");
        return b;
    }
}
