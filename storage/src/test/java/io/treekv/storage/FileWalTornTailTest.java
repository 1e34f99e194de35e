// file: storage/src/test/java/io/treekv/storage/FileWalTornTailTest.java
package io.treekv.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path dataDir;

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] put(long txId, String key, String value) {
        return RecordCodec.encode(txId, List.of(
                new Mutation.CreateBucket(List.of("r")),
                new Mutation.Put(List.of("r"), key, b(value))));
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() throws Exception {
        Path walDir = dataDir.resolve("wal");
        var wal = new FileWal(walDir, 1L << 60); // huge rotate threshold so single segment
        wal.append(put(1, "k1", "v1"));
        wal.append(put(2, "k2", "v2"));
        byte[] r3 = put(3, "k3", "v3");
        try (OutputStream out = Files.newOutputStream(walDir.resolve("00000001.log"), APPEND)) {
            out.write(r3, 0, r3.length - 5); // header says "len" but payload is short
        }
        wal.close();

        try (DurableBucketStore store = DurableBucketStore.open(dataDir, 1000)) {
            store.view(tx -> {
                assertArrayEquals(b("v1"), tx.bucket("r").get("k1"));
                assertArrayEquals(b("v2"), tx.bucket("r").get("k2"));
                assertNull(tx.bucket("r").get("k3"));
                return null;
            });

            // new commits after the cut must be readable on the next restart
            store.update(tx -> {
                tx.bucket("r").put("k4", b("v4"));
                return null;
            });
        }

        try (DurableBucketStore store = DurableBucketStore.open(dataDir, 1000)) {
            store.view(tx -> {
                assertArrayEquals(b("v4"), tx.bucket("r").get("k4"));
                return null;
            });
        }
    }

    @Test
    void reader_walks_every_segment_in_order() {
        Path walDir = dataDir.resolve("wal");
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(put(1, "a", "1"));
        wal.rotate();
        wal.append(put(2, "b", "2"));
        wal.close();

        var reopened = new FileWal(walDir, 1L << 60);
        try (Wal.Reader r = reopened.openReader()) {
            assertEquals(1, RecordCodec.decode(r.next()).txId());
            assertEquals(2, RecordCodec.decode(r.next()).txId());
            assertNull(r.next());
        } finally {
            reopened.close();
        }
    }
}
