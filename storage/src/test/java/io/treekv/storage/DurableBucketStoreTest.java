// file: storage/src/test/java/io/treekv/storage/DurableBucketStoreTest.java
package io.treekv.storage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DurableBucketStoreTest {

    @TempDir Path dataDir;

    private DurableBucketStore store;

    @AfterEach
    void stop() {
        if (store != null) store.close();
    }

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void update_then_view_sees_nested_values() {
        store = DurableBucketStore.open(dataDir, 1000);

        store.update(tx -> {
            Bucket a = tx.createBucketIfNotExists("a");
            a.createBucketIfNotExists("b").put("k", b("v"));
            a.put("x", b("1"));
            return null;
        });

        store.view(tx -> {
            Bucket a = tx.bucket("a");
            assertNotNull(a);
            assertArrayEquals(b("1"), a.get("x"));
            assertArrayEquals(b("v"), a.bucket("b").get("k"));
            assertNull(a.get("b"), "bucket is not a value");
            assertNull(a.bucket("x"), "value is not a bucket");
            assertEquals(List.of("b", "x"), a.keys());
            return null;
        });
    }

    @Test
    void keys_are_listed_in_ascending_order_with_null_for_buckets() {
        store = DurableBucketStore.open(dataDir, 1000);
        store.update(tx -> {
            Bucket r = tx.createBucketIfNotExists("r");
            r.put("foo", b("3"));
            r.createBucketIfNotExists("bar");
            r.put("baz", b("2"));
            return null;
        });

        List<String> seen = new ArrayList<>();
        store.view(tx -> {
            tx.bucket("r").forEach((k, v) -> seen.add(k + "=" + (v == null ? "<bucket>" : new String(v, StandardCharsets.UTF_8))));
            return null;
        });
        assertEquals(List.of("bar=<bucket>", "baz=2", "foo=3"), seen);
    }

    @Test
    void put_on_bucket_key_is_incompatible_and_rolls_back() {
        store = DurableBucketStore.open(dataDir, 1000);
        store.update(tx -> tx.createBucketIfNotExists("r").createBucketIfNotExists("child"));

        StoreException e = assertThrows(StoreException.class, () -> store.update(tx -> {
            Bucket r = tx.bucket("r");
            r.put("other", b("kept?"));
            r.put("child", b("boom"));
            return null;
        }));
        assertEquals(StoreException.Kind.INCOMPATIBLE_VALUE, e.kind());

        store.view(tx -> {
            assertNull(tx.bucket("r").get("other"), "failed transaction must leave no trace");
            assertNotNull(tx.bucket("r").bucket("child"));
            return null;
        });
    }

    @Test
    void create_bucket_over_value_is_incompatible() {
        store = DurableBucketStore.open(dataDir, 1000);
        store.update(tx -> {
            tx.createBucketIfNotExists("r").put("v", b("x"));
            return null;
        });
        StoreException e = assertThrows(StoreException.class,
                () -> store.update(tx -> tx.bucket("r").createBucketIfNotExists("v")));
        assertEquals(StoreException.Kind.INCOMPATIBLE_VALUE, e.kind());
    }

    @Test
    void delete_bucket_removes_subtree() {
        store = DurableBucketStore.open(dataDir, 1000);
        store.update(tx -> {
            tx.createBucketIfNotExists("r").createBucketIfNotExists("a").createBucketIfNotExists("b").put("k", b("v"));
            return null;
        });
        store.update(tx -> {
            tx.bucket("r").deleteBucket("a");
            return null;
        });
        store.view(tx -> {
            assertNull(tx.bucket("r").bucket("a"));
            assertTrue(tx.bucket("r").keys().isEmpty());
            return null;
        });

        StoreException e = assertThrows(StoreException.class,
                () -> store.update(tx -> {
                    tx.bucket("r").deleteBucket("a");
                    return null;
                }));
        assertEquals(StoreException.Kind.BUCKET_NOT_FOUND, e.kind());
    }

    @Test
    void read_only_transaction_rejects_writes() {
        store = DurableBucketStore.open(dataDir, 1000);
        store.update(tx -> tx.createBucketIfNotExists("r"));

        try (Tx tx = store.begin(false)) {
            assertFalse(tx.writable());
            StoreException e = assertThrows(StoreException.class, () -> tx.bucket("r").put("k", b("v")));
            assertEquals(StoreException.Kind.TX_NOT_WRITABLE, e.kind());
            assertThrows(StoreException.class, tx::commit);
        }
    }

    @Test
    void reader_keeps_its_snapshot_while_writer_commits() {
        store = DurableBucketStore.open(dataDir, 1000);
        store.update(tx -> {
            tx.createBucketIfNotExists("r").put("k", b("old"));
            return null;
        });

        try (Tx reader = store.begin(false)) {
            store.update(tx -> {
                tx.bucket("r").put("k", b("new"));
                tx.bucket("r").put("extra", b("1"));
                return null;
            });
            assertArrayEquals(b("old"), reader.bucket("r").get("k"));
            assertNull(reader.bucket("r").get("extra"));
        }

        store.view(tx -> {
            assertArrayEquals(b("new"), tx.bucket("r").get("k"));
            return null;
        });
    }

    @Test
    void uncommitted_writes_are_invisible_to_readers() {
        store = DurableBucketStore.open(dataDir, 1000);
        store.update(tx -> tx.createBucketIfNotExists("r"));

        try (Tx writer = store.begin(true)) {
            writer.bucket("r").put("k", b("pending"));
            store.view(tx -> {
                assertNull(tx.bucket("r").get("k"));
                return null;
            });
            writer.rollback();
        }
        store.view(tx -> {
            assertNull(tx.bucket("r").get("k"));
            return null;
        });
    }

    @Test
    void returned_values_are_copies() {
        store = DurableBucketStore.open(dataDir, 1000);
        byte[] input = b("abc");
        store.update(tx -> {
            tx.createBucketIfNotExists("r").put("k", input);
            return null;
        });
        input[0] = 'z';
        store.view(tx -> {
            byte[] out = tx.bucket("r").get("k");
            assertArrayEquals(b("abc"), out);
            out[0] = 'q';
            assertArrayEquals(b("abc"), tx.bucket("r").get("k"));
            return null;
        });
    }

    @Test
    void committed_state_survives_restart() {
        store = DurableBucketStore.open(dataDir, 1000);
        store.update(tx -> {
            Bucket r = tx.createBucketIfNotExists("r");
            r.put("k", b("v1"));
            r.createBucketIfNotExists("sub").put("deep", b("d"));
            return null;
        });
        store.update(tx -> {
            tx.bucket("r").put("k", b("v2"));
            tx.bucket("r").delete("missing");
            return null;
        });
        store.close();

        store = DurableBucketStore.open(dataDir, 1000);
        store.view(tx -> {
            assertArrayEquals(b("v2"), tx.bucket("r").get("k"));
            assertArrayEquals(b("d"), tx.bucket("r").bucket("sub").get("deep"));
            return null;
        });
        assertEquals(2, store.lastTxId());
    }

    @Test
    void writers_are_serialized() throws Exception {
        store = DurableBucketStore.open(dataDir, 1000);
        store.update(tx -> {
            tx.createBucketIfNotExists("r").put("n", b("0"));
            return null;
        });

        int threads = 4;
        int perThread = 25;
        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            Thread w = new Thread(() -> {
                for (int i = 0; i < perThread; i++) {
                    store.update(tx -> {
                        Bucket r = tx.bucket("r");
                        int n = Integer.parseInt(new String(r.get("n"), StandardCharsets.UTF_8));
                        r.put("n", b(Integer.toString(n + 1)));
                        return null;
                    });
                }
            });
            workers.add(w);
            w.start();
        }
        for (Thread w : workers) {
            w.join();
        }

        store.view(tx -> {
            assertEquals(Integer.toString(threads * perThread),
                    new String(tx.bucket("r").get("n"), StandardCharsets.UTF_8));
            return null;
        });
    }
}
