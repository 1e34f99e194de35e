// file: storage/src/test/java/io/treekv/storage/RecordCodecTest.java
package io.treekv.storage;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordCodecTest {

    @Test
    void header_frames_payload_and_crc_matches() {
        List<Mutation> ops = List.of(
                new Mutation.CreateBucket(List.of("/", "a")),
                new Mutation.Put(List.of("/", "a"), "kéy", "value".getBytes(StandardCharsets.UTF_8)),
                new Mutation.Delete(List.of("/", "a"), "old"),
                new Mutation.DeleteBucket(List.of("/", "gone")));

        byte[] bytes = RecordCodec.encode(42, ops);

        ByteBuffer hdr = ByteBuffer.wrap(bytes, 0, RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(RecordCodec.MAGIC, hdr.getShort());
        assertEquals(RecordCodec.VERSION, hdr.get());
        int length = hdr.getInt();
        int crc = hdr.getInt();
        assertEquals(bytes.length - RecordCodec.HEADER_BYTES, length);

        byte[] payload = new byte[length];
        System.arraycopy(bytes, RecordCodec.HEADER_BYTES, payload, 0, length);
        assertEquals(RecordCodec.crc32(payload), crc);

        RecordCodec.LogRecord rec = RecordCodec.decode(payload);
        assertEquals(42, rec.txId());
        assertEquals(4, rec.mutations().size());
        assertEquals(ops.get(0), rec.mutations().get(0));
        Mutation.Put put = (Mutation.Put) rec.mutations().get(1);
        assertEquals("kéy", put.key());
        assertArrayEquals("value".getBytes(StandardCharsets.UTF_8), put.value());
        assertEquals(ops.get(2), rec.mutations().get(2));
        assertEquals(ops.get(3), rec.mutations().get(3));
    }

    @Test
    void large_values_grow_the_buffer() {
        byte[] big = new byte[10_000];
        big[9_999] = 7;
        byte[] bytes = RecordCodec.encode(1, List.of(new Mutation.Put(List.of("r"), "k", big)));
        byte[] payload = new byte[bytes.length - RecordCodec.HEADER_BYTES];
        System.arraycopy(bytes, RecordCodec.HEADER_BYTES, payload, 0, payload.length);

        Mutation.Put put = (Mutation.Put) RecordCodec.decode(payload).mutations().get(0);
        assertArrayEquals(big, put.value());
    }
}
