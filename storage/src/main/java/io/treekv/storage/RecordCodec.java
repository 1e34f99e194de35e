// file: storage/src/main/java/io/treekv/storage/RecordCodec.java
package io.treekv.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records. One record holds one committed transaction.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xB7EE   (helps detect garbage)
 *     - version (1B)  = 1       (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - txId:     int64
 *     - opCount:  int32
 *         repeated opCount times:
 *           - op:    byte (1=create bucket, 2=delete bucket, 3=put, 4=delete)
 *           - path:  int32 count + that many strings (int32 len + UTF-8 bytes)
 *           - key:   string (put/delete only)
 *           - value: int32 len + bytes (put only)
 * <p>
 * The header is validated by magic/version/length and CRC when reading.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xB7EE;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private static final byte OP_CREATE_BUCKET = 1;
    private static final byte OP_DELETE_BUCKET = 2;
    private static final byte OP_PUT = 3;
    private static final byte OP_DELETE = 4;

    private RecordCodec() {
    }

    /** Immutable view of a decoded record. */
    record LogRecord(long txId, List<Mutation> mutations) {}

    /** Encode a committed transaction into header+payload bytes ready for append. */
    static byte[] encode(long txId, List<Mutation> mutations) {
        byte[] payload = encodePayload(txId, mutations);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /**
     * Payload length announced by a header, or -1 if the header is not one of ours.
     * Leaves the CRC in {@code crcOut[0]}.
     */
    static int payloadLength(ByteBuffer header, int[] crcOut) {
        header.order(ByteOrder.LITTLE_ENDIAN);
        if (header.getShort() != MAGIC || header.get() != VERSION) {
            return -1;
        }
        int len = header.getInt();
        crcOut[0] = header.getInt();
        return len;
    }

    /** Decode a full payload (not including header). */
    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long txId = b.getLong();
        int count = b.getInt();
        List<Mutation> ops = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte op = b.get();
            List<String> path = readPath(b);
            switch (op) {
                case OP_CREATE_BUCKET -> ops.add(new Mutation.CreateBucket(path));
                case OP_DELETE_BUCKET -> ops.add(new Mutation.DeleteBucket(path));
                case OP_PUT -> {
                    String key = readString(b);
                    ops.add(new Mutation.Put(path, key, readBytes(b)));
                }
                case OP_DELETE -> ops.add(new Mutation.Delete(path, readString(b)));
                default -> throw new IllegalStateException("Unknown WAL op: " + op);
            }
        }
        return new LogRecord(txId, List.copyOf(ops));
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(long txId, List<Mutation> mutations) {
        GrowableBuffer b = new GrowableBuffer();
        b.putLong(txId);
        b.putInt(mutations.size());
        for (Mutation m : mutations) {
            if (m instanceof Mutation.CreateBucket c) {
                b.put(OP_CREATE_BUCKET);
                writePath(b, c.path());
            } else if (m instanceof Mutation.DeleteBucket d) {
                b.put(OP_DELETE_BUCKET);
                writePath(b, d.path());
            } else if (m instanceof Mutation.Put p) {
                b.put(OP_PUT);
                writePath(b, p.bucket());
                writeString(b, p.key());
                b.putBytes(p.value());
            } else if (m instanceof Mutation.Delete d) {
                b.put(OP_DELETE);
                writePath(b, d.bucket());
                writeString(b, d.key());
            } else {
                throw new IllegalStateException("Unknown mutation type: " + m);
            }
        }
        return b.toArray();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // CRC32 fits in unsigned int; Java int is fine for compare
    }

    private static void writePath(GrowableBuffer b, List<String> path) {
        b.putInt(path.size());
        for (String s : path) {
            writeString(b, s);
        }
    }

    private static void writeString(GrowableBuffer b, String s) {
        b.putBytes(s.getBytes(StandardCharsets.UTF_8));
    }

    private static List<String> readPath(ByteBuffer b) {
        int n = b.getInt();
        List<String> path = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            path.add(readString(b));
        }
        return List.copyOf(path);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static String readString(ByteBuffer b) {
        return new String(readBytes(b), StandardCharsets.UTF_8);
    }

    /** Little-endian output buffer that doubles its capacity as needed. */
    private static final class GrowableBuffer {
        private ByteBuffer buf = ByteBuffer.allocate(256).order(ByteOrder.LITTLE_ENDIAN);

        void put(byte v) {
            ensure(1);
            buf.put(v);
        }

        void putInt(int v) {
            ensure(4);
            buf.putInt(v);
        }

        void putLong(long v) {
            ensure(8);
            buf.putLong(v);
        }

        void putBytes(byte[] data) {
            ensure(4 + data.length);
            buf.putInt(data.length).put(data);
        }

        byte[] toArray() {
            byte[] out = new byte[buf.position()];
            buf.flip();
            buf.get(out);
            return out;
        }

        private void ensure(int extra) {
            if (buf.remaining() >= extra) return;
            int cap = Math.max(buf.capacity() * 2, buf.position() + extra);
            ByteBuffer bigger = ByteBuffer.allocate(cap).order(ByteOrder.LITTLE_ENDIAN);
            buf.flip();
            bigger.put(buf);
            buf = bigger;
        }
    }
}
