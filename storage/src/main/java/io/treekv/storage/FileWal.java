// file: storage/src/main/java/io/treekv/storage/FileWal.java
package io.treekv.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * Segmented on-disk {@link Wal}. Segments are named "%08d.log" and only the
 * newest one is written to.
 * <p>
 * Opening the log trims a half-written frame from the end of the newest
 * segment, so commits appended after a crash are not hidden behind it.
 * Every append is forced to disk (data and file metadata) before returning.
 * Readers validate each frame (magic, version, length, CRC32) and stop at
 * the first one that does not check out.
 */
public class FileWal implements Wal {
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;
    private boolean broken;

    public FileWal(Path dir, long rotateBytes) {
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.IO, "cannot create WAL dir " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public void append(byte[] frame) {
        if (broken) {
            throw new StoreException(StoreException.Kind.IO, "WAL unusable after a failed append in " + current);
        }
        long mark;
        try {
            mark = ch.position();
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.IO, "WAL append failed", e);
        }
        try {
            ByteBuffer buf = ByteBuffer.wrap(frame);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += frame.length;
        } catch (IOException e) {
            cutBackTo(mark, e);
            throw new StoreException(StoreException.Kind.IO, "WAL append failed", e);
        }
    }

    /** Drop a partially written frame so later appends do not land behind it. */
    private void cutBackTo(long mark, IOException cause) {
        try {
            ch.truncate(mark);
            ch.position(mark);
            ch.force(true);
        } catch (IOException e) {
            cause.addSuppressed(e);
            broken = true;
        }
    }

    @Override
    public void rotateIfOversized() {
        if (writtenInSegment < rotateBytes) return;
        rotate();
    }

    @Override
    public void rotate() {
        try {
            ch.close();
            int index = Integer.parseInt(current.getFileName().toString().replace(SUFFIX, ""));
            current = dir.resolve(segmentName(index + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.IO, "WAL rotation failed", e);
        }
    }

    @Override
    public void pruneInactiveSegments() {
        try {
            for (Path seg : segments(dir)) {
                if (!seg.equals(current)) {
                    Files.deleteIfExists(seg);
                }
            }
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.IO, "WAL cleanup failed", e);
        }
    }

    @Override
    public Reader openReader() {
        return new SegmentReader(segments(dir));
    }

    @Override
    public void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.IO, "WAL close failed", e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one, truncate any
     *    torn tail and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments(dir);
            current = segs.isEmpty() ? dir.resolve(segmentName(1)) : segs.get(segs.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validPrefix(ch);
            if (valid < ch.size()) {
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.IO, "cannot open WAL in " + dir, e);
        }
    }

    static String segmentName(int index) {
        return String.format("%08d%s", index, SUFFIX);
    }

    static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.IO, "cannot list WAL segments in " + dir, e);
        }
    }

    /** Length of the longest prefix of complete, CRC-valid records. */
    private static long validPrefix(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] payload = readRecord(ch, pos);
            if (payload == null) {
                return pos;
            }
            pos += RecordCodec.HEADER_BYTES + payload.length;
        }
    }

    /** Payload of the frame at 'pos', or null if the frame is missing, short or fails its CRC. */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES);
        if (!readFully(ch, hdr, pos)) {
            return null;
        }
        hdr.flip();
        int[] crc = new int[1];
        int len = RecordCodec.payloadLength(hdr, crc);
        long start = pos + RecordCodec.HEADER_BYTES;
        if (len < 0 || start + len > ch.size()) {
            return null;
        }
        ByteBuffer payload = ByteBuffer.allocate(len);
        if (!readFully(ch, payload, start)) {
            return null;
        }
        byte[] bytes = payload.array();
        return RecordCodec.crc32(bytes) == crc[0] ? bytes : null;
    }

    private static boolean readFully(FileChannel ch, ByteBuffer dst, long pos) throws IOException {
        while (dst.hasRemaining()) {
            if (ch.read(dst, pos + dst.position()) <= 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Sequential reader over every segment, oldest first.
     */
    private static final class SegmentReader implements Reader {
        private final List<Path> segs;
        private int segIndex = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped;

        SegmentReader(List<Path> segs) {
            this.segs = segs;
        }

        @Override
        public byte[] next() {
            try {
                while (!stopped) {
                    if (ch == null && !openNext()) {
                        return null;
                    }
                    byte[] payload = readRecord(ch, pos);
                    if (payload != null) {
                        pos += RecordCodec.HEADER_BYTES + payload.length;
                        return payload;
                    }
                    if (pos < ch.size()) {
                        stopped = true; // corrupt record inside a segment: nothing after it is trusted
                        return null;
                    }
                    ch.close();
                    ch = null;
                }
                return null;
            } catch (IOException e) {
                throw new StoreException(StoreException.Kind.IO, "WAL read failed", e);
            }
        }

        private boolean openNext() throws IOException {
            segIndex++;
            if (segIndex >= segs.size()) {
                return false;
            }
            ch = FileChannel.open(segs.get(segIndex), READ);
            pos = 0;
            return true;
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new StoreException(StoreException.Kind.IO, "WAL reader close failed", e);
            }
        }
    }
}
