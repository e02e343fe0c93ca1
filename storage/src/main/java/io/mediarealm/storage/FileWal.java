package io.mediarealm.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;


/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - cuts off a torn tail left by a crash mid-append,
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - Reader:
 *      - walks all segments from the earliest (sorted by name),
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] framedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(framedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment += framedRecord.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        rotate();
    }

    @Override
    public synchronized void rotate() {
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentNumber(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public synchronized void deleteSealedSegments() {
        try {
            for (Path seg : segments(dir)) {
                if (segmentNumber(seg) < segmentNumber(current)) {
                    Files.deleteIfExists(seg);
                }
            }
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one and position at the
     *    end of its last valid record.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        try {
            List<Path> existing = segments(dir);
            current = existing.isEmpty() ? dir.resolve(segmentName(1)) : existing.get(existing.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validLength(ch);
            if (valid < ch.size()) {
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    /** Byte offset just past the last intact record of a segment. */
    private static long validLength(FileChannel channel) throws IOException {
        long pos = 0;
        while (true) {
            int len = readRecordAt(channel, pos, null);
            if (len < 0) return pos;
            pos += RecordCodec.HEADER_BYTES + len;
        }
    }

    /**
     * Reads and validates the record at {@code pos}. Returns the payload length,
     * or -1 on EOF/truncation/corruption. If {@code sink} is non-null the payload
     * is copied into sink[0].
     */
    private static int readRecordAt(FileChannel channel, long pos, byte[][] sink) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES);
        int read = channel.read(hdr, pos);
        if (read < RecordCodec.HEADER_BYTES) return -1; // EOF or truncated header at tail
        hdr.flip();
        int len = RecordCodec.payloadLength(hdr);
        if (len < 0) return -1;
        int crc = RecordCodec.headerCrc(hdr);
        ByteBuffer payload = ByteBuffer.allocate(len);
        int r2 = len == 0 ? 0 : channel.read(payload, pos + RecordCodec.HEADER_BYTES);
        if (r2 < len) return -1; // truncated payload, stop
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return -1; // bad tail, stop
        if (sink != null) sink[0] = bytes;
        return len;
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String segmentName(int n) {
        return String.format("%08d.log", n);
    }

    private static int segmentNumber(Path segment) {
        return Integer.parseInt(segment.getFileName().toString().replace(".log", ""));
    }

    /**
     * Sequential reader for WAL segments used during recovery.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segIdx = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped = false;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null && !openNextSegment()) {
                        return null;
                    }
                    byte[][] sink = new byte[1][];
                    int len = readRecordAt(ch, pos, sink);
                    if (len >= 0) {
                        pos += RecordCodec.HEADER_BYTES + len;
                        return sink[0];
                    }
                    if (pos < ch.size()) {
                        // Garbage inside a segment: nothing after it can be trusted.
                        stopped = true;
                        return null;
                    }
                    ch.close();
                    ch = null;
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        private boolean openNextSegment() throws IOException {
            segIdx++;
            if (segIdx >= segments.size()) {
                return false;
            }
            ch = FileChannel.open(segments.get(segIdx), READ);
            pos = 0;
            return true;
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
