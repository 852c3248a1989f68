// file: src/main/java/io/fieldsync/storage/FileWal.java
package io.fieldsync.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends framed entries to numbered segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - opens the newest segment (or creates "00000001.log"),
 *      - truncates a torn tail left by a crash mid-append, so new entries are
 *        never written behind garbage the reader would stop at.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment.
 * <p>
 *  - Reader:
 *      - walks segments in index order starting at the requested one,
 *      - reads the 11-byte header, validates magic/version/length,
 *      - reads the payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private long currentIndex;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Failed to create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] framedEntry) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(framedEntry);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true); // fsync: metadata too, so a freshly rotated file is durable
            writtenInSegment += framedEntry.length;
        } catch (IOException e) {
            throw new StorageException("WAL append failed on segment " + segmentName(currentIndex), e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        rotate();
    }

    @Override
    public synchronized long rotate() {
        try {
            ch.close();
            currentIndex++;
            ch = FileChannel.open(dir.resolve(segmentName(currentIndex)), CREATE, WRITE, READ);
            writtenInSegment = 0;
            return currentIndex;
        } catch (IOException e) {
            throw new StorageException("WAL rotation to segment " + segmentName(currentIndex) + " failed", e);
        }
    }

    @Override
    public synchronized void deleteSegmentsBefore(long segment) {
        for (Path p : listSegments(dir)) {
            long idx = indexOf(p);
            if (idx < segment && idx != currentIndex) {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new StorageException("Failed to delete WAL segment " + p, e);
                }
            }
        }
    }

    @Override
    public WalReader openReader(long fromSegment) {
        List<Path> segments = new ArrayList<>();
        for (Path p : listSegments(dir)) {
            if (indexOf(p) >= fromSegment) segments.add(p);
        }
        return new Reader(segments);
    }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new StorageException("Failed to close WAL", e);
        }
    }

    /** Index of the segment currently being appended to. */
    public synchronized long currentSegment() {
        return currentIndex;
    }

    private void openNewestOrCreate() {
        List<Path> segments = listSegments(dir);
        Path seg = segments.isEmpty() ? dir.resolve(segmentName(1)) : segments.get(segments.size() - 1);
        try {
            currentIndex = indexOf(seg);
            ch = FileChannel.open(seg, CREATE, WRITE, READ);
            long valid = validLength(ch);
            if (valid < ch.size()) {
                log.log(Level.WARNING, "Truncating torn tail of {0}: {1} -> {2} bytes",
                        new Object[]{seg.getFileName(), ch.size(), valid});
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) {
            throw new StorageException("Failed to open WAL segment " + seg, e);
        }
    }

    /** Offset just past the last intact entry of the segment. */
    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            int len = readEntryAt(ch, pos, null);
            if (len < 0) return pos;
            pos += RecordCodec.HEADER_LEN + len;
        }
    }

    /**
     * Validate the entry at {@code pos}.
     *
     * @param sink receives the payload when non-null
     * @return payload length, or -1 if there is no intact entry at pos
     */
    private static int readEntryAt(FileChannel ch, long pos, byte[][] sink) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_LEN).order(ByteOrder.LITTLE_ENDIAN);
        while (hdr.hasRemaining()) {
            int n = ch.read(hdr, pos + hdr.position());
            if (n <= 0) return -1; // EOF or truncated header
        }
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return -1;
        if (pos + RecordCodec.HEADER_LEN + len > ch.size()) return -1; // truncated payload

        ByteBuffer payload = ByteBuffer.allocate(len);
        while (payload.hasRemaining()) {
            int n = ch.read(payload, pos + RecordCodec.HEADER_LEN + payload.position());
            if (n <= 0) return -1;
        }
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return -1; // bad tail
        if (sink != null) sink[0] = bytes;
        return len;
    }

    static String segmentName(long index) {
        return String.format("%08d.log", index);
    }

    private static long indexOf(Path segment) {
        return Long.parseLong(segment.getFileName().toString().replace(".log", ""));
    }

    private static List<Path> listSegments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().matches("\\d{8}\\.log"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list WAL segments in " + dir, e);
        }
    }

    /**
     * Sequential reader used during recovery. Moves to the next segment only when
     * the current one ended cleanly; a corrupt entry ends the whole log.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segmentIdx = -1;
        private FileChannel ch;
        private long pos;
        private boolean stopped;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null && !openNext()) {
                        stopped = true;
                        return null;
                    }
                    byte[][] sink = new byte[1][];
                    int len = readEntryAt(ch, pos, sink);
                    if (len >= 0) {
                        pos += RecordCodec.HEADER_LEN + len;
                        return sink[0];
                    }
                    boolean cleanEnd = pos == ch.size();
                    ch.close();
                    ch = null;
                    if (!cleanEnd) {
                        log.log(Level.WARNING, "WAL replay stopped at corrupt entry in {0} offset {1}",
                                new Object[]{segments.get(segmentIdx).getFileName(), pos});
                        stopped = true;
                        return null;
                    }
                }
            } catch (IOException e) {
                throw new StorageException("WAL read failed", e);
            }
        }

        private boolean openNext() throws IOException {
            segmentIdx++;
            if (segmentIdx >= segments.size()) return false;
            ch = FileChannel.open(segments.get(segmentIdx), READ);
            pos = 0;
            return true;
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new StorageException("Failed to close WAL reader", e);
            }
        }
    }
}
