// file: src/main/java/io/fieldsync/storage/FileSnapshotter.java
package io.fieldsync.storage;

import io.fieldsync.core.Hashing;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;
import io.fieldsync.core.chain.ChainState;
import io.fieldsync.core.wire.WireCodec;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int32  magic
 *   int64  replayFromSegment
 *   int64  head.lastSequence
 *   32B    head.lastHash
 *   int32  pendingCount,  repeated: int32 len + unchained record bytes
 *   int32  chainedCount,  repeated: int32 len + wire-encoded record
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<segment>.bin.tmp" first, fsync it,
 *   - then move to "snapshot-<segment>.bin" using ATOMIC_MOVE,
 *   - then delete older snapshots.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final int MAGIC = 0xF5_5A_00_01;

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Failed to create snapshot directory " + dir, e);
        }
    }

    @Override
    public String writeSnapshot(StoreImage image) {
        String name = String.format("snapshot-%08d.bin", image.replayFromSegment());
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)))) {
            out.writeInt(MAGIC);
            out.writeLong(image.replayFromSegment());
            out.writeLong(image.head().lastSequence());
            out.write(image.head().lastHash());

            out.writeInt(image.pending().size());
            for (UnchainedRecord r : image.pending()) {
                writeBytes(out, RecordCodec.encodeUnchained(r));
            }
            out.writeInt(image.chained().size());
            for (SyncRecord r : image.chained()) {
                writeBytes(out, WireCodec.encode(r));
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write snapshot " + tmp, e);
        }

        try (var ch = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
            ch.force(true);
        } catch (IOException e) {
            throw new StorageException("Failed to sync snapshot " + tmp, e);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to publish snapshot " + dst, e);
        }

        for (Path old : listSnapshots()) {
            if (old.getFileName().toString().compareTo(name) < 0) {
                try {
                    Files.deleteIfExists(old);
                } catch (IOException e) {
                    throw new StorageException("Failed to delete old snapshot " + old, e);
                }
            }
        }
        return name;
    }

    @Override
    public StoreImage loadLatest() {
        List<Path> snaps = listSnapshots();
        if (snaps.isEmpty()) return null;
        Path snap = snaps.get(snaps.size() - 1);

        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            if (in.readInt() != MAGIC) {
                throw new StorageException("Not a snapshot file: " + snap);
            }
            long replayFrom = in.readLong();
            long lastSeq = in.readLong();
            byte[] lastHash = in.readNBytes(Hashing.HASH_LEN);
            ChainState head = new ChainState(lastSeq, lastHash);

            int pendingCount = in.readInt();
            List<UnchainedRecord> pending = new ArrayList<>(pendingCount);
            for (int i = 0; i < pendingCount; i++) {
                pending.add(RecordCodec.decodeUnchained(
                        ByteBuffer.wrap(readBytes(in)).order(ByteOrder.LITTLE_ENDIAN)));
            }
            int chainedCount = in.readInt();
            List<SyncRecord> chained = new ArrayList<>(chainedCount);
            for (int i = 0; i < chainedCount; i++) {
                chained.add(WireCodec.decode(readBytes(in)));
            }
            return new StoreImage(replayFrom, head, pending, chained);
        } catch (IOException | RuntimeException e) {
            if (e instanceof StorageException se) throw se;
            throw new StorageException("Corrupt snapshot " + snap, e);
        }
    }

    private List<Path> listSnapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith("snapshot-") && n.endsWith(".bin");
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to list snapshots in " + dir, e);
        }
    }

    private static void writeBytes(DataOutputStream out, byte[] v) throws IOException {
        out.writeInt(v.length);
        out.write(v);
    }

    private static byte[] readBytes(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len < 0) throw new IOException("negative length " + len);
        byte[] b = in.readNBytes(len);
        if (b.length != len) throw new IOException("truncated snapshot entry");
        return b;
    }
}
