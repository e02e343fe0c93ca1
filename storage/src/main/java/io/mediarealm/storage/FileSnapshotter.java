package io.mediarealm.storage;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * JSON snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format: {@code {"lsn": n, "state": {...}}} in "snapshot-&lt;lsn&gt;.json",
 * the LSN zero-padded so names sort in LSN order.
 * <p>
 * Atomicity:
 *   - We write to "snapshot-&lt;lsn&gt;.json.tmp" first and fsync it,
 *   - then move to "snapshot-&lt;lsn&gt;.json" using ATOMIC_MOVE.
 * <p>
 * Only the newest {@value #KEEP} snapshots are kept. If the newest one cannot
 * be parsed, loading falls back to the previous one.
 */
public final class FileSnapshotter<S> implements Snapshotter<S> {
    private static final Logger LOG = Logger.getLogger(FileSnapshotter.class.getName());
    static final int KEEP = 2;

    private final Path dir;
    private final ObjectMapper mapper = Json.mapper();
    private final JavaType fileType;

    public FileSnapshotter(Path dir, Class<S> stateType) {
        this.dir = dir;
        this.fileType = mapper.getTypeFactory().constructParametricType(SnapshotFile.class, stateType);
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    public record SnapshotFile<S>(long lsn, S state) {
    }

    @Override
    public String writeSnapshot(long lsn, S state) {
        String name = String.format("snapshot-%020d.json", lsn);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (OutputStream out = Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC)) {
            mapper.writerFor(fileType).writeValue(out, new SnapshotFile<>(lsn, state));
        } catch (IOException ex) { throw new UncheckedIOException("snapshot write failed", ex); }

        try { Files.move(tmp, dst, ATOMIC_MOVE); }
        catch (IOException e) { throw new UncheckedIOException(e); }

        prune();
        LOG.fine(() -> "wrote snapshot " + name);
        return name;
    }

    @Override
    public LoadedSnapshot<S> loadLatest() {
        List<Path> snaps = snapshots();
        for (int i = snaps.size() - 1; i >= 0; i--) {
            Path snap = snaps.get(i);
            try {
                SnapshotFile<S> file = mapper.readValue(snap.toFile(), fileType);
                return new LoadedSnapshot<>(snap.getFileName().toString(), file.lsn(), file.state());
            } catch (IOException e) {
                LOG.log(Level.WARNING, "skipping unreadable snapshot " + snap.getFileName(), e);
            }
        }
        return null;
    }

    private void prune() {
        List<Path> snaps = snapshots();
        try {
            for (int i = 0; i < snaps.size() - KEEP; i++) {
                Files.deleteIfExists(snaps.get(i));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith("snapshot-") && n.endsWith(".json");
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
