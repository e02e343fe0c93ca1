package io.mediarealm.storage.cursor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardOpenOption.*;

/**
 * One small file per source ("&lt;source&gt;.cursor") holding the cursor as UTF-8.
 * Written to a temp file, fsynced, then atomically renamed over the old one,
 * so a reader sees either the old or the new cursor, never a mix.
 */
public final class FileCursorStore implements CursorStore {
    private static final Pattern SOURCE_NAME = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path dir;

    public FileCursorStore(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public synchronized Optional<String> load(String source) {
        Path file = fileFor(source);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read cursor of " + source, e);
        }
    }

    @Override
    public synchronized void save(String source, String cursor) {
        Path dst = fileFor(source);
        Path tmp = dst.resolveSibling(dst.getFileName() + ".tmp");
        try (FileChannel ch = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
            ByteBuffer buf = ByteBuffer.wrap(cursor.getBytes(StandardCharsets.UTF_8));
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write cursor of " + source, e);
        }
        try { Files.move(tmp, dst, ATOMIC_MOVE); }
        catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public synchronized void reset(String source) {
        try {
            Files.deleteIfExists(fileFor(source));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Path fileFor(String source) {
        if (source == null || !SOURCE_NAME.matcher(source).matches()) {
            throw new IllegalArgumentException("invalid source name: " + source);
        }
        return dir.resolve(source + ".cursor");
    }
}
