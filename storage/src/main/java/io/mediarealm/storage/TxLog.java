package io.mediarealm.storage;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.function.Consumer;

/**
 * Typed transaction log on top of a {@link Wal}.
 * <p>
 * Every transaction becomes exactly one WAL record holding
 * {@code {"lsn": n, "tx": {...}}}. The log sequence number (LSN) grows by one
 * per append and lets recovery skip records already covered by a snapshot,
 * so replay never applies a transaction twice.
 *
 * @param <T> transaction payload, serialized with Jackson
 */
public final class TxLog<T> implements AutoCloseable {
    private final Wal wal;
    private final ObjectMapper mapper = Json.mapper();
    private final JavaType entryType;
    private long lastLsn = 0;

    public TxLog(Wal wal, Class<T> txType) {
        this.wal = wal;
        this.entryType = mapper.getTypeFactory().constructParametricType(LogEntry.class, txType);
    }

    /** On-disk envelope of one transaction. */
    public record LogEntry<T>(long lsn, T tx) {
    }

    /**
     * Serialize, frame, append and fsync one transaction.
     *
     * @return the LSN assigned to it
     */
    public synchronized long append(T tx) {
        long lsn = lastLsn + 1;
        byte[] payload;
        try {
            payload = mapper.writerFor(entryType).writeValueAsBytes(new LogEntry<>(lsn, tx));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot serialize transaction", e);
        }
        wal.append(RecordCodec.frame(payload));
        lastLsn = lsn;
        wal.rotateIfNeeded();
        return lsn;
    }

    /**
     * Feed every transaction with an LSN greater than {@code afterLsn} to
     * {@code applier}, in log order. Must be called once, before any append.
     *
     * @return number of transactions applied
     */
    public synchronized int replay(long afterLsn, Consumer<T> applier) {
        lastLsn = Math.max(lastLsn, afterLsn);
        int applied = 0;
        try (Wal.WalReader reader = wal.openReader()) {
            byte[] payload;
            while ((payload = reader.next()) != null) {
                LogEntry<T> entry = decode(payload);
                if (entry.lsn() <= afterLsn) {
                    continue; // already in the snapshot
                }
                applier.accept(entry.tx());
                lastLsn = Math.max(lastLsn, entry.lsn());
                applied++;
            }
        }
        return applied;
    }

    public synchronized long lastLsn() {
        return lastLsn;
    }

    /**
     * Drop log segments made redundant by a snapshot covering {@link #lastLsn()}.
     * The next append goes to a fresh segment.
     */
    public synchronized void compact() {
        wal.rotate();
        wal.deleteSealedSegments();
    }

    @Override
    public void close() {
        wal.close();
    }

    private LogEntry<T> decode(byte[] payload) {
        try {
            return mapper.readValue(payload, entryType);
        } catch (IOException e) {
            // CRC was fine, so this is a format problem, not a torn write.
            throw new IllegalStateException("undecodable WAL entry", e);
        }
    }
}
