package io.mediarealm.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single framed record and fsync it.
     *
     * @param framedRecord header+payload bytes from {@link RecordCodec#frame(byte[])}
     */
    void append(byte[] framedRecord);

    /** Rotate to a new segment if the current one grew past its threshold. */
    void rotateIfNeeded();

    /** Unconditionally start a new segment. */
    void rotate();

    /**
     * Delete every segment older than the one currently written to.
     * Only safe once a snapshot covers all records in those segments.
     */
    void deleteSealedSegments();

    /**
     * Open a sequential reader over the WAL.
     * Reader walks all segments in order and stops at:
     *  - first corrupt header,
     *  - first truncated payload, or
     *  - end of the last segment.
     */
    WalReader openReader();

    @Override
    void close();

    /**
     * Reader abstraction used during recovery.
     */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null when:
         *   - at EOF, or
         *   - corruption/truncation is detected.
         */
        byte[] next();

        @Override
        void close();
    }
}
