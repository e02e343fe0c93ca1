package io.mediarealm.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot policy that triggers a full snapshot after every N transactions.
 * <p>
 * Bounds worst-case recovery time by limiting WAL replay length. Does not
 * consider file size or time.
 */
public final class SnapshotPolicy {
    private final int everyTx;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyTx) {
        if (everyTx <= 0) throw new IllegalArgumentException("everyTx must be > 0");
        this.everyTx = everyTx;
    }

    /** Call after each durable transaction. Runs {@code snapshot} when the threshold is hit. */
    public void maybeSnapshot(Runnable snapshot) {
        if (sinceLast.incrementAndGet() >= everyTx) {
            snapshot.run();
            sinceLast.set(0);
        }
    }
}
