package io.mediarealm.server.realm;

import io.mediarealm.core.error.ConflictException;
import io.mediarealm.core.realm.RealmPaths;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Subtree locks keyed by materialized path.
 * <p>
 * A lock on "/a" covers "/a" and everything below it; two locks conflict when
 * one path lies within the other. Structural mutations of overlapping
 * subtrees therefore run one after another, disjoint subtrees in parallel.
 * A caller that cannot get its locks within the timeout gets a
 * {@link ConflictException} and may retry.
 */
public final class PathLocks {

    private final Map<Long, List<String>> held = new HashMap<>();
    private final Duration timeout;
    private long nextStamp = 1;

    public PathLocks(Duration timeout) {
        this.timeout = timeout;
    }

    /** Lock all of {@code paths} at once; blocks while any overlaps a held lock. */
    public Lease acquire(List<String> paths) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (this) {
            while (overlapsHeld(paths)) {
                long leftMillis = (deadline - System.nanoTime()) / 1_000_000L;
                if (leftMillis <= 0) {
                    throw new ConflictException("another change to " + paths + " is in progress; try again");
                }
                try {
                    wait(leftMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ConflictException("interrupted while waiting for " + paths);
                }
            }
            long stamp = nextStamp++;
            held.put(stamp, List.copyOf(paths));
            return new Lease(stamp);
        }
    }

    public Lease acquire(String path) {
        return acquire(List.of(path));
    }

    synchronized int heldCount() {
        return held.size();
    }

    private synchronized void release(long stamp) {
        if (held.remove(stamp) != null) {
            notifyAll();
        }
    }

    private boolean overlapsHeld(List<String> paths) {
        for (List<String> lease : held.values()) {
            for (String h : lease) {
                for (String p : paths) {
                    if (RealmPaths.isWithin(p, h) || RealmPaths.isWithin(h, p)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /** Held lock; release with try-with-resources. */
    public final class Lease implements AutoCloseable {
        private final long stamp;

        private Lease(long stamp) {
            this.stamp = stamp;
        }

        @Override
        public void close() {
            release(stamp);
        }
    }
}
