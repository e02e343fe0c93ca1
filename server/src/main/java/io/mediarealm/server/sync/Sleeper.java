package io.mediarealm.server.sync;

import java.time.Duration;

/** Waits of the sync loop. Wakeable, so stop and operator commands do not wait out a poll interval. */
public interface Sleeper {

    /** Sleep for up to {@code d}; may return early after {@link #wake()}. */
    void sleep(Duration d) throws InterruptedException;

    void wake();

    static Sleeper monitor() {
        return new MonitorSleeper();
    }

    final class MonitorSleeper implements Sleeper {
        private boolean woken = false;

        @Override
        public synchronized void sleep(Duration d) throws InterruptedException {
            long deadline = System.nanoTime() + d.toNanos();
            while (!woken) {
                long leftMillis = (deadline - System.nanoTime()) / 1_000_000L;
                if (leftMillis <= 0) {
                    break;
                }
                wait(leftMillis);
            }
            woken = false;
        }

        @Override
        public synchronized void wake() {
            woken = true;
            notifyAll();
        }
    }
}
