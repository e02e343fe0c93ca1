package io.mediarealm.server.sync;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff with jitter, capped.
 * <p>
 * delay(n) = jitter(min(max, initial * 2^(n-1))), where jitter picks uniformly
 * in [d/2, d] so that several failing sources do not retry in lockstep.
 */
public final class Backoff {
    private final long initialMillis;
    private final long maxMillis;
    private final Random random;

    public Backoff(Duration initial, Duration max, Random random) {
        if (initial.isNegative() || initial.isZero()) throw new IllegalArgumentException("initial must be > 0");
        if (max.compareTo(initial) < 0) throw new IllegalArgumentException("max must be >= initial");
        this.initialMillis = initial.toMillis();
        this.maxMillis = max.toMillis();
        this.random = random;
    }

    public Backoff(Duration initial, Duration max) {
        this(initial, max, new Random());
    }

    /** Delay before retry number {@code attempt}, 1-based. */
    public Duration delay(int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
        int shift = Math.min(attempt - 1, 30);
        long capped = Math.min(maxMillis, initialMillis << shift);
        if (capped < 0) {
            capped = maxMillis; // overflow
        }
        long half = capped / 2;
        long jitter = (long) (random.nextDouble() * (capped - half + 1));
        return Duration.ofMillis(Math.min(capped, half + jitter));
    }
}
