package io.mediarealm.server.sync;

import java.time.Duration;

/**
 * @param pollInterval   wait between cycles when the source has nothing more
 * @param initialBackoff first retry delay after a transient failure
 * @param maxBackoff     cap of the retry delay
 */
public record SyncSettings(Duration pollInterval, Duration initialBackoff, Duration maxBackoff) {

    public static SyncSettings defaults() {
        return new SyncSettings(Duration.ofSeconds(30), Duration.ofSeconds(1), Duration.ofMinutes(5));
    }
}
