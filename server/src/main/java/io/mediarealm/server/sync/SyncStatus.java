package io.mediarealm.server.sync;

import java.time.Instant;

/** Point-in-time view of a sync source, for operators. */
public record SyncStatus(
        String source,
        SyncState state,
        String cursor,
        Instant lastSuccess,
        int consecutiveFailures,
        boolean halted,
        String haltReason
) {
}
