package io.mediarealm.server.sync;

import io.mediarealm.server.harvest.HarvestBatch;

/**
 * Complete loop state of one source. Carried through the loop explicitly so
 * several sources can run side by side without shared mutable state.
 *
 * @param state      current state
 * @param cursor     last durably applied cursor (null = from the beginning)
 * @param inFlight   batch between FETCHING and the cursor write, else null
 * @param failures   consecutive transient failures
 * @param haltReason reason of the protocol halt, else null
 */
public record SyncContext(SyncState state, String cursor, HarvestBatch inFlight, int failures, String haltReason) {

    public static SyncContext initial(String cursor) {
        return new SyncContext(SyncState.IDLE, cursor, null, 0, null);
    }

    SyncContext to(SyncState next) {
        return new SyncContext(next, cursor, inFlight, failures, haltReason);
    }

    SyncContext withInFlight(HarvestBatch batch) {
        return new SyncContext(state, cursor, batch, failures, haltReason);
    }

    SyncContext withCursor(String newCursor) {
        return new SyncContext(state, newCursor, inFlight, failures, haltReason);
    }

    SyncContext withFailures(int n) {
        return new SyncContext(state, cursor, inFlight, n, haltReason);
    }

    SyncContext withHaltReason(String reason) {
        return new SyncContext(state, cursor, inFlight, failures, reason);
    }
}
