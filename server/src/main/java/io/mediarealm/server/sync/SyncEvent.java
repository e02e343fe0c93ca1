package io.mediarealm.server.sync;

import io.mediarealm.core.mirror.ChangeEvent;
import io.mediarealm.server.harvest.HarvestBatch;

import java.util.List;

/** Input of {@link SyncTransitions#next}: an outcome of an effect, a timer, or an operator command. */
public sealed interface SyncEvent {

    /** The poll interval elapsed (or the loop just started). */
    record PollDue() implements SyncEvent {
    }

    record Fetched(HarvestBatch batch) implements SyncEvent {
    }

    record Applied(List<ChangeEvent> changes) implements SyncEvent {
    }

    record HandedOff() implements SyncEvent {
    }

    record CursorPersisted() implements SyncEvent {
    }

    /** Network trouble, or a local write that failed and can be retried. */
    record TransientFailure(String reason) implements SyncEvent {
    }

    record ProtocolFailure(String reason) implements SyncEvent {
    }

    record RetryDue() implements SyncEvent {
    }

    /** Operator: leave HALTED. */
    record Resume() implements SyncEvent {
    }

    /** Operator: forget the cursor and harvest everything again. */
    record ResetCursor() implements SyncEvent {
    }
}
