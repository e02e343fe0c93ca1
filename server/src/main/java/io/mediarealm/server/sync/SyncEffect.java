package io.mediarealm.server.sync;

import io.mediarealm.core.mirror.ChangeEvent;
import io.mediarealm.server.harvest.HarvestBatch;

import java.util.List;

/**
 * Work requested by a transition. {@link SyncDaemon} executes effects in order;
 * at most one effect of a step produces the next event.
 */
public sealed interface SyncEffect {

    record Fetch(String cursor) implements SyncEffect {
    }

    record Apply(HarvestBatch batch) implements SyncEffect {
    }

    record HandOff(List<ChangeEvent> changes) implements SyncEffect {
    }

    record PersistCursor(String cursor) implements SyncEffect {
    }

    record ClearCursor() implements SyncEffect {
    }

    record WaitForPoll() implements SyncEffect {
    }

    /** Sleep before retry number {@code attempt} (1-based). */
    record WaitBackoff(int attempt) implements SyncEffect {
    }

    /** Raise an operational alert. */
    record Alert(String reason) implements SyncEffect {
    }

    /** Block until an operator command arrives. */
    record AwaitOperator() implements SyncEffect {
    }
}
