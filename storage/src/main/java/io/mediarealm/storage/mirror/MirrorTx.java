package io.mediarealm.storage.mirror;

import io.mediarealm.core.mirror.MirroredEntity;

import java.util.List;

/**
 * One durable mirror-store transaction: new entity states, index-queue
 * additions and index-queue removals, applied together or not at all.
 */
public record MirrorTx(List<MirroredEntity> writes, List<IndexTicket> enqueued, List<IndexTicket> acknowledged) {

    public MirrorTx {
        writes = writes == null ? List.of() : List.copyOf(writes);
        enqueued = enqueued == null ? List.of() : List.copyOf(enqueued);
        acknowledged = acknowledged == null ? List.of() : List.copyOf(acknowledged);
    }
}
