package io.mediarealm.storage.mirror;

import io.mediarealm.core.mirror.ChangeEvent;
import io.mediarealm.core.mirror.ChangeRecord;
import io.mediarealm.core.mirror.EntityRef;
import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.mirror.MirroredEntity;
import io.mediarealm.core.mirror.Series;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Local mirror of series and events harvested from the external system.
 * <p>
 * Lookups by id also return tombstoned entities so references can degrade to
 * a "deleted" marker; every listing operation excludes them.
 */
public interface MirrorStore {

    /**
     * Reconcile a harvest batch and commit all resulting writes, together with
     * the ids that need re-indexing, as one durable transaction.
     *
     * @return change events for the writes that actually changed state, in batch order
     */
    List<ChangeEvent> applyBatch(List<ChangeRecord> batch);

    Optional<Series> findSeries(String id);

    Optional<Event> findEvent(String id);

    /** Entity by kind and id, tombstones included. */
    Optional<MirroredEntity> find(EntityRef ref);

    /** Non-tombstoned events whose {@code seriesId} is the given series. */
    List<Event> liveEventsOfSeries(String seriesId);

    /** Every non-tombstoned series and event; input for a full index rebuild. */
    List<MirroredEntity> liveEntities();

    /** Entities whose search documents still have to be written, oldest first. */
    List<EntityRef> pendingIndexQueue();

    /** Same as {@link #pendingIndexQueue()}, with the sequence of each entry. */
    List<IndexTicket> pendingIndexTickets();

    /**
     * Remove entries once the search backend accepted them. An entry that was
     * queued again after its ticket was taken stays in the queue.
     */
    void acknowledgeIndexed(Collection<IndexTicket> tickets);
}
