package io.mediarealm.storage.mirror;

import io.mediarealm.core.mirror.ChangeEvent;
import io.mediarealm.core.mirror.ChangeRecord;
import io.mediarealm.core.mirror.EntityKind;
import io.mediarealm.core.mirror.EntityRef;
import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.mirror.MirrorReconciler;
import io.mediarealm.core.mirror.MirroredEntity;
import io.mediarealm.core.mirror.Series;
import io.mediarealm.storage.FileSnapshotter;
import io.mediarealm.storage.FileWal;
import io.mediarealm.storage.SnapshotPolicy;
import io.mediarealm.storage.Snapshotter;
import io.mediarealm.storage.TxLog;
import io.mediarealm.storage.Wal;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Durable mirror store.
 * <p>
 * Responsibilities:
 *  - Maintain in-memory maps id -> Series and id -> Event, plus the ordered
 *    index queue.
 *  - On applyBatch:
 *      1) Reconcile every record against the current state (and against
 *         earlier records of the same batch).
 *      2) Serialize all effective writes + queue additions into one
 *         {@link MirrorTx} and append+fsync it.
 *      3) Apply the transaction to memory.
 *      4) Possibly snapshot and compact the log.
 *  - On startup:
 *      1) Load the latest snapshot (if any).
 *      2) Replay transactions with an LSN above the snapshot's.
 * <p>
 * A batch that changes nothing writes nothing, so re-applying a batch leaves
 * the store (and the log) untouched.
 */
public final class DurableMirrorStore implements MirrorStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(DurableMirrorStore.class.getName());

    private final Map<String, Series> series = new HashMap<>();
    private final Map<String, Event> events = new HashMap<>();
    // ref -> sequence of its latest enqueue, oldest entry first
    private final LinkedHashMap<EntityRef, Long> indexQueue = new LinkedHashMap<>();
    private long nextTicket = 1;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final TxLog<MirrorTx> log;
    private final Snapshotter<MirrorState> snaps;
    private final SnapshotPolicy snapPolicy;

    public DurableMirrorStore(Wal wal, Snapshotter<MirrorState> snaps, SnapshotPolicy snapPolicy) {
        this.log = new TxLog<>(wal, MirrorTx.class);
        this.snaps = snaps;
        this.snapPolicy = snapPolicy;
        recover();
    }

    /** Standard on-disk layout: {@code dir/wal} and {@code dir/snapshots}. */
    public static DurableMirrorStore open(Path dir, long walRotateBytes, int snapshotEveryTx) {
        return new DurableMirrorStore(
                new FileWal(dir.resolve("wal"), walRotateBytes),
                new FileSnapshotter<>(dir.resolve("snapshots"), MirrorState.class),
                new SnapshotPolicy(snapshotEveryTx));
    }

    @Override
    public List<ChangeEvent> applyBatch(List<ChangeRecord> batch) {
        lock.writeLock().lock();
        try {
            // Later records of the batch must see the effect of earlier ones.
            Map<EntityRef, MirroredEntity> pending = new LinkedHashMap<>();
            List<ChangeEvent> changes = new ArrayList<>();
            LinkedHashSet<EntityRef> enqueue = new LinkedHashSet<>();

            for (ChangeRecord record : batch) {
                EntityRef ref = new EntityRef(record.entityKind(), record.entityId());
                MirroredEntity stored = pending.containsKey(ref) ? pending.get(ref) : lookup(ref);
                MirrorReconciler.Outcome outcome = MirrorReconciler.reconcile(stored, record);
                if (!outcome.changed()) {
                    continue;
                }
                pending.put(ref, outcome.next());
                changes.add(outcome.event());
                enqueue.add(ref);
                if (ref.kind() == EntityKind.SERIES && seriesDocumentChanged(stored, outcome.next())) {
                    // Event documents carry the series title.
                    for (Event e : eventsOfSeries(ref.id(), pending)) {
                        enqueue.add(EntityRef.of(e));
                    }
                }
            }

            if (pending.isEmpty()) {
                LOG.fine(() -> "batch of " + batch.size() + " records changed nothing");
                return List.of();
            }

            List<IndexTicket> tickets = new ArrayList<>(enqueue.size());
            long seq = nextTicket;
            for (EntityRef ref : enqueue) {
                tickets.add(new IndexTicket(ref, seq++));
            }
            MirrorTx tx = new MirrorTx(new ArrayList<>(pending.values()), tickets, List.of());
            log.append(tx);
            apply(tx);
            snapPolicy.maybeSnapshot(this::snapshotLocked);
            return List.copyOf(changes);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Series> findSeries(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(series.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Event> findEvent(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(events.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<MirroredEntity> find(EntityRef ref) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(lookup(ref));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Event> liveEventsOfSeries(String seriesId) {
        lock.readLock().lock();
        try {
            List<Event> out = new ArrayList<>();
            for (Event e : events.values()) {
                if (!e.tombstone() && seriesId.equals(e.seriesId())) {
                    out.add(e);
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<MirroredEntity> liveEntities() {
        lock.readLock().lock();
        try {
            List<MirroredEntity> out = new ArrayList<>();
            series.values().stream().filter(s -> !s.tombstone()).forEach(out::add);
            events.values().stream().filter(e -> !e.tombstone()).forEach(out::add);
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<EntityRef> pendingIndexQueue() {
        lock.readLock().lock();
        try {
            return List.copyOf(indexQueue.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<IndexTicket> pendingIndexTickets() {
        lock.readLock().lock();
        try {
            return ticketsLocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void acknowledgeIndexed(Collection<IndexTicket> tickets) {
        lock.writeLock().lock();
        try {
            List<IndexTicket> present = tickets.stream()
                    .filter(t -> Long.valueOf(t.seq()).equals(indexQueue.get(t.ref())))
                    .distinct()
                    .toList();
            if (present.isEmpty()) {
                return;
            }
            MirrorTx tx = new MirrorTx(List.of(), List.of(), present);
            log.append(tx);
            apply(tx);
            snapPolicy.maybeSnapshot(this::snapshotLocked);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Force a snapshot + log compaction now. */
    public void snapshot() {
        lock.writeLock().lock();
        try {
            snapshotLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        log.close();
    }

    private MirroredEntity lookup(EntityRef ref) {
        return switch (ref.kind()) {
            case SERIES -> series.get(ref.id());
            case EVENT -> events.get(ref.id());
        };
    }

    private static boolean seriesDocumentChanged(MirroredEntity before, MirroredEntity after) {
        if (before == null) {
            return true;
        }
        Series b = (Series) before;
        Series a = (Series) after;
        return b.tombstone() != a.tombstone() || !Objects.equals(b.title(), a.title());
    }

    private List<Event> eventsOfSeries(String seriesId, Map<EntityRef, MirroredEntity> pending) {
        Map<String, Event> merged = new HashMap<>(events);
        for (MirroredEntity m : pending.values()) {
            if (m instanceof Event e) {
                merged.put(e.id(), e);
            }
        }
        return merged.values().stream()
                .filter(e -> !e.tombstone() && seriesId.equals(e.seriesId()))
                .toList();
    }

    private void apply(MirrorTx tx) {
        for (MirroredEntity entity : tx.writes()) {
            if (entity instanceof Series s) {
                series.put(s.id(), s);
            } else if (entity instanceof Event e) {
                events.put(e.id(), e);
            }
        }
        for (IndexTicket t : tx.enqueued()) {
            indexQueue.put(t.ref(), t.seq());
            nextTicket = Math.max(nextTicket, t.seq() + 1);
        }
        for (IndexTicket t : tx.acknowledged()) {
            indexQueue.remove(t.ref(), t.seq());
        }
    }

    private List<IndexTicket> ticketsLocked() {
        List<IndexTicket> out = new ArrayList<>(indexQueue.size());
        indexQueue.forEach((ref, seq) -> out.add(new IndexTicket(ref, seq)));
        return out;
    }

    private void snapshotLocked() {
        MirrorState state = new MirrorState(
                new ArrayList<>(series.values()),
                new ArrayList<>(events.values()),
                ticketsLocked());
        snaps.writeSnapshot(log.lastLsn(), state);
        log.compact();
    }

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay log entries newer than the snapshot, in order.
     */
    private void recover() {
        long fromLsn = 0;
        Snapshotter.LoadedSnapshot<MirrorState> loaded = snaps.loadLatest();
        if (loaded != null && loaded.state() != null) {
            MirrorState state = loaded.state();
            state.series().forEach(s -> series.put(s.id(), s));
            state.events().forEach(e -> events.put(e.id(), e));
            for (IndexTicket t : state.indexQueue()) {
                indexQueue.put(t.ref(), t.seq());
                nextTicket = Math.max(nextTicket, t.seq() + 1);
            }
            fromLsn = loaded.lsn();
        }
        int replayed = log.replay(fromLsn, this::apply);
        LOG.info(String.format("mirror store recovered: %d series, %d events, %d queued for indexing (%d log entries replayed)",
                series.size(), events.size(), indexQueue.size(), replayed));
    }
}
