package io.mediarealm.storage.realm;

import io.mediarealm.core.error.ConflictException;
import io.mediarealm.core.realm.Block;
import io.mediarealm.core.realm.Realm;
import io.mediarealm.storage.FileSnapshotter;
import io.mediarealm.storage.FileWal;
import io.mediarealm.storage.SnapshotPolicy;
import io.mediarealm.storage.Snapshotter;
import io.mediarealm.storage.TxLog;
import io.mediarealm.storage.Wal;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Durable realm tree store.
 * <p>
 * Memory layout is an arena: realms by id, a parent -> children id index, a
 * full path -> id index, and realm id -> block list. Realms never hold
 * references to each other.
 * <p>
 * commit():
 *  1) validate the transaction against current state (under the write lock),
 *  2) append+fsync it as one WAL record,
 *  3) apply to memory,
 *  4) possibly snapshot and compact.
 * Readers take the read lock, so they observe either none or all of a
 * transaction.
 */
public final class DurableRealmStore implements RealmStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(DurableRealmStore.class.getName());

    private final Map<Long, Realm> realms = new HashMap<>();
    private final Map<Long, Set<Long>> childrenByParent = new HashMap<>();
    private final Map<String, Long> byPath = new HashMap<>();
    private final Map<Long, List<Block>> blocksByRealm = new HashMap<>();
    private final AtomicLong nextRealmId = new AtomicLong(Realm.ROOT_ID + 1);
    private final AtomicLong nextBlockId = new AtomicLong(1);
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final TxLog<RealmTx> log;
    private final Snapshotter<RealmState> snaps;
    private final SnapshotPolicy snapPolicy;

    public DurableRealmStore(Wal wal, Snapshotter<RealmState> snaps, SnapshotPolicy snapPolicy) {
        this.log = new TxLog<>(wal, RealmTx.class);
        this.snaps = snaps;
        this.snapPolicy = snapPolicy;
        recover();
        if (!realms.containsKey(Realm.ROOT_ID)) {
            commit(RealmTx.of(new RealmOp.PutRealm(Realm.root())));
            LOG.info("created root realm");
        }
    }

    /** Standard on-disk layout: {@code dir/wal} and {@code dir/snapshots}. */
    public static DurableRealmStore open(Path dir, long walRotateBytes, int snapshotEveryTx) {
        return new DurableRealmStore(
                new FileWal(dir.resolve("wal"), walRotateBytes),
                new FileSnapshotter<>(dir.resolve("snapshots"), RealmState.class),
                new SnapshotPolicy(snapshotEveryTx));
    }

    @Override
    public Optional<Realm> realm(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(realms.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Realm> realmByPath(String fullPath) {
        lock.readLock().lock();
        try {
            Long id = byPath.get(fullPath);
            return id == null ? Optional.empty() : Optional.ofNullable(realms.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Realm> children(long parentId) {
        lock.readLock().lock();
        try {
            List<Realm> out = new ArrayList<>();
            for (Long id : childrenByParent.getOrDefault(parentId, Set.of())) {
                out.add(realms.get(id));
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Realm> descendants(long id) {
        lock.readLock().lock();
        try {
            List<Realm> out = new ArrayList<>();
            Deque<Long> todo = new ArrayDeque<>(childrenByParent.getOrDefault(id, Set.of()));
            while (!todo.isEmpty()) {
                long next = todo.removeFirst();
                out.add(realms.get(next));
                todo.addAll(childrenByParent.getOrDefault(next, Set.of()));
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Block> blocks(long realmId) {
        lock.readLock().lock();
        try {
            return blocksByRealm.getOrDefault(realmId, List.of());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Block> findBlocks(Predicate<Block> filter) {
        lock.readLock().lock();
        try {
            List<Block> out = new ArrayList<>();
            for (List<Block> list : blocksByRealm.values()) {
                for (Block b : list) {
                    if (filter.test(b)) {
                        out.add(b);
                    }
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long allocateRealmId() {
        return nextRealmId.getAndIncrement();
    }

    @Override
    public long allocateBlockId() {
        return nextBlockId.getAndIncrement();
    }

    @Override
    public void commit(RealmTx tx) {
        lock.writeLock().lock();
        try {
            validate(tx);
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

    /**
     * Checks the structural invariants the transaction would leave behind.
     * Works on an overlay of the ids and paths the transaction touches instead
     * of copying the whole tree.
     */
    private void validate(RealmTx tx) {
        Map<Long, Realm> touched = new HashMap<>();
        Set<Long> deleted = new HashSet<>();
        Map<String, Long> pathOverlay = new HashMap<>();

        for (RealmOp op : tx.ops()) {
            if (op instanceof RealmOp.PutRealm put) {
                Realm r = put.realm();
                if (deleted.contains(r.id())) {
                    throw new ConflictException("realm " + r.id() + " is deleted in the same transaction");
                }
                if (r.id() == Realm.ROOT_ID) {
                    if (r.parentId() != null || !r.fullPath().isEmpty()) {
                        throw new ConflictException("root realm cannot be moved");
                    }
                } else {
                    if (r.parentId() == null) {
                        throw new ConflictException("realm " + r.id() + " has no parent");
                    }
                    long parent = r.parentId();
                    boolean parentExists = !deleted.contains(parent)
                            && (touched.containsKey(parent) || realms.containsKey(parent));
                    if (!parentExists) {
                        throw new ConflictException("parent realm " + parent + " does not exist");
                    }
                }
                Realm before = touched.containsKey(r.id()) ? touched.get(r.id()) : realms.get(r.id());
                if (before != null && !before.fullPath().equals(r.fullPath())) {
                    pathOverlay.put(before.fullPath(), null);
                }
                Long holder = pathOverlay.containsKey(r.fullPath())
                        ? pathOverlay.get(r.fullPath())
                        : byPath.get(r.fullPath());
                if (holder != null && holder != r.id()) {
                    throw new ConflictException("path " + r.fullPath() + " is already taken");
                }
                pathOverlay.put(r.fullPath(), r.id());
                touched.put(r.id(), r);
            } else if (op instanceof RealmOp.DeleteRealms del) {
                for (long id : del.ids()) {
                    if (id == Realm.ROOT_ID) {
                        throw new ConflictException("the root realm cannot be deleted");
                    }
                    Realm before = touched.containsKey(id) ? touched.get(id) : realms.get(id);
                    if (before == null || deleted.contains(id)) {
                        throw new ConflictException("realm " + id + " was already deleted");
                    }
                    deleted.add(id);
                    touched.remove(id);
                    pathOverlay.put(before.fullPath(), null);
                }
            } else if (op instanceof RealmOp.PutBlocks pb) {
                boolean exists = !deleted.contains(pb.realmId())
                        && (touched.containsKey(pb.realmId()) || realms.containsKey(pb.realmId()));
                if (!exists) {
                    throw new ConflictException("realm " + pb.realmId() + " does not exist");
                }
            }
        }

        // Deleting a realm while keeping any of its children would leave a dangling parent.
        for (long id : deleted) {
            for (Long child : childrenByParent.getOrDefault(id, Set.of())) {
                if (!deleted.contains(child)) {
                    Realm moved = touched.get(child);
                    if (moved == null || moved.parentId() == null || moved.parentId() == id) {
                        throw new ConflictException("realm " + id + " still has child " + child);
                    }
                }
            }
        }
    }

    private void apply(RealmTx tx) {
        for (RealmOp op : tx.ops()) {
            if (op instanceof RealmOp.PutRealm put) {
                putRealm(put.realm());
            } else if (op instanceof RealmOp.DeleteRealms del) {
                del.ids().forEach(this::removeRealm);
            } else if (op instanceof RealmOp.PutBlocks pb) {
                if (pb.blocks().isEmpty()) {
                    blocksByRealm.remove(pb.realmId());
                } else {
                    blocksByRealm.put(pb.realmId(), pb.blocks());
                }
                for (Block b : pb.blocks()) {
                    bump(nextBlockId, b.id());
                }
            }
        }
    }

    private void putRealm(Realm r) {
        Realm old = realms.put(r.id(), r);
        if (old != null) {
            byPath.remove(old.fullPath(), old.id());
            if (old.parentId() != null) {
                Set<Long> siblings = childrenByParent.get(old.parentId());
                if (siblings != null) {
                    siblings.remove(old.id());
                }
            }
        }
        byPath.put(r.fullPath(), r.id());
        if (r.parentId() != null) {
            childrenByParent.computeIfAbsent(r.parentId(), k -> new TreeSet<>()).add(r.id());
        }
        bump(nextRealmId, r.id());
    }

    private void removeRealm(long id) {
        Realm old = realms.remove(id);
        if (old == null) {
            return;
        }
        byPath.remove(old.fullPath(), id);
        if (old.parentId() != null) {
            Set<Long> siblings = childrenByParent.get(old.parentId());
            if (siblings != null) {
                siblings.remove(id);
            }
        }
        childrenByParent.remove(id);
        blocksByRealm.remove(id);
    }

    private static void bump(AtomicLong counter, long usedId) {
        counter.accumulateAndGet(usedId + 1, Math::max);
    }

    private void snapshotLocked() {
        List<Block> allBlocks = new ArrayList<>();
        blocksByRealm.values().forEach(allBlocks::addAll);
        snaps.writeSnapshot(log.lastLsn(), new RealmState(
                new ArrayList<>(realms.values()), allBlocks, nextRealmId.get(), nextBlockId.get()));
        log.compact();
    }

    private void recover() {
        long fromLsn = 0;
        Snapshotter.LoadedSnapshot<RealmState> loaded = snaps.loadLatest();
        if (loaded != null && loaded.state() != null) {
            RealmState state = loaded.state();
            state.realms().forEach(this::putRealm);
            Map<Long, List<Block>> grouped = new HashMap<>();
            for (Block b : state.blocks()) {
                grouped.computeIfAbsent(b.realmId(), k -> new ArrayList<>()).add(b);
            }
            grouped.forEach((realmId, list) -> {
                list.sort((a, b) -> Integer.compare(a.index(), b.index()));
                blocksByRealm.put(realmId, List.copyOf(list));
            });
            bump(nextRealmId, state.nextRealmId() - 1);
            bump(nextBlockId, state.nextBlockId() - 1);
            fromLsn = loaded.lsn();
        }
        int replayed = log.replay(fromLsn, this::apply);
        LOG.info(String.format("realm store recovered: %d realms (%d log entries replayed)", realms.size(), replayed));
    }
}
