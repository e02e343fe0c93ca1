package io.mediarealm.server.realm;

import io.mediarealm.core.access.AccessControl;
import io.mediarealm.core.access.User;
import io.mediarealm.core.error.ConflictException;
import io.mediarealm.core.error.NotAuthorizedException;
import io.mediarealm.core.error.NotFoundException;
import io.mediarealm.core.error.ValidationException;
import io.mediarealm.core.mirror.MirroredEntity;
import io.mediarealm.core.realm.Block;
import io.mediarealm.core.realm.BlockContent;
import io.mediarealm.core.realm.PathSegments;
import io.mediarealm.core.realm.Realm;
import io.mediarealm.core.realm.RealmOrder;
import io.mediarealm.core.realm.RealmPaths;
import io.mediarealm.storage.mirror.MirrorStore;
import io.mediarealm.storage.realm.RealmOp;
import io.mediarealm.storage.realm.RealmStore;
import io.mediarealm.storage.realm.RealmTx;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Write side of the realm tree.
 * <p>
 * Every operation:
 *  1) checks the caller may write the target realm,
 *  2) locks the affected subtree(s) in {@link PathLocks},
 *  3) re-reads the target under the lock (it may have moved meanwhile),
 *  4) validates, then commits all resulting ops as one {@link RealmTx}.
 * <p>
 * Failures: {@link ValidationException} (bad input, listing the violated
 * rules), {@link NotFoundException}, {@link NotAuthorizedException},
 * {@link ConflictException} (concurrent structural change; retry).
 */
public final class RealmMutations {
    private static final Logger LOG = Logger.getLogger(RealmMutations.class.getName());

    public static final String BLANK_NAME = "name-must-not-be-blank";
    public static final String PATH_COLLISION = "path-collision";
    public static final String ROOT_IMMUTABLE = "root-cannot-be-changed";
    public static final String BLOCK_INDEX = "block-index-out-of-range";
    public static final String BLOCKS_NOT_ADJACENT = "blocks-not-adjacent";
    public static final String BLOCK_KIND_CHANGED = "block-type-cannot-change";
    public static final String NOT_A_PERMUTATION = "child-order-not-a-permutation";
    public static final String BLANK_TITLE = "title-must-not-be-blank";

    private final RealmStore store;
    private final MirrorStore mirror;
    private final AccessControl access;
    private final PathLocks locks;

    public RealmMutations(RealmStore store, MirrorStore mirror, AccessControl access, PathLocks locks) {
        this.store = store;
        this.mirror = mirror;
        this.access = access;
        this.locks = locks;
    }

    // ---------- tree structure ----------

    /** Create a child realm at the end of the parent's manual order. */
    public Realm addChild(User user, long parentId, String name, String pathSegment) {
        Realm parent = requireWritable(user, parentId);
        List<String> violations = new ArrayList<>(PathSegments.violations(pathSegment));
        if (name == null || name.isBlank()) {
            violations.add(BLANK_NAME);
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        try (PathLocks.Lease ignored = locks.acquire(parent.fullPath())) {
            parent = reread(parent);
            String path = RealmPaths.child(parent.fullPath(), pathSegment);
            requireFreePath(path);
            int index = nextChildIndex(parent.id());
            Realm child = new Realm(store.allocateRealmId(), parent.id(), name.trim(), pathSegment, path,
                    RealmOrder.ALPHABETIC_ASC, index, parent.owner());
            store.commit(RealmTx.of(new RealmOp.PutRealm(child)));
            LOG.info(() -> "realm " + child.fullPath() + " created by " + user.username());
            return child;
        }
    }

    /** Create (or return the existing) personal realm "/@username" of the caller. */
    public Realm createUserRealm(User user) {
        if (!access.canCreateUserRealm(user)) {
            throw new NotAuthorizedException("only logged-in users have a user realm");
        }
        String segment = RealmPaths.userRealmSegment(user.username());
        // The leading '@' is what marks a user realm; every other segment rule applies.
        List<String> violations = new ArrayList<>(PathSegments.violations(segment));
        violations.remove(PathSegments.RESERVED_CHAR);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        String path = RealmPaths.child("", segment);
        try (PathLocks.Lease ignored = locks.acquire(List.of("", path))) {
            Optional<Realm> existing = store.realmByPath(path);
            if (existing.isPresent()) {
                return existing.get();
            }
            String name = user.displayName() == null ? user.username() : user.displayName();
            Realm realm = new Realm(store.allocateRealmId(), Realm.ROOT_ID, name, segment, path,
                    RealmOrder.ALPHABETIC_ASC, nextChildIndex(Realm.ROOT_ID), user.username());
            store.commit(RealmTx.of(new RealmOp.PutRealm(realm)));
            LOG.info(() -> "user realm " + path + " created");
            return realm;
        }
    }

    public Realm rename(User user, long realmId, String name) {
        Realm realm = requireWritable(user, realmId);
        requireNotRoot(realm);
        if (name == null || name.isBlank()) {
            throw new ValidationException(BLANK_NAME, "realm name must not be blank");
        }
        try (PathLocks.Lease ignored = locks.acquire(realm.fullPath())) {
            Realm renamed = reread(realm).withName(name.trim());
            store.commit(RealmTx.of(new RealmOp.PutRealm(renamed)));
            return renamed;
        }
    }

    /** Change a realm's segment; the whole subtree moves along, atomically. */
    public Realm changePathSegment(User user, long realmId, String newSegment) {
        Realm realm = requireWritable(user, realmId);
        requireNotRoot(realm);
        if (realm.isUserRealm() && realm.parentId() == Realm.ROOT_ID) {
            throw new ValidationException(ROOT_IMMUTABLE, "the path of a user realm is fixed");
        }
        PathSegments.requireValid(newSegment);

        Realm parent = store.realm(realm.parentId()).orElseThrow(() -> gone(realm.parentId()));
        String newPath = RealmPaths.child(parent.fullPath(), newSegment);
        try (PathLocks.Lease ignored = locks.acquire(List.of(realm.fullPath(), newPath))) {
            Realm current = reread(realm);
            if (current.fullPath().equals(newPath)) {
                return current;
            }
            requireFreePath(newPath);

            String oldPath = current.fullPath();
            List<RealmOp> ops = new ArrayList<>();
            Realm moved = current.withPath(newSegment, newPath);
            ops.add(new RealmOp.PutRealm(moved));
            for (Realm d : store.descendants(current.id())) {
                ops.add(new RealmOp.PutRealm(d.withPath(d.pathSegment(), RealmPaths.rebase(d.fullPath(), oldPath, newPath))));
            }
            store.commit(new RealmTx(ops));
            LOG.info(() -> "realm " + oldPath + " moved to " + newPath + " (" + ops.size() + " realms)");
            return moved;
        }
    }

    /**
     * Delete a realm with its whole subtree and every block in it.
     *
     * @return number of realms removed
     */
    public int delete(User user, long realmId) {
        Realm realm = requireWritable(user, realmId);
        requireNotRoot(realm);
        try (PathLocks.Lease ignored = locks.acquire(realm.fullPath())) {
            Realm current = reread(realm);
            List<Long> ids = new ArrayList<>();
            ids.add(current.id());
            store.descendants(current.id()).forEach(d -> ids.add(d.id()));
            store.commit(RealmTx.of(new RealmOp.DeleteRealms(ids)));
            LOG.info(() -> "realm " + current.fullPath() + " deleted with " + (ids.size() - 1) + " descendants");
            return ids.size();
        }
    }

    /**
     * Switch the child ordering mode. With {@link RealmOrder#BY_INDEX} an
     * explicit sequence of child ids may be given; it must be a permutation
     * of the current children.
     */
    public Realm setChildOrder(User user, long realmId, RealmOrder order, List<Long> childIds) {
        Realm realm = requireWritable(user, realmId);
        if (order == null) {
            throw new ValidationException(List.of("child-order-missing"));
        }
        try (PathLocks.Lease ignored = locks.acquire(realm.fullPath())) {
            Realm current = reread(realm).withChildOrder(order);
            List<RealmOp> ops = new ArrayList<>();
            ops.add(new RealmOp.PutRealm(current));
            if (order == RealmOrder.BY_INDEX && childIds != null) {
                List<Realm> children = store.children(current.id());
                Set<Long> actual = new HashSet<>();
                children.forEach(c -> actual.add(c.id()));
                if (childIds.size() != actual.size() || !actual.equals(new HashSet<>(childIds))) {
                    throw new ValidationException(NOT_A_PERMUTATION,
                            "child order must list every child of " + current.fullPath() + " exactly once");
                }
                for (int i = 0; i < childIds.size(); i++) {
                    Realm child = store.realm(childIds.get(i)).orElseThrow();
                    if (child.index() != i) {
                        ops.add(new RealmOp.PutRealm(child.withIndex(i)));
                    }
                }
            }
            store.commit(new RealmTx(ops));
            return current;
        }
    }

    // ---------- blocks ----------

    /** Insert at {@code index} (0..size); later blocks shift down by one. */
    public Block insertBlock(User user, long realmId, int index, BlockContent content) {
        return insert(user, realmId, index, content);
    }

    /** Insert after the last block. */
    public Block appendBlock(User user, long realmId, BlockContent content) {
        return insert(user, realmId, null, content);
    }

    private Block insert(User user, long realmId, Integer at, BlockContent content) {
        Realm realm = requireWritable(user, realmId);
        validateContent(content);
        try (PathLocks.Lease ignored = locks.acquire(realm.fullPath())) {
            reread(realm);
            List<Block> blocks = new ArrayList<>(store.blocks(realmId));
            int index = at == null ? blocks.size() : at;
            if (index < 0 || index > blocks.size()) {
                throw new ValidationException(BLOCK_INDEX, "index " + index + " not in 0.." + blocks.size());
            }
            Block inserted = new Block(store.allocateBlockId(), realmId, index, content);
            blocks.add(index, inserted);
            store.commit(RealmTx.of(new RealmOp.PutBlocks(realmId, reindex(blocks))));
            return inserted;
        }
    }

    /** Replace the content of a block. Its type cannot change. */
    public Block updateBlock(User user, long realmId, int index, BlockContent content) {
        Realm realm = requireWritable(user, realmId);
        validateContent(content);
        try (PathLocks.Lease ignored = locks.acquire(realm.fullPath())) {
            reread(realm);
            List<Block> blocks = new ArrayList<>(store.blocks(realmId));
            requireIndex(blocks, index);
            Block old = blocks.get(index);
            if (old.kind() != content.kind()) {
                throw new ValidationException(BLOCK_KIND_CHANGED,
                        "block " + index + " is " + old.kind() + ", not " + content.kind());
            }
            Block updated = old.withContent(content);
            blocks.set(index, updated);
            store.commit(RealmTx.of(new RealmOp.PutBlocks(realmId, blocks)));
            return updated;
        }
    }

    /** Exchange two neighbouring blocks ("move up" / "move down"). */
    public List<Block> swapBlocks(User user, long realmId, int indexA, int indexB) {
        Realm realm = requireWritable(user, realmId);
        if (Math.abs(indexA - indexB) != 1) {
            throw new ValidationException(BLOCKS_NOT_ADJACENT, "only neighbouring blocks can be swapped");
        }
        try (PathLocks.Lease ignored = locks.acquire(realm.fullPath())) {
            reread(realm);
            List<Block> blocks = new ArrayList<>(store.blocks(realmId));
            requireIndex(blocks, indexA);
            requireIndex(blocks, indexB);
            Block a = blocks.get(indexA);
            blocks.set(indexA, blocks.get(indexB));
            blocks.set(indexB, a);
            List<Block> result = reindex(blocks);
            store.commit(RealmTx.of(new RealmOp.PutBlocks(realmId, result)));
            return result;
        }
    }

    /** Remove the block at {@code index}; later blocks shift up by one. */
    public List<Block> removeBlock(User user, long realmId, int index) {
        Realm realm = requireWritable(user, realmId);
        try (PathLocks.Lease ignored = locks.acquire(realm.fullPath())) {
            reread(realm);
            List<Block> blocks = new ArrayList<>(store.blocks(realmId));
            requireIndex(blocks, index);
            blocks.remove(index);
            List<Block> result = reindex(blocks);
            store.commit(RealmTx.of(new RealmOp.PutBlocks(realmId, result)));
            return result;
        }
    }

    // ---------- helpers ----------

    private Realm requireWritable(User user, long realmId) {
        Realm realm = store.realm(realmId).orElseThrow(() -> gone(realmId));
        if (!access.canWrite(user, realm)) {
            throw new NotAuthorizedException("not allowed to edit realm " + displayPath(realm));
        }
        return realm;
    }

    /** Re-read under the lock; fail if the realm vanished or moved since it was locked. */
    private Realm reread(Realm locked) {
        Realm current = store.realm(locked.id()).orElseThrow(() -> gone(locked.id()));
        if (!current.fullPath().equals(locked.fullPath())) {
            throw new ConflictException("realm " + locked.id() + " was moved concurrently; try again");
        }
        return current;
    }

    private void requireFreePath(String path) {
        if (store.realmByPath(path).isPresent()) {
            throw new ValidationException(PATH_COLLISION, "a realm with path " + path + " already exists");
        }
    }

    private static void requireNotRoot(Realm realm) {
        if (realm.isRoot()) {
            throw new ValidationException(ROOT_IMMUTABLE, "the root realm cannot be renamed, moved or deleted");
        }
    }

    private static void requireIndex(List<Block> blocks, int index) {
        if (index < 0 || index >= blocks.size()) {
            throw new ValidationException(BLOCK_INDEX, "no block at index " + index);
        }
    }

    private int nextChildIndex(long parentId) {
        int max = -1;
        for (Realm c : store.children(parentId)) {
            max = Math.max(max, c.index());
        }
        return max + 1;
    }

    private void validateContent(BlockContent content) {
        if (content == null) {
            throw new ValidationException(List.of("block-content-missing"));
        }
        switch (content.kind()) {
            case TITLE -> {
                String text = ((BlockContent.Title) content).text();
                if (text == null || text.isBlank()) {
                    throw new ValidationException(BLANK_TITLE, "title block needs text");
                }
            }
            case TEXT -> {
                // any text, including empty
            }
            case SERIES -> requireLive(mirror.findSeries(((BlockContent.SeriesRef) content).seriesId()), "series");
            case VIDEO -> requireLive(mirror.findEvent(((BlockContent.VideoRef) content).eventId()), "event");
        }
    }

    private static void requireLive(Optional<? extends MirroredEntity> entity, String what) {
        if (entity.isEmpty() || entity.get().tombstone()) {
            throw new NotFoundException("referenced " + what + " does not exist");
        }
    }

    private static List<Block> reindex(List<Block> blocks) {
        List<Block> out = new ArrayList<>(blocks.size());
        for (int i = 0; i < blocks.size(); i++) {
            Block b = blocks.get(i);
            out.add(b.index() == i ? b : b.atIndex(i));
        }
        return out;
    }

    private static NotFoundException gone(long id) {
        return new NotFoundException("realm " + id + " does not exist");
    }

    private static String displayPath(Realm realm) {
        return realm.isRoot() ? "/" : realm.fullPath();
    }
}
