package io.mediarealm.storage.realm;

import io.mediarealm.core.realm.Block;
import io.mediarealm.core.realm.Realm;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Durable realm tree: realms keyed by id with a parent id, a path index and
 * per-realm block lists.
 * <p>
 * Invariants enforced on every commit:
 *  - every realm except the root has an existing parent,
 *  - full paths are unique,
 *  - the root is never deleted.
 * Violations fail the commit with a {@code ConflictException} and leave the
 * store unchanged.
 */
public interface RealmStore {

    Optional<Realm> realm(long id);

    Optional<Realm> realmByPath(String fullPath);

    /** Direct children, in no particular order. */
    List<Realm> children(long parentId);

    /** All realms strictly below {@code id}, parents before children. */
    List<Realm> descendants(long id);

    /** Blocks of a realm ordered by index. */
    List<Block> blocks(long realmId);

    /** Blocks of every realm that satisfy {@code filter}. */
    List<Block> findBlocks(Predicate<Block> filter);

    long allocateRealmId();

    long allocateBlockId();

    /** Apply all ops of {@code tx} atomically and durably. */
    void commit(RealmTx tx);
}
