package io.mediarealm.core.realm;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * A page in the realm tree.
 * <p>
 * Invariants:
 *  - Exactly one realm has {@code parentId == null}: the root, id {@link #ROOT_ID},
 *    path "" and no segment.
 *  - {@code fullPath} == parent's fullPath + "/" + {@code pathSegment}.
 *  - {@code index} is the position among siblings in manual order.
 *  - {@code owner} is set for user realms and everything below them.
 * <p>
 * The parent link is a plain id; children are found through the store's
 * parent index, never through stored child lists.
 */
public record Realm(
        long id,
        Long parentId,
        String name,
        String pathSegment,
        String fullPath,
        RealmOrder childOrder,
        int index,
        String owner
) {
    public static final long ROOT_ID = 0L;

    public Realm {
        Objects.requireNonNull(fullPath, "fullPath");
        childOrder = childOrder == null ? RealmOrder.ALPHABETIC_ASC : childOrder;
    }

    public static Realm root() {
        return new Realm(ROOT_ID, null, null, "", "", RealmOrder.ALPHABETIC_ASC, 0, null);
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentId == null;
    }

    @JsonIgnore
    public boolean isUserRealm() {
        return owner != null;
    }

    public Realm withName(String newName) {
        return new Realm(id, parentId, newName, pathSegment, fullPath, childOrder, index, owner);
    }

    public Realm withPath(String newSegment, String newFullPath) {
        return new Realm(id, parentId, name, newSegment, newFullPath, childOrder, index, owner);
    }

    public Realm withChildOrder(RealmOrder order) {
        return new Realm(id, parentId, name, pathSegment, fullPath, order, index, owner);
    }

    public Realm withIndex(int newIndex) {
        return new Realm(id, parentId, name, pathSegment, fullPath, childOrder, newIndex, owner);
    }
}
