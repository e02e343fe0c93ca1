package io.mediarealm.core.realm;

/** How a realm's children are ordered when listed. */
public enum RealmOrder {
    ALPHABETIC_ASC,
    ALPHABETIC_DESC,
    /** Manual order by each child's {@code index}; new children go last. */
    BY_INDEX
}
