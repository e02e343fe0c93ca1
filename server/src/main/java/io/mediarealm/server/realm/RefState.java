package io.mediarealm.server.realm;

/** Resolution state of a block's reference to mirrored content. */
public enum RefState {
    LIVE,
    /** Referenced entity is tombstoned or was never seen. */
    DELETED,
    /** Entity exists, but the caller's roles do not grant read access. */
    NOT_ALLOWED
}
