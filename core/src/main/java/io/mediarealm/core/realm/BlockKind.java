package io.mediarealm.core.realm;

/** Tag of the closed block variant set. */
public enum BlockKind {
    TITLE,
    TEXT,
    SERIES,
    VIDEO
}
