package io.mediarealm.core.mirror;

/** The two kinds of entities mirrored from the video-management system. */
public enum EntityKind {
    SERIES,
    EVENT
}
