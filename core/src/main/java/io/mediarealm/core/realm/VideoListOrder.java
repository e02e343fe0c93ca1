package io.mediarealm.core.realm;

/** Order in which a series block lists its events. */
public enum VideoListOrder {
    NEW_TO_OLD,
    OLD_TO_NEW,
    AZ,
    ZA
}
