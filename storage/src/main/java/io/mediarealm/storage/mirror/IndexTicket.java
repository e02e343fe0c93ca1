package io.mediarealm.storage.mirror;

import io.mediarealm.core.mirror.EntityRef;

import java.util.Objects;

/**
 * One index-queue entry. {@code seq} changes every time the entity is queued
 * again, so an acknowledgement only clears the version that was indexed.
 */
public record IndexTicket(EntityRef ref, long seq) {

    public IndexTicket {
        Objects.requireNonNull(ref, "ref");
    }
}
