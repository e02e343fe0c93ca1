package io.mediarealm.core.mirror;

/**
 * Emitted by the mirror store for every write that actually changed state.
 * Downstream consumers (search indexer) react to these; no-op applications
 * emit nothing.
 */
public record ChangeEvent(EntityKind kind, String id, Type type, long revision) {

    public enum Type {
        UPSERTED,
        TOMBSTONED
    }
}
