package io.mediarealm.core.mirror;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An entity copied from the external system.
 * <p>
 * Invariants:
 *  - {@code id} is the external id: stable and globally unique per kind.
 *  - {@code updated} is the revision marker (epoch millis at the source);
 *    it only ever grows for a stored entity.
 *  - A tombstoned entity stays resolvable by id but is never live data.
 * <p>
 * Only harvest application creates or changes these; the realm tree merely
 * references them by id.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Series.class, name = "series"),
        @JsonSubTypes.Type(value = Event.class, name = "event")
})
public sealed interface MirroredEntity permits Series, Event {

    String id();

    long updated();

    boolean tombstone();

    @JsonIgnore
    EntityKind kind();

    /** Same identity, marked deleted at the given revision. */
    MirroredEntity asTombstone(long revision);
}
