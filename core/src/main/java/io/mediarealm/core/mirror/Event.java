package io.mediarealm.core.mirror;

import java.util.List;
import java.util.Objects;

/**
 * A single video. {@code seriesId} is null for standalone events.
 * {@code duration} is in milliseconds, {@code created} and {@code updated}
 * are epoch millis.
 */
public record Event(
        String id,
        String seriesId,
        String title,
        String description,
        String creator,
        Long duration,
        String thumbnail,
        long created,
        long updated,
        List<Track> tracks,
        Acl acl,
        boolean tombstone
) implements MirroredEntity {

    public Event {
        Objects.requireNonNull(id, "id");
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
        acl = acl == null ? Acl.empty() : acl;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.EVENT;
    }

    @Override
    public Event asTombstone(long revision) {
        return new Event(id, seriesId, title, description, creator, duration, thumbnail,
                created, revision, tracks, acl, true);
    }

    public static Event deletedStub(String id, long revision) {
        return new Event(id, null, null, null, null, null, null,
                0L, revision, List.of(), Acl.empty(), true);
    }
}
