package io.mediarealm.core.mirror;

import java.util.Objects;

/** A series groups events. Series carry no ACL of their own and are publicly readable. */
public record Series(
        String id,
        String title,
        String description,
        long updated,
        boolean tombstone
) implements MirroredEntity {

    public Series {
        Objects.requireNonNull(id, "id");
    }

    @Override
    public EntityKind kind() {
        return EntityKind.SERIES;
    }

    @Override
    public Series asTombstone(long revision) {
        return new Series(id, title, description, revision, true);
    }

    /** Placeholder for a deletion we heard about before ever seeing the series. */
    public static Series deletedStub(String id, long revision) {
        return new Series(id, null, null, revision, true);
    }
}
