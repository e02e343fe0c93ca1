package io.mediarealm.core.mirror;

import java.util.Objects;

/** Kind + external id: enough to look a mirrored entity up again. */
public record EntityRef(EntityKind kind, String id) {

    public EntityRef {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
    }

    public static EntityRef of(MirroredEntity entity) {
        return new EntityRef(entity.kind(), entity.id());
    }

    public static EntityRef event(String id) {
        return new EntityRef(EntityKind.EVENT, id);
    }

    public static EntityRef series(String id) {
        return new EntityRef(EntityKind.SERIES, id);
    }
}
