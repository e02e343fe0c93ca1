package io.mediarealm.core.mirror;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * One item of a harvest batch: either a full new state of an entity or the
 * notice that it was removed at the source. Delivery is at-least-once, so
 * every record must be safe to apply repeatedly.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "op")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ChangeRecord.Upsert.class, name = "upsert"),
        @JsonSubTypes.Type(value = ChangeRecord.Delete.class, name = "delete")
})
public sealed interface ChangeRecord {

    EntityKind entityKind();

    String entityId();

    long revision();

    record Upsert(MirroredEntity entity) implements ChangeRecord {
        public Upsert {
            Objects.requireNonNull(entity, "entity");
        }

        @Override public EntityKind entityKind() { return entity.kind(); }
        @Override public String entityId() { return entity.id(); }
        @Override public long revision() { return entity.updated(); }
    }

    record Delete(EntityKind entityKind, String entityId, long revision) implements ChangeRecord {
        public Delete {
            Objects.requireNonNull(entityKind, "entityKind");
            Objects.requireNonNull(entityId, "entityId");
        }
    }
}
