package io.mediarealm.server.search;

import io.mediarealm.core.mirror.EntityKind;
import io.mediarealm.core.mirror.EntityRef;
import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.mirror.Series;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Denormalized search document for an event or a series.
 * <p>
 * {@code id} is the document id in the index ("event_&lt;id&gt;" / "series_&lt;id&gt;"),
 * {@code entityId} the mirrored entity's own id. Series documents carry no
 * read roles: series are public.
 */
public record SearchDocument(
        String id,
        String entityId,
        String kind,
        String title,
        String description,
        String creator,
        String seriesId,
        String seriesTitle,
        Long duration,
        String thumbnail,
        Long created,
        long updated,
        List<String> readRoles
) {
    public SearchDocument {
        readRoles = readRoles == null ? List.of() : List.copyOf(readRoles);
    }

    public static String documentId(EntityRef ref) {
        return documentId(ref.kind(), ref.id());
    }

    public static String documentId(EntityKind kind, String entityId) {
        return (kind == EntityKind.EVENT ? "event_" : "series_") + entityId;
    }

    /** @param series owning series, or null for standalone events or unknown series */
    public static SearchDocument of(Event event, Series series) {
        Set<String> roles = new TreeSet<>(event.acl().readRoles());
        return new SearchDocument(
                documentId(EntityKind.EVENT, event.id()),
                event.id(),
                "event",
                event.title(),
                event.description(),
                event.creator(),
                event.seriesId(),
                series == null || series.tombstone() ? null : series.title(),
                event.duration(),
                event.thumbnail(),
                event.created(),
                event.updated(),
                List.copyOf(roles));
    }

    public static SearchDocument of(Series series) {
        return new SearchDocument(
                documentId(EntityKind.SERIES, series.id()),
                series.id(),
                "series",
                series.title(),
                series.description(),
                null,
                null,
                null,
                null,
                null,
                null,
                series.updated(),
                List.of());
    }

    public EntityRef ref() {
        return new EntityRef("event".equals(kind) ? EntityKind.EVENT : EntityKind.SERIES, entityId);
    }
}
