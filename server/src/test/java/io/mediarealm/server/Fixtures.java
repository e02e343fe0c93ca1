package io.mediarealm.server;

import io.mediarealm.core.mirror.Acl;
import io.mediarealm.core.mirror.ChangeRecord;
import io.mediarealm.core.mirror.EntityKind;
import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.mirror.Series;

import java.util.List;
import java.util.Set;

/** Harvest records for server tests. */
public final class Fixtures {
    private Fixtures() {
    }

    public static ChangeRecord series(String id, String title, long rev) {
        return new ChangeRecord.Upsert(new Series(id, title, null, rev, false));
    }

    /** Event readable by the given roles, writable by nobody but admins. */
    public static ChangeRecord event(String id, String seriesId, String title, long rev, long created, String... readRoles) {
        return new ChangeRecord.Upsert(new Event(id, seriesId, title, null, "Jane Doe", 60_000L, null,
                created, rev, List.of(), new Acl(Set.of(readRoles), Set.of()), false));
    }

    public static ChangeRecord publicEvent(String id, String seriesId, String title, long rev, long created) {
        return event(id, seriesId, title, rev, created, "ROLE_ANONYMOUS");
    }

    public static ChangeRecord deleteEvent(String id, long rev) {
        return new ChangeRecord.Delete(EntityKind.EVENT, id, rev);
    }

    public static ChangeRecord deleteSeries(String id, long rev) {
        return new ChangeRecord.Delete(EntityKind.SERIES, id, rev);
    }
}
