package io.mediarealm.storage.mirror;

import io.mediarealm.core.mirror.Acl;
import io.mediarealm.core.mirror.ChangeRecord;
import io.mediarealm.core.mirror.EntityKind;
import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.mirror.Series;

import java.util.List;
import java.util.Set;

final class MirrorFixtures {
    private MirrorFixtures() {
    }

    static ChangeRecord series(String id, String title, long rev) {
        return new ChangeRecord.Upsert(new Series(id, title, null, rev, false));
    }

    static ChangeRecord event(String id, String seriesId, String title, long rev) {
        return new ChangeRecord.Upsert(new Event(id, seriesId, title, null, "creator", 60_000L, null,
                100L, rev, List.of(), new Acl(Set.of("ROLE_ANONYMOUS"), Set.of()), false));
    }

    static ChangeRecord deleteEvent(String id, long rev) {
        return new ChangeRecord.Delete(EntityKind.EVENT, id, rev);
    }
}
