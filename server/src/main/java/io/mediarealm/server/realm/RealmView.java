package io.mediarealm.server.realm;

import io.mediarealm.core.realm.Realm;

import java.util.List;

/** Everything needed to render one realm page for one caller. */
public record RealmView(
        Realm realm,
        List<RealmSummary> ancestors,
        List<RealmSummary> children,
        List<BlockView> blocks,
        int descendantCount,
        boolean canEdit
) {
}
