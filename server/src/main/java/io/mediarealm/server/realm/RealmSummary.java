package io.mediarealm.server.realm;

import io.mediarealm.core.realm.Realm;

/** Compact realm reference used for navigation (children, breadcrumbs). */
public record RealmSummary(long id, String name, String path, boolean userRealm) {

    public static RealmSummary of(Realm realm) {
        return new RealmSummary(realm.id(), realm.name(), realm.fullPath(), realm.isUserRealm());
    }
}
