package io.mediarealm.storage.realm;

import io.mediarealm.core.realm.Block;
import io.mediarealm.core.realm.Realm;

import java.util.List;

/** Snapshot form of the realm tree store. */
public record RealmState(List<Realm> realms, List<Block> blocks, long nextRealmId, long nextBlockId) {

    public RealmState {
        realms = realms == null ? List.of() : realms;
        blocks = blocks == null ? List.of() : blocks;
    }
}
