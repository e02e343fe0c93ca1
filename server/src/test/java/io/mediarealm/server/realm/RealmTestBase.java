package io.mediarealm.server.realm;

import io.mediarealm.core.access.AccessControl;
import io.mediarealm.core.access.AccessPolicy;
import io.mediarealm.core.access.User;
import io.mediarealm.storage.mirror.DurableMirrorStore;
import io.mediarealm.storage.realm.DurableRealmStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

/** Real durable stores in a temp dir, wired like Main does. */
abstract class RealmTestBase {

    static final User MODERATOR = User.of("mod", AccessPolicy.DEFAULT_MODERATOR_ROLE);
    static final User ADMIN = User.of("root", AccessPolicy.DEFAULT_ADMIN_ROLE);

    @TempDir Path dir;
    DurableRealmStore store;
    DurableMirrorStore mirror;
    RealmMutations mutations;
    RealmQueries queries;

    @BeforeEach
    void openStores() {
        store = DurableRealmStore.open(dir.resolve("realms"), 1L << 20, 1000);
        mirror = DurableMirrorStore.open(dir.resolve("mirror"), 1L << 20, 1000);
        wire();
    }

    @AfterEach
    void closeStores() {
        store.close();
        mirror.close();
    }

    void reopenRealms() {
        store.close();
        store = DurableRealmStore.open(dir.resolve("realms"), 1L << 20, 1000);
        wire();
    }

    private void wire() {
        var access = new AccessControl(AccessPolicy.defaults());
        mutations = new RealmMutations(store, mirror, access, new PathLocks(Duration.ofSeconds(2)));
        queries = new RealmQueries(store, mirror, access);
    }
}
