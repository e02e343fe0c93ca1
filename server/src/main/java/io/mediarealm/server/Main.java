package io.mediarealm.server;

import io.mediarealm.core.access.AccessControl;
import io.mediarealm.server.harvest.HarvestSource;
import io.mediarealm.server.harvest.HttpHarvestClient;
import io.mediarealm.server.realm.PathLocks;
import io.mediarealm.server.realm.RealmMutations;
import io.mediarealm.server.realm.RealmQueries;
import io.mediarealm.server.search.HttpSearchBackend;
import io.mediarealm.server.search.InMemorySearchBackend;
import io.mediarealm.server.search.SearchBackend;
import io.mediarealm.server.search.SearchIndexer;
import io.mediarealm.server.search.SearchQueries;
import io.mediarealm.server.sync.Backoff;
import io.mediarealm.server.sync.Sleeper;
import io.mediarealm.server.sync.SyncDaemon;
import io.mediarealm.server.sync.SyncStatus;
import io.mediarealm.storage.cursor.FileCursorStore;
import io.mediarealm.storage.mirror.DurableMirrorStore;
import io.mediarealm.storage.realm.DurableRealmStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point of a media-realm node.
 *
 * Responsibilities:
 *  - Parse CLI flags and the optional JSON runtime config.
 *  - Recover the durable stores (mirror, realm tree, cursors) from the data dir.
 *  - Wire search backend + indexer, the sync daemon and the realm services.
 *  - Start the HTTP façade, or with --sync-once drain the source and exit.
 */
public final class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        installLogging();
        var cfg = ServerConfig.fromArgs(args);
        RuntimeConfig runtime = cfg.configPath() == null
                ? RuntimeConfig.defaults()
                : RuntimeConfig.fromJsonFile(Path.of(cfg.configPath()));

        // ------ Storage layer (recovery failures abort startup) -------
        Path data = Path.of(cfg.dataDir());
        var storage = runtime.storage();
        var mirror = DurableMirrorStore.open(data.resolve("mirror"), storage.walRotateBytes(), storage.snapshotEveryTx());
        var realmStore = DurableRealmStore.open(data.resolve("realms"), storage.walRotateBytes(), storage.snapshotEveryTx());
        var cursors = new FileCursorStore(data.resolve("cursors"));

        var access = new AccessControl(runtime.access());

        // ------ Search -------
        SearchBackend backend = buildSearchBackend(runtime);
        var sync = runtime.sync();
        var indexer = new SearchIndexer(mirror, backend,
                new Backoff(sync.initialBackoff(), sync.maxBackoff()), Sleeper.monitor(), Duration.ofSeconds(30));

        // ------ Harvest / sync -------
        SyncDaemon daemon = null;
        HarvestSource source = runtime.harvest();
        if (source != null) {
            daemon = new SyncDaemon(source.name(), new HttpHarvestClient(source), mirror, cursors, indexer,
                    sync, new Backoff(sync.initialBackoff(), sync.maxBackoff()), Sleeper.monitor(), Clock.systemUTC());
        }

        if (cfg.syncOnce()) {
            runOnce(daemon, indexer, mirror, realmStore);
            return;
        }

        // ------ Realm services + HTTP -------
        var queries = new RealmQueries(realmStore, mirror, access);
        var mutations = new RealmMutations(realmStore, mirror, access, new PathLocks(Duration.ofSeconds(5)));
        var web = new WebServer(cfg.httpPort(), queries, mutations,
                new SearchQueries(backend, mirror, access), indexer, daemon, access);

        indexer.start();
        if (daemon != null) {
            daemon.start();
        } else {
            LOG.info("no harvest source configured; sync disabled");
        }
        web.start();
        LOG.info("media-realm listening on http://localhost:" + cfg.httpPort() + " (data: " + data.toAbsolutePath() + ")");

        final SyncDaemon runningDaemon = daemon;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
                if (runningDaemon != null) {
                    runningDaemon.stop(STOP_TIMEOUT);
                }
                indexer.stop(STOP_TIMEOUT);
                mirror.close();
                realmStore.close();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "error during shutdown", e);
            }
        }, "shutdown"));
    }

    private static void runOnce(SyncDaemon daemon, SearchIndexer indexer,
                                DurableMirrorStore mirror, DurableRealmStore realmStore) {
        if (daemon == null) {
            System.err.println("--sync-once needs a harvest source in the runtime config");
            System.exit(1);
        }
        int exitCode;
        try {
            SyncStatus status = daemon.runUntilDrained();
            int indexed = indexer.drainQueue();
            LOG.info("sync run finished: state=" + status.state() + " cursor=" + status.cursor()
                    + " indexed=" + indexed);
            exitCode = status.halted() ? 2 : 0;
        } finally {
            mirror.close();
            realmStore.close();
        }
        System.exit(exitCode);
    }

    private static SearchBackend buildSearchBackend(RuntimeConfig runtime) {
        var search = runtime.search();
        if (search == null) {
            LOG.info("no search URL configured; using in-memory search index");
            return new InMemorySearchBackend();
        }
        return new HttpSearchBackend(search.url(), search.indexName(), search.apiKey(), search.timeout());
    }

    private static void installLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("could not load logging.properties: " + e.getMessage());
        }
    }
}
