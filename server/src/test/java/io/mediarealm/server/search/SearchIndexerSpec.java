package io.mediarealm.server.search;

import io.mediarealm.server.sync.Backoff;
import io.mediarealm.server.sync.Sleeper;
import io.mediarealm.storage.mirror.DurableMirrorStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.List;

import static io.mediarealm.server.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SearchIndexerSpec {

    @TempDir Path dir;
    private DurableMirrorStore mirror;
    private InMemorySearchBackend backend;

    @BeforeEach
    void open() {
        mirror = DurableMirrorStore.open(dir, 1L << 20, 1000);
        backend = new InMemorySearchBackend();
    }

    @AfterEach
    void close() {
        mirror.close();
    }

    private SearchIndexer indexer(SearchBackend b) {
        return new SearchIndexer(mirror, b, new Backoff(Duration.ofMillis(1), Duration.ofMillis(5)),
                Sleeper.monitor(), Duration.ofMillis(20));
    }

    @Test
    void drain_writes_documents_and_empties_the_queue() {
        mirror.applyBatch(List.of(series("S1", "Algebra", 1),
                publicEvent("E1", "S1", "Groups", 1, 10), publicEvent("E2", null, "Rings", 1, 20)));

        int n = indexer(backend).drainQueue();

        assertEquals(3, n);
        assertEquals(3, backend.size());
        assertTrue(mirror.pendingIndexQueue().isEmpty());
        SearchDocument e1 = backend.search("groups", 10).get(0);
        assertEquals("event_E1", e1.id());
        assertEquals("Algebra", e1.seriesTitle());
        assertEquals(List.of("ROLE_ANONYMOUS"), e1.readRoles());
    }

    @Test
    void tombstone_deletes_the_document() {
        var idx = indexer(backend);
        mirror.applyBatch(List.of(publicEvent("E1", null, "Groups", 1, 10)));
        idx.drainQueue();

        mirror.applyBatch(List.of(deleteEvent("E1", 2)));
        idx.drainQueue();

        assertEquals(0, backend.size());
        assertTrue(mirror.pendingIndexQueue().isEmpty());
    }

    @Test
    void renamed_series_reindexes_its_events() {
        var idx = indexer(backend);
        mirror.applyBatch(List.of(series("S1", "Old name", 1), publicEvent("E1", "S1", "Groups", 1, 10)));
        idx.drainQueue();

        mirror.applyBatch(List.of(series("S1", "Fresh name", 2)));
        idx.drainQueue();

        var hits = backend.search("fresh", 10);
        assertEquals(2, hits.size());
        assertTrue(backend.search("old", 10).isEmpty());
    }

    @Test
    void backend_outage_keeps_entries_queued() {
        var flaky = new FlakyBackend(backend, 1);
        var idx = indexer(flaky);
        mirror.applyBatch(List.of(publicEvent("E1", null, "Groups", 1, 10)));

        assertThrows(IndexingException.class, idx::drainQueue);
        assertEquals(1, mirror.pendingIndexQueue().size());

        assertEquals(1, idx.drainQueue());
        assertEquals(1, backend.size());
        assertTrue(mirror.pendingIndexQueue().isEmpty());
    }

    @Test
    void queue_survives_a_restart() {
        mirror.applyBatch(List.of(publicEvent("E1", null, "Groups", 1, 10)));
        mirror.close();
        mirror = DurableMirrorStore.open(dir, 1L << 20, 1000);

        assertEquals(1, mirror.pendingIndexQueue().size());
        indexer(backend).drainQueue();
        assertEquals(1, backend.size());
    }

    @Test
    void rebuild_replaces_the_index_with_live_entities() {
        backend.upsert(List.of(new SearchDocument("event_ghost", "ghost", "event", "Ghost", null, null,
                null, null, null, null, 0L, 1, List.of())));
        mirror.applyBatch(List.of(series("S1", "Algebra", 1), publicEvent("E1", "S1", "Groups", 1, 10),
                publicEvent("E2", null, "Gone", 1, 10), deleteEvent("E2", 2)));

        int written = indexer(backend).rebuild();

        assertEquals(2, written);
        assertEquals(2, backend.size());
        assertTrue(backend.search("ghost", 10).isEmpty());
        assertTrue(mirror.pendingIndexQueue().isEmpty());
    }

    @Test
    void store_commit_during_drain_stays_queued() {
        mirror.applyBatch(List.of(publicEvent("E1", null, "Groups", 1, 10)));
        var racing = new CommittingBackend(backend,
                () -> mirror.applyBatch(List.of(publicEvent("E1", null, "Renamed", 2, 10))));
        var idx = indexer(racing);

        idx.drainQueue();

        assertEquals(1, mirror.pendingIndexQueue().size(), "the newer revision is still queued");
        assertEquals(1, backend.search("groups", 10).size());

        assertEquals(1, idx.drainQueue());
        assertEquals(1, backend.search("renamed", 10).size());
        assertTrue(backend.search("groups", 10).isEmpty());
        assertTrue(mirror.pendingIndexQueue().isEmpty());
    }

    @Test
    void store_commit_during_rebuild_stays_queued() {
        mirror.applyBatch(List.of(publicEvent("E1", null, "Groups", 1, 10)));
        var racing = new CommittingBackend(backend,
                () -> mirror.applyBatch(List.of(publicEvent("E1", null, "Renamed", 2, 10))));
        var idx = indexer(racing);

        idx.rebuild();

        assertEquals(1, mirror.pendingIndexQueue().size());
        idx.drainQueue();
        assertEquals(1, backend.search("renamed", 10).size());
        assertTrue(mirror.pendingIndexQueue().isEmpty());
    }

    @Test
    void worker_indexes_in_the_background() throws Exception {
        var idx = indexer(backend);
        idx.start();
        try {
            mirror.applyBatch(List.of(publicEvent("E1", null, "Groups", 1, 10)));
            idx.handOff(List.of());
            long deadline = System.currentTimeMillis() + 5_000;
            while (backend.size() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(1, backend.size());
        } finally {
            idx.stop(Duration.ofSeconds(5));
        }
    }

    /** Runs {@code commit} once, after the first upsert reached the delegate. */
    static final class CommittingBackend implements SearchBackend {
        private final SearchBackend delegate;
        private Runnable commit;

        CommittingBackend(SearchBackend delegate, Runnable commit) {
            this.delegate = delegate;
            this.commit = commit;
        }

        @Override
        public void upsert(Collection<SearchDocument> docs) {
            delegate.upsert(docs);
            if (commit != null && !docs.isEmpty()) {
                Runnable c = commit;
                commit = null;
                c.run();
            }
        }

        @Override
        public void delete(Collection<String> documentIds) {
            delegate.delete(documentIds);
        }

        @Override
        public void clear() {
            delegate.clear();
        }

        @Override
        public List<SearchDocument> search(String query, int limit) {
            return delegate.search(query, limit);
        }
    }

    /** Throws on the first {@code failures} upserts, then delegates. */
    static final class FlakyBackend implements SearchBackend {
        private final SearchBackend delegate;
        private int failures;

        FlakyBackend(SearchBackend delegate, int failures) {
            this.delegate = delegate;
            this.failures = failures;
        }

        @Override
        public void upsert(Collection<SearchDocument> docs) {
            if (failures-- > 0) {
                throw new IndexingException("backend unavailable");
            }
            delegate.upsert(docs);
        }

        @Override
        public void delete(Collection<String> documentIds) {
            delegate.delete(documentIds);
        }

        @Override
        public void clear() {
            delegate.clear();
        }

        @Override
        public List<SearchDocument> search(String query, int limit) {
            return delegate.search(query, limit);
        }
    }
}
