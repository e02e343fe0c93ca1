package io.mediarealm.server.search;

import io.mediarealm.core.mirror.ChangeEvent;
import io.mediarealm.core.mirror.EntityRef;
import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.mirror.MirroredEntity;
import io.mediarealm.core.mirror.Series;
import io.mediarealm.server.sync.Backoff;
import io.mediarealm.server.sync.ChangeSink;
import io.mediarealm.server.sync.Sleeper;
import io.mediarealm.storage.mirror.IndexTicket;
import io.mediarealm.storage.mirror.MirrorStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps the search index in line with the mirror store.
 * <p>
 * Work comes from the store's durable index queue, not from the change
 * events themselves: {@link #handOff} only wakes the worker. An entry leaves
 * the queue after the backend accepted the corresponding write, so a crash
 * or a backend outage loses nothing; it only delays.
 * <p>
 * The worker retries with its own backoff, independent of the harvest
 * cursor. Indexing and rebuild are mutually exclusive.
 */
public final class SearchIndexer implements ChangeSink {
    private static final Logger LOG = Logger.getLogger(SearchIndexer.class.getName());
    static final int BATCH_SIZE = 200;

    private final MirrorStore mirror;
    private final SearchBackend backend;
    private final Backoff backoff;
    private final Sleeper sleeper;
    private final Duration idleRecheck;
    private final ExecutorService worker;
    private final Object indexLock = new Object();
    private volatile boolean stopping = false;
    private volatile int consecutiveFailures = 0;

    public SearchIndexer(MirrorStore mirror, SearchBackend backend, Backoff backoff, Sleeper sleeper, Duration idleRecheck) {
        this.mirror = mirror;
        this.backend = backend;
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.idleRecheck = idleRecheck;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "search-indexer");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        worker.submit(this::workLoop);
    }

    public void stop(Duration timeout) {
        stopping = true;
        sleeper.wake();
        worker.shutdown();
        try {
            worker.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void handOff(List<ChangeEvent> changes) {
        if (!changes.isEmpty()) {
            sleeper.wake();
        }
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * Write every queued entry to the backend, in batches.
     *
     * @return number of queue entries processed
     * @throws IndexingException if the backend failed; already written batches stay acknowledged
     */
    public int drainQueue() {
        synchronized (indexLock) {
            int done = 0;
            // Tickets are taken before the entities are read; anything queued
            // again meanwhile carries a newer ticket and survives the acknowledgement.
            List<IndexTicket> queue = mirror.pendingIndexTickets();
            for (int from = 0; from < queue.size(); from += BATCH_SIZE) {
                List<IndexTicket> chunk = queue.subList(from, Math.min(queue.size(), from + BATCH_SIZE));
                indexChunk(chunk);
                mirror.acknowledgeIndexed(chunk);
                done += chunk.size();
            }
            return done;
        }
    }

    /**
     * Drop the whole index and re-derive it from the live mirror-store
     * entities. Queue entries present when the rebuild started are
     * acknowledged afterwards; entries added or re-queued meanwhile stay queued.
     *
     * @return number of documents written
     */
    public int rebuild() {
        synchronized (indexLock) {
            List<IndexTicket> covered = mirror.pendingIndexTickets();
            backend.clear();
            List<SearchDocument> batch = new ArrayList<>(BATCH_SIZE);
            int written = 0;
            for (MirroredEntity entity : mirror.liveEntities()) {
                batch.add(toDocument(entity));
                if (batch.size() == BATCH_SIZE) {
                    backend.upsert(batch);
                    written += batch.size();
                    batch.clear();
                }
            }
            backend.upsert(batch);
            written += batch.size();
            mirror.acknowledgeIndexed(covered);
            LOG.info("search index rebuilt with " + written + " documents");
            return written;
        }
    }

    private void indexChunk(List<IndexTicket> chunk) {
        List<SearchDocument> upserts = new ArrayList<>();
        List<String> deletes = new ArrayList<>();
        for (IndexTicket ticket : chunk) {
            EntityRef ref = ticket.ref();
            Optional<MirroredEntity> entity = mirror.find(ref);
            if (entity.isEmpty() || entity.get().tombstone()) {
                deletes.add(SearchDocument.documentId(ref));
            } else {
                upserts.add(toDocument(entity.get()));
            }
        }
        backend.upsert(upserts);
        backend.delete(deletes);
    }

    private SearchDocument toDocument(MirroredEntity entity) {
        if (entity instanceof Event e) {
            Series series = e.seriesId() == null ? null : mirror.findSeries(e.seriesId()).orElse(null);
            return SearchDocument.of(e, series);
        }
        return SearchDocument.of((Series) entity);
    }

    private void workLoop() {
        while (!stopping) {
            try {
                int n = drainQueue();
                if (n > 0) {
                    LOG.fine(() -> "indexed " + n + " queue entries");
                }
                if (consecutiveFailures > 0) {
                    LOG.info("search backend recovered after " + consecutiveFailures + " failures");
                }
                consecutiveFailures = 0;
                if (mirror.pendingIndexQueue().isEmpty()) {
                    sleeper.sleep(idleRecheck);
                }
            } catch (IndexingException e) {
                consecutiveFailures++;
                Duration delay = backoff.delay(consecutiveFailures);
                LOG.log(Level.WARNING, "indexing failed (" + e.getMessage() + "), retry in " + delay.toMillis() + " ms");
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, "unexpected indexer failure", e);
                consecutiveFailures++;
                try {
                    sleeper.sleep(backoff.delay(consecutiveFailures));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
