package io.mediarealm.server.sync;

import io.mediarealm.core.mirror.ChangeEvent;
import io.mediarealm.server.harvest.HarvestBatch;
import io.mediarealm.server.harvest.HarvestClient;
import io.mediarealm.server.harvest.ProtocolException;
import io.mediarealm.server.harvest.TransientHarvestException;
import io.mediarealm.storage.cursor.CursorStore;
import io.mediarealm.storage.mirror.MirrorStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives harvest -> mirror store -> indexer hand-off for one source.
 * <p>
 * Decisions are made by {@link SyncTransitions}; this class only executes the
 * resulting effects against the real collaborators and turns their outcomes
 * into events.
 * <p>
 * Threading:
 *  - One dedicated worker thread per daemon; steps are strictly sequential.
 *  - {@link #resume()} and {@link #resetCursor()} may be called from any
 *    thread; they are queued and picked up while the loop is waiting.
 *  - {@link #stop(Duration)} lets the running step finish (an apply in
 *    progress is never abandoned) and exits before the next fetch or wait.
 */
public final class SyncDaemon {
    private static final Logger LOG = Logger.getLogger(SyncDaemon.class.getName());
    /** Consecutive transient failures after which a drain run gives up. */
    static final int MAX_DRAIN_FAILURES = 5;

    private final String source;
    private final HarvestClient harvest;
    private final MirrorStore mirror;
    private final CursorStore cursors;
    private final ChangeSink sink;
    private final SyncSettings settings;
    private final Backoff backoff;
    private final Sleeper sleeper;
    private final Clock clock;

    private final Queue<SyncEvent> commands = new ConcurrentLinkedQueue<>();
    private final ExecutorService worker;
    private volatile boolean stopping = false;
    private volatile SyncContext context;
    private volatile Instant lastSuccess;

    public SyncDaemon(
            String source,
            HarvestClient harvest,
            MirrorStore mirror,
            CursorStore cursors,
            ChangeSink sink,
            SyncSettings settings,
            Backoff backoff,
            Sleeper sleeper,
            Clock clock
    ) {
        this.source = Objects.requireNonNull(source, "source");
        this.harvest = harvest;
        this.mirror = mirror;
        this.cursors = cursors;
        this.sink = sink;
        this.settings = settings;
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.clock = clock;
        this.context = SyncContext.initial(cursors.load(source).orElse(null));
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sync-daemon-" + source);
            t.setDaemon(true);
            return t;
        });
    }

    /** Start the indefinite loop on the worker thread. */
    public void start() {
        worker.submit(() -> {
            try {
                loop(false);
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, "sync loop of " + source + " died", e);
            }
        });
        LOG.info("sync daemon started for source " + source);
    }

    /**
     * Graceful stop: the current step completes, then the loop exits.
     *
     * @return true if the worker finished within {@code timeout}
     */
    public boolean stop(Duration timeout) {
        stopping = true;
        sleeper.wake();
        worker.shutdown();
        try {
            boolean done = worker.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!done) {
                LOG.warning("sync daemon of " + source + " did not stop within " + timeout);
            }
            return done;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Drain mode: run cycles in the calling thread until the source has no
     * more changes, the source halts, or {@value #MAX_DRAIN_FAILURES}
     * consecutive transient failures happened.
     */
    public SyncStatus runUntilDrained() {
        loop(true);
        return status();
    }

    public SyncStatus status() {
        SyncContext ctx = context;
        return new SyncStatus(source, ctx.state(), ctx.cursor(), lastSuccess, ctx.failures(),
                ctx.state() == SyncState.HALTED, ctx.haltReason());
    }

    /** Operator: continue after a protocol halt. */
    public void resume() {
        commands.add(new SyncEvent.Resume());
        sleeper.wake();
    }

    /** Operator: forget the cursor; the next cycle harvests from the beginning. */
    public void resetCursor() {
        commands.add(new SyncEvent.ResetCursor());
        sleeper.wake();
    }

    // ---------- loop ----------

    private void loop(boolean drainOnly) {
        SyncState resting = context.state();
        if (resting != SyncState.IDLE && resting != SyncState.BACKOFF && resting != SyncState.HALTED) {
            // a previous loop was stopped mid-cycle; re-fetching from the cursor is safe
            context = SyncContext.initial(context.cursor()).withFailures(context.failures());
        }
        SyncEvent event = pendingCommand();
        if (event == null) {
            event = switch (context.state()) {
                case HALTED -> null;
                case BACKOFF -> new SyncEvent.RetryDue();
                default -> new SyncEvent.PollDue();
            };
        }
        if (event == null && drainOnly) {
            return; // halted and nobody resumed
        }
        if (event == null) {
            event = awaitOperator();
        }
        while (event != null) {
            SyncTransitions.Step step = SyncTransitions.next(context, event);
            SyncState before = context.state();
            context = step.context();
            if (before != context.state()) {
                LOG.fine(() -> "source " + source + ": " + before + " -> " + context.state());
            }
            event = null;
            for (SyncEffect effect : step.effects()) {
                SyncEvent produced = execute(effect, drainOnly);
                if (produced != null) {
                    event = produced;
                }
            }
        }
    }

    /** Run one effect; returns the event it produced, or null to end the loop. */
    private SyncEvent execute(SyncEffect effect, boolean drainOnly) {
        if (effect instanceof SyncEffect.Fetch fetch) {
            return stopping ? null : fetch(fetch.cursor());
        }
        if (effect instanceof SyncEffect.Apply apply) {
            return apply(apply.batch());
        }
        if (effect instanceof SyncEffect.HandOff handOff) {
            sink.handOff(handOff.changes());
            return new SyncEvent.HandedOff();
        }
        if (effect instanceof SyncEffect.PersistCursor persist) {
            return persist(persist.cursor());
        }
        if (effect instanceof SyncEffect.ClearCursor) {
            cursors.reset(source);
            LOG.info("cursor of source " + source + " reset; next cycle harvests everything");
            return null;
        }
        if (effect instanceof SyncEffect.WaitForPoll) {
            lastSuccess = clock.instant();
            if (drainOnly) {
                return null;
            }
            return waitThen(settings.pollInterval(), new SyncEvent.PollDue());
        }
        if (effect instanceof SyncEffect.WaitBackoff wait) {
            if (drainOnly && wait.attempt() >= MAX_DRAIN_FAILURES) {
                LOG.warning("giving up drain of " + source + " after " + wait.attempt() + " failures");
                return null;
            }
            Duration delay = backoff.delay(wait.attempt());
            LOG.info(String.format("source %s: retry %d in %d ms", source, wait.attempt(), delay.toMillis()));
            return waitThen(delay, new SyncEvent.RetryDue());
        }
        if (effect instanceof SyncEffect.Alert alert) {
            LOG.severe("sync of source " + source + " halted: " + alert.reason()
                    + " (operator action required: resume after fixing the source)");
            return null;
        }
        if (effect instanceof SyncEffect.AwaitOperator) {
            return drainOnly ? pendingCommand() : awaitOperator();
        }
        throw new IllegalStateException("unknown effect " + effect);
    }

    private SyncEvent fetch(String cursor) {
        try {
            HarvestBatch batch = harvest.fetch(cursor);
            LOG.fine(() -> "source " + source + ": fetched " + batch.records().size()
                    + " records after cursor " + cursor);
            return new SyncEvent.Fetched(batch);
        } catch (TransientHarvestException e) {
            LOG.log(Level.WARNING, "harvest of " + source + " failed transiently: " + e.getMessage());
            return new SyncEvent.TransientFailure(e.getMessage());
        } catch (ProtocolException e) {
            return new SyncEvent.ProtocolFailure(e.getMessage());
        } catch (RuntimeException e) {
            // A client bug or an unparseable answer; halting keeps the loop alive and resumable.
            LOG.log(Level.SEVERE, "harvest of " + source + " failed unexpectedly", e);
            return new SyncEvent.ProtocolFailure("unexpected harvest failure: " + e);
        }
    }

    private SyncEvent apply(HarvestBatch batch) {
        try {
            List<ChangeEvent> changes = mirror.applyBatch(batch.records());
            LOG.info(String.format("source %s: applied %d records, %d changed", source,
                    batch.records().size(), changes.size()));
            return new SyncEvent.Applied(changes);
        } catch (RuntimeException e) {
            // Nothing was committed (one transaction per batch); retry the same cursor.
            LOG.log(Level.WARNING, "applying batch of " + source + " failed", e);
            return new SyncEvent.TransientFailure("apply failed: " + e.getMessage());
        }
    }

    private SyncEvent persist(String cursor) {
        try {
            cursors.save(source, cursor);
            return new SyncEvent.CursorPersisted();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "persisting cursor of " + source + " failed", e);
            return new SyncEvent.TransientFailure("cursor write failed: " + e.getMessage());
        }
    }

    /** Sleep, but let stop and operator commands cut the wait short. */
    private SyncEvent waitThen(Duration delay, SyncEvent timerEvent) {
        SyncEvent command = pendingCommand();
        if (command != null) {
            return command;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
        if (stopping) {
            return null;
        }
        command = pendingCommand();
        return command != null ? command : timerEvent;
    }

    private SyncEvent awaitOperator() {
        while (!stopping) {
            SyncEvent command = pendingCommand();
            if (command != null) {
                return command;
            }
            try {
                sleeper.sleep(settings.pollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
        return null;
    }

    private SyncEvent pendingCommand() {
        return commands.poll();
    }
}
