package io.mediarealm.server.sync;

import io.mediarealm.server.harvest.HarvestBatch;

import java.util.List;

/**
 * The sync loop as a pure function (context, event) -> (context, effects).
 * <p>
 * Cycle: IDLE -> FETCHING -> APPLYING -> INDEXING -> IDLE, or straight back to
 * FETCHING when the source reported more changes. Transient failures in any
 * step go to BACKOFF and retry from the unchanged cursor; protocol failures go
 * to HALTED. The cursor only moves on CursorPersisted, i.e. after the batch
 * was applied and handed to the indexer.
 * <p>
 * An event that makes no sense in the current state is a programming error
 * and throws {@link IllegalStateException}.
 */
public final class SyncTransitions {

    private SyncTransitions() {
    }

    public record Step(SyncContext context, List<SyncEffect> effects) {
        public Step {
            effects = List.copyOf(effects);
        }
    }

    public static Step next(SyncContext ctx, SyncEvent event) {
        // Operator commands are accepted in every resting state.
        if (event instanceof SyncEvent.ResetCursor) {
            requireResting(ctx, event);
            SyncContext cleared = ctx.withCursor(null).withInFlight(null);
            if (ctx.state() == SyncState.HALTED) {
                return new Step(cleared, List.of(new SyncEffect.ClearCursor(), new SyncEffect.AwaitOperator()));
            }
            return new Step(cleared.to(SyncState.FETCHING).withFailures(0),
                    List.of(new SyncEffect.ClearCursor(), new SyncEffect.Fetch(null)));
        }
        if (event instanceof SyncEvent.Resume) {
            requireResting(ctx, event);
            if (ctx.state() != SyncState.HALTED) {
                return stay(ctx); // nothing to resume
            }
            return new Step(ctx.to(SyncState.FETCHING).withFailures(0).withHaltReason(null),
                    List.of(new SyncEffect.Fetch(ctx.cursor())));
        }

        switch (ctx.state()) {
            case IDLE -> {
                if (event instanceof SyncEvent.PollDue) {
                    return fetch(ctx);
                }
            }
            case FETCHING -> {
                if (event instanceof SyncEvent.Fetched fetched) {
                    HarvestBatch batch = fetched.batch();
                    return new Step(ctx.to(SyncState.APPLYING).withInFlight(batch),
                            List.of(new SyncEffect.Apply(batch)));
                }
                if (event instanceof SyncEvent.TransientFailure) {
                    return backoff(ctx);
                }
                if (event instanceof SyncEvent.ProtocolFailure failure) {
                    return halt(ctx, failure.reason());
                }
            }
            case APPLYING -> {
                if (event instanceof SyncEvent.Applied applied) {
                    return new Step(ctx.to(SyncState.INDEXING),
                            List.of(new SyncEffect.HandOff(applied.changes())));
                }
                if (event instanceof SyncEvent.TransientFailure) {
                    return backoff(ctx);
                }
            }
            case INDEXING -> {
                if (event instanceof SyncEvent.HandedOff) {
                    String next = ctx.inFlight().nextCursor();
                    if (next == null) {
                        return afterCommit(ctx); // source gave no cursor; keep the old one
                    }
                    return new Step(ctx, List.of(new SyncEffect.PersistCursor(next)));
                }
                if (event instanceof SyncEvent.CursorPersisted) {
                    return afterCommit(ctx.withCursor(ctx.inFlight().nextCursor()));
                }
                if (event instanceof SyncEvent.TransientFailure) {
                    return backoff(ctx);
                }
            }
            case BACKOFF -> {
                if (event instanceof SyncEvent.RetryDue) {
                    return fetch(ctx);
                }
            }
            case HALTED -> {
                // only operator commands, handled above
            }
        }
        throw new IllegalStateException("unexpected " + event + " in state " + ctx.state());
    }

    private static Step fetch(SyncContext ctx) {
        return new Step(ctx.to(SyncState.FETCHING).withInFlight(null),
                List.of(new SyncEffect.Fetch(ctx.cursor())));
    }

    private static Step afterCommit(SyncContext ctx) {
        boolean hasMore = ctx.inFlight().hasMore();
        SyncContext done = ctx.withInFlight(null).withFailures(0);
        if (hasMore) {
            return new Step(done.to(SyncState.FETCHING), List.of(new SyncEffect.Fetch(done.cursor())));
        }
        return new Step(done.to(SyncState.IDLE), List.of(new SyncEffect.WaitForPoll()));
    }

    private static Step backoff(SyncContext ctx) {
        int attempt = ctx.failures() + 1;
        return new Step(ctx.to(SyncState.BACKOFF).withInFlight(null).withFailures(attempt),
                List.of(new SyncEffect.WaitBackoff(attempt)));
    }

    private static Step halt(SyncContext ctx, String reason) {
        return new Step(ctx.to(SyncState.HALTED).withInFlight(null).withHaltReason(reason),
                List.of(new SyncEffect.Alert(reason), new SyncEffect.AwaitOperator()));
    }

    private static Step stay(SyncContext ctx) {
        SyncEffect wait = switch (ctx.state()) {
            case IDLE -> new SyncEffect.WaitForPoll();
            case BACKOFF -> new SyncEffect.WaitBackoff(ctx.failures());
            default -> new SyncEffect.AwaitOperator();
        };
        return new Step(ctx, List.of(wait));
    }

    private static void requireResting(SyncContext ctx, SyncEvent event) {
        SyncState s = ctx.state();
        if (s != SyncState.IDLE && s != SyncState.BACKOFF && s != SyncState.HALTED) {
            throw new IllegalStateException(event + " is only accepted while waiting, not in " + s);
        }
    }
}
