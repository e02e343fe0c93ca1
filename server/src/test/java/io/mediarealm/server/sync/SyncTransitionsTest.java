package io.mediarealm.server.sync;

import io.mediarealm.core.mirror.ChangeEvent;
import io.mediarealm.core.mirror.EntityKind;
import io.mediarealm.server.harvest.HarvestBatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncTransitionsTest {

    private static final HarvestBatch LAST = new HarvestBatch(List.of(), "200", false);
    private static final HarvestBatch MORE = new HarvestBatch(List.of(), "150", true);
    private static final List<ChangeEvent> CHANGES =
            List.of(new ChangeEvent(EntityKind.EVENT, "E1", ChangeEvent.Type.UPSERTED, 5));

    private static SyncTransitions.Step step(SyncContext ctx, SyncEvent e) {
        return SyncTransitions.next(ctx, e);
    }

    @Test
    void full_cycle_moves_cursor_only_after_persist() {
        var ctx = SyncContext.initial("100");

        var s1 = step(ctx, new SyncEvent.PollDue());
        assertEquals(SyncState.FETCHING, s1.context().state());
        assertEquals(List.of(new SyncEffect.Fetch("100")), s1.effects());

        var s2 = step(s1.context(), new SyncEvent.Fetched(LAST));
        assertEquals(SyncState.APPLYING, s2.context().state());
        assertEquals("100", s2.context().cursor());

        var s3 = step(s2.context(), new SyncEvent.Applied(CHANGES));
        assertEquals(SyncState.INDEXING, s3.context().state());
        assertEquals(List.of(new SyncEffect.HandOff(CHANGES)), s3.effects());
        assertEquals("100", s3.context().cursor());

        var s4 = step(s3.context(), new SyncEvent.HandedOff());
        assertEquals(List.of(new SyncEffect.PersistCursor("200")), s4.effects());
        assertEquals("100", s4.context().cursor(), "cursor moves only once persisted");

        var s5 = step(s4.context(), new SyncEvent.CursorPersisted());
        assertEquals(SyncState.IDLE, s5.context().state());
        assertEquals("200", s5.context().cursor());
        assertNull(s5.context().inFlight());
        assertEquals(List.of(new SyncEffect.WaitForPoll()), s5.effects());
    }

    @Test
    void has_more_fetches_again_without_waiting() {
        var ctx = new SyncContext(SyncState.INDEXING, "100", MORE, 0, null);
        var s = step(ctx, new SyncEvent.CursorPersisted());
        assertEquals(SyncState.FETCHING, s.context().state());
        assertEquals(List.of(new SyncEffect.Fetch("150")), s.effects());
    }

    @Test
    void transient_failure_backs_off_and_retries_same_cursor() {
        var fetching = new SyncContext(SyncState.FETCHING, "100", null, 0, null);
        var s1 = step(fetching, new SyncEvent.TransientFailure("timeout"));
        assertEquals(SyncState.BACKOFF, s1.context().state());
        assertEquals(List.of(new SyncEffect.WaitBackoff(1)), s1.effects());

        var s2 = step(s1.context(), new SyncEvent.RetryDue());
        assertEquals(List.of(new SyncEffect.Fetch("100")), s2.effects());

        var s3 = step(s2.context(), new SyncEvent.TransientFailure("timeout"));
        assertEquals(List.of(new SyncEffect.WaitBackoff(2)), s3.effects());
        assertEquals("100", s3.context().cursor());
    }

    @Test
    void apply_failure_drops_in_flight_batch() {
        var applying = new SyncContext(SyncState.APPLYING, "100", LAST, 0, null);
        var s = step(applying, new SyncEvent.TransientFailure("disk full"));
        assertEquals(SyncState.BACKOFF, s.context().state());
        assertNull(s.context().inFlight());
        assertEquals("100", s.context().cursor());
    }

    @Test
    void success_resets_failure_counter() {
        var ctx = new SyncContext(SyncState.INDEXING, "100", LAST, 3, null);
        var s = step(ctx, new SyncEvent.CursorPersisted());
        assertEquals(0, s.context().failures());
    }

    @Test
    void protocol_failure_halts_until_resume() {
        var fetching = new SyncContext(SyncState.FETCHING, "100", null, 2, null);
        var halted = step(fetching, new SyncEvent.ProtocolFailure("HTTP 401"));
        assertEquals(SyncState.HALTED, halted.context().state());
        assertEquals("HTTP 401", halted.context().haltReason());
        assertEquals(List.of(new SyncEffect.Alert("HTTP 401"), new SyncEffect.AwaitOperator()), halted.effects());

        assertThrows(IllegalStateException.class, () -> step(halted.context(), new SyncEvent.PollDue()));
        assertThrows(IllegalStateException.class, () -> step(halted.context(), new SyncEvent.RetryDue()));

        var resumed = step(halted.context(), new SyncEvent.Resume());
        assertEquals(SyncState.FETCHING, resumed.context().state());
        assertNull(resumed.context().haltReason());
        assertEquals(0, resumed.context().failures());
        assertEquals(List.of(new SyncEffect.Fetch("100")), resumed.effects());
    }

    @Test
    void reset_cursor_while_idle_fetches_from_the_beginning() {
        var s = step(SyncContext.initial("100"), new SyncEvent.ResetCursor());
        assertNull(s.context().cursor());
        assertEquals(SyncState.FETCHING, s.context().state());
        assertEquals(List.of(new SyncEffect.ClearCursor(), new SyncEffect.Fetch(null)), s.effects());
    }

    @Test
    void reset_cursor_while_halted_stays_halted() {
        var halted = new SyncContext(SyncState.HALTED, "100", null, 0, "bad payload");
        var s = step(halted, new SyncEvent.ResetCursor());
        assertEquals(SyncState.HALTED, s.context().state());
        assertNull(s.context().cursor());
    }

    @Test
    void operator_commands_are_rejected_mid_cycle() {
        var applying = new SyncContext(SyncState.APPLYING, "100", LAST, 0, null);
        assertThrows(IllegalStateException.class, () -> step(applying, new SyncEvent.ResetCursor()));
        assertThrows(IllegalStateException.class, () -> step(applying, new SyncEvent.Resume()));
    }

    @Test
    void resume_when_not_halted_keeps_waiting() {
        var s = step(SyncContext.initial("100"), new SyncEvent.Resume());
        assertEquals(SyncState.IDLE, s.context().state());
        assertEquals(List.of(new SyncEffect.WaitForPoll()), s.effects());
    }

    @Test
    void unexpected_events_are_programming_errors() {
        assertThrows(IllegalStateException.class,
                () -> step(SyncContext.initial(null), new SyncEvent.Fetched(LAST)));
        assertThrows(IllegalStateException.class,
                () -> step(new SyncContext(SyncState.FETCHING, null, null, 0, null), new SyncEvent.Applied(List.of())));
    }
}
