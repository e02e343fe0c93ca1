package io.mediarealm.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class TxLogSnapshotSpec {

    @TempDir Path dir;

    record Note(String text) {
    }

    record Notes(List<String> texts) {
    }

    @Test
    void replay_skips_entries_covered_by_the_snapshot_lsn() {
        var log = new TxLog<>(new FileWal(dir.resolve("wal"), 1L << 60), Note.class);
        log.append(new Note("a"));
        long second = log.append(new Note("b"));
        log.append(new Note("c"));
        log.close();

        var reopened = new TxLog<>(new FileWal(dir.resolve("wal"), 1L << 60), Note.class);
        List<String> seen = new ArrayList<>();
        int applied = reopened.replay(second, n -> seen.add(n.text()));

        assertEquals(1, applied);
        assertEquals(List.of("c"), seen);
        assertEquals(3, reopened.lastLsn());
        assertEquals(4, reopened.append(new Note("d")));
        reopened.close();
    }

    @Test
    void lsn_continues_after_compaction_emptied_the_log() {
        var log = new TxLog<>(new FileWal(dir.resolve("wal"), 1L << 60), Note.class);
        log.append(new Note("a"));
        log.append(new Note("b"));
        log.compact();
        log.close();

        var reopened = new TxLog<>(new FileWal(dir.resolve("wal"), 1L << 60), Note.class);
        assertEquals(0, reopened.replay(2, n -> fail("nothing left to replay")));
        assertEquals(3, reopened.append(new Note("c")));
        reopened.close();
    }

    @Test
    void snapshotter_keeps_latest_two_and_loads_newest() throws Exception {
        var snaps = new FileSnapshotter<>(dir.resolve("snaps"), Notes.class);
        snaps.writeSnapshot(1, new Notes(List.of("a")));
        snaps.writeSnapshot(5, new Notes(List.of("a", "b")));
        snaps.writeSnapshot(9, new Notes(List.of("a", "b", "c")));

        try (Stream<Path> files = Files.list(dir.resolve("snaps"))) {
            assertEquals(2, files.count());
        }
        var loaded = snaps.loadLatest();
        assertEquals(9, loaded.lsn());
        assertEquals(List.of("a", "b", "c"), loaded.state().texts());
    }

    @Test
    void unreadable_newest_snapshot_falls_back_to_previous() throws Exception {
        var snaps = new FileSnapshotter<>(dir.resolve("snaps"), Notes.class);
        snaps.writeSnapshot(1, new Notes(List.of("a")));
        String newest = snaps.writeSnapshot(2, new Notes(List.of("a", "b")));
        Files.writeString(dir.resolve("snaps").resolve(newest), "{not json");

        var loaded = snaps.loadLatest();
        assertEquals(1, loaded.lsn());
    }

    @Test
    void no_snapshot_yet_loads_null() {
        assertNull(new FileSnapshotter<>(dir.resolve("snaps"), Notes.class).loadLatest());
    }
}
