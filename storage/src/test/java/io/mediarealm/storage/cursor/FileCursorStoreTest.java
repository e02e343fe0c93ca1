package io.mediarealm.storage.cursor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileCursorStoreTest {

    @TempDir Path dir;

    @Test
    void absent_cursor_means_from_the_beginning() {
        assertEquals(Optional.empty(), new FileCursorStore(dir).load("opencast"));
    }

    @Test
    void saved_cursor_survives_a_new_instance_and_leaves_no_temp_file() {
        new FileCursorStore(dir).save("opencast", "1700000000000");
        new FileCursorStore(dir).save("opencast", "1700000005000");

        assertEquals(Optional.of("1700000005000"), new FileCursorStore(dir).load("opencast"));
        assertFalse(Files.exists(dir.resolve("opencast.cursor.tmp")));
    }

    @Test
    void reset_forgets_only_that_source() {
        var cursors = new FileCursorStore(dir);
        cursors.save("a", "1");
        cursors.save("b", "2");
        cursors.reset("a");

        assertTrue(cursors.load("a").isEmpty());
        assertEquals(Optional.of("2"), cursors.load("b"));
    }

    @Test
    void source_names_cannot_escape_the_directory() {
        assertThrows(IllegalArgumentException.class, () -> new FileCursorStore(dir).save("../x", "1"));
    }
}
