package io.mediarealm.storage.cursor;

import java.util.Optional;

/**
 * Durable harvest cursor, one per sync source. An absent cursor means
 * "harvest from the beginning".
 */
public interface CursorStore {

    Optional<String> load(String source);

    /** Replace the cursor; once this returns it survives a crash. */
    void save(String source, String cursor);

    /** Forget the cursor so the next harvest starts from scratch. */
    void reset(String source);
}
