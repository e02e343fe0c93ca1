package io.mediarealm.storage;

/**
 * Abstraction for writing and loading full snapshots of in-memory state.
 * <p>
 * Used to:
 *  - bound WAL replay time on startup,
 *  - make recovery faster for large datasets.
 *
 * @param <S> state type, serialized as a whole
 */
public interface Snapshotter<S> {

    /**
     * Persist a snapshot of {@code state}, which reflects every transaction up
     * to and including {@code lsn}.
     *
     * @return snapshot file name
     */
    String writeSnapshot(long lsn, S state);

    /**
     * Load the newest readable snapshot.
     *
     * @return null if no snapshot exists yet
     */
    LoadedSnapshot<S> loadLatest();

    record LoadedSnapshot<S>(String name, long lsn, S state) {
    }
}
