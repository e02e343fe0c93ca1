package io.mediarealm.server.sync;

/** Where the sync loop of one source currently is. */
public enum SyncState {
    /** Waiting for the next poll. */
    IDLE,
    FETCHING,
    APPLYING,
    /** Handing the applied batch to the indexer and persisting the cursor. */
    INDEXING,
    /** Waiting before retrying after a transient failure. */
    BACKOFF,
    /** Stopped after a protocol error until an operator resumes. */
    HALTED
}
