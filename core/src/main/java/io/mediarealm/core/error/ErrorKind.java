package io.mediarealm.core.error;

/**
 * Classification of every failure the system surfaces.
 * <p>
 * Propagation policy:
 *  - TRANSIENT_HARVEST and INDEXING are retried internally with backoff and
 *    never reach end users.
 *  - PROTOCOL halts the sync source until an operator resumes it.
 *  - VALIDATION, NOT_FOUND, CONFLICT and NOT_AUTHORIZED are returned verbatim
 *    to the caller of the mutation API.
 */
public enum ErrorKind {
    TRANSIENT_HARVEST,
    PROTOCOL,
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    NOT_AUTHORIZED,
    INDEXING;

    /** True for kinds the caller may simply retry. */
    public boolean retryable() {
        return this == TRANSIENT_HARVEST || this == CONFLICT || this == INDEXING;
    }
}
