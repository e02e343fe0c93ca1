package io.mediarealm.server.harvest;

/**
 * Pull-based client for the external system's change feed. Stateless: the
 * caller owns the cursor.
 */
public interface HarvestClient {

    /**
     * Fetch the changes after {@code cursor}.
     *
     * @param cursor cursor of the last applied batch, or null to start from the beginning
     * @throws TransientHarvestException on network failures, timeouts and retryable HTTP statuses
     * @throws ProtocolException         when the response cannot be understood
     */
    HarvestBatch fetch(String cursor);
}
