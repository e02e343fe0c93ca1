package io.mediarealm.server.harvest;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings of one harvest source.
 *
 * @param name            local name of the source, also the cursor file name
 * @param baseUri         base URL of the external system
 * @param user            basic-auth user, or null for no authentication
 * @param password        basic-auth password
 * @param preferredAmount how many items to ask for per request
 * @param timeout         timeout of a single request
 */
public record HarvestSource(
        String name,
        URI baseUri,
        String user,
        String password,
        int preferredAmount,
        Duration timeout
) {
    public HarvestSource {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(baseUri, "baseUri");
        Objects.requireNonNull(timeout, "timeout");
        if (preferredAmount <= 0) throw new IllegalArgumentException("preferredAmount must be > 0");
    }
}
