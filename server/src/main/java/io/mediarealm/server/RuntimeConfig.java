package io.mediarealm.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mediarealm.core.access.AccessPolicy;
import io.mediarealm.server.dto.JsonConfig;
import io.mediarealm.server.harvest.HarvestSource;
import io.mediarealm.server.sync.SyncSettings;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Typed runtime settings, loaded from the optional JSON config file.
 *
 * @param harvest harvest source, or null when no source is configured (sync disabled)
 * @param search  Meilisearch settings, or null to use the in-memory backend
 */
public record RuntimeConfig(
        HarvestSource harvest,
        SyncSettings sync,
        SearchSettings search,
        AccessPolicy access,
        StorageSettings storage
) {

    public record SearchSettings(URI url, String apiKey, String indexName, Duration timeout) {
    }

    public record StorageSettings(long walRotateBytes, int snapshotEveryTx) {
        public StorageSettings {
            if (walRotateBytes <= 0) throw new IllegalArgumentException("walRotateBytes must be > 0");
            if (snapshotEveryTx <= 0) throw new IllegalArgumentException("snapshotEveryTx must be > 0");
        }

        public static StorageSettings defaults() {
            return new StorageSettings(64L * 1024 * 1024, 1000);
        }
    }

    public static RuntimeConfig defaults() {
        return new RuntimeConfig(null, SyncSettings.defaults(), null, AccessPolicy.defaults(), StorageSettings.defaults());
    }

    public static RuntimeConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try {
            return from(mapper.readValue(path.toFile(), JsonConfig.class));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load runtime config from " + path, e);
        }
    }

    static RuntimeConfig from(JsonConfig cfg) {
        RuntimeConfig d = defaults();

        HarvestSource harvest = null;
        if (cfg.harvest != null && cfg.harvest.url != null && !cfg.harvest.url.isBlank()) {
            harvest = new HarvestSource(
                    cfg.harvest.name == null ? "default" : cfg.harvest.name,
                    URI.create(cfg.harvest.url),
                    cfg.harvest.user,
                    cfg.harvest.password,
                    cfg.harvest.preferredAmount == null ? 500 : cfg.harvest.preferredAmount,
                    Duration.ofMillis(cfg.harvest.timeoutMillis == null ? 30_000L : cfg.harvest.timeoutMillis)
            );
        }

        SyncSettings sync = d.sync();
        if (cfg.sync != null) {
            sync = new SyncSettings(
                    millisOr(cfg.sync.pollIntervalMillis, sync.pollInterval()),
                    millisOr(cfg.sync.initialBackoffMillis, sync.initialBackoff()),
                    millisOr(cfg.sync.maxBackoffMillis, sync.maxBackoff())
            );
        }

        SearchSettings search = null;
        if (cfg.search != null && cfg.search.meiliUrl != null && !cfg.search.meiliUrl.isBlank()) {
            search = new SearchSettings(
                    URI.create(cfg.search.meiliUrl),
                    cfg.search.meiliKey,
                    cfg.search.indexName == null ? "media_realm" : cfg.search.indexName,
                    Duration.ofMillis(cfg.search.timeoutMillis == null ? 10_000L : cfg.search.timeoutMillis)
            );
        }

        AccessPolicy access = d.access();
        if (cfg.auth != null) {
            access = new AccessPolicy(
                    cfg.auth.adminRole == null ? access.adminRole() : cfg.auth.adminRole,
                    cfg.auth.moderatorRole == null ? access.moderatorRole() : cfg.auth.moderatorRole
            );
        }

        StorageSettings storage = d.storage();
        if (cfg.storage != null) {
            storage = new StorageSettings(
                    cfg.storage.walRotateBytes == null ? storage.walRotateBytes() : cfg.storage.walRotateBytes,
                    cfg.storage.snapshotEveryTx == null ? storage.snapshotEveryTx() : cfg.storage.snapshotEveryTx
            );
        }

        return new RuntimeConfig(harvest, sync, search, access, storage);
    }

    private static Duration millisOr(Long millis, Duration fallback) {
        return millis == null ? fallback : Duration.ofMillis(millis);
    }
}
