package io.mediarealm.server.dto;

/**
 * Shape of the optional JSON runtime config file. Every section and field
 * may be omitted; {@code RuntimeConfig} fills in defaults.
 */
public class JsonConfig {
    public Harvest harvest;
    public Sync sync;
    public Search search;
    public Auth auth;
    public Storage storage;

    public static class Harvest {
        public String name;
        public String url;
        public String user;
        public String password;
        public Integer preferredAmount;
        public Long timeoutMillis;
    }

    public static class Sync {
        public Long pollIntervalMillis;
        public Long initialBackoffMillis;
        public Long maxBackoffMillis;
    }

    public static class Search {
        public String meiliUrl;
        public String meiliKey;
        public String indexName;
        public Long timeoutMillis;
    }

    public static class Auth {
        public String adminRole;
        public String moderatorRole;
    }

    public static class Storage {
        public Long walRotateBytes;
        public Integer snapshotEveryTx;
    }
}
