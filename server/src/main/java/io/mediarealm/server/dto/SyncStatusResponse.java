package io.mediarealm.server.dto;

import io.mediarealm.server.sync.SyncStatus;

/** JSON response for GET /admin/sync/status. {@code lastSuccessMillis} is null before the first successful cycle. */
public class SyncStatusResponse {
    public String source;
    public String state;
    public String cursor;
    public Long lastSuccessMillis;
    public int consecutiveFailures;
    public boolean halted;
    public String haltReason;

    public static SyncStatusResponse of(SyncStatus s) {
        SyncStatusResponse r = new SyncStatusResponse();
        r.source = s.source();
        r.state = s.state().name();
        r.cursor = s.cursor();
        r.lastSuccessMillis = s.lastSuccess() == null ? null : s.lastSuccess().toEpochMilli();
        r.consecutiveFailures = s.consecutiveFailures();
        r.halted = s.halted();
        r.haltReason = s.haltReason();
        return r;
    }
}
