package io.mediarealm.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void no_args_gives_local_dev_defaults() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[0]);

        assertEquals(8080, cfg.httpPort());
        assertEquals("./data", cfg.dataDir());
        assertNull(cfg.configPath());
        assertFalse(cfg.syncOnce());
    }

    @Test
    void long_and_short_flags_are_parsed() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[]{
                "-p", "9000", "--data-dir", "/var/lib/mr", "-c", "conf.json", "--sync-once"});

        assertEquals(9000, cfg.httpPort());
        assertEquals("/var/lib/mr", cfg.dataDir());
        assertEquals("conf.json", cfg.configPath());
        assertTrue(cfg.syncOnce());
    }
}
