package io.mediarealm.client;

import org.junit.jupiter.api.Test;

import java.net.http.HttpRequest;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @Test
    void options_precede_the_command() {
        var inv = Cli.parse(new String[]{"--base-url", "http://mr:9000/", "--user", "root", "--roles", "ROLE_ADMIN",
                "rebuild-index"});

        assertEquals("http://mr:9000", inv.baseUrl());
        assertEquals("root", inv.user());
        assertEquals("ROLE_ADMIN", inv.roles());
        assertEquals("rebuild-index", inv.command());
        assertEquals(List.of(), inv.args());
    }

    @Test
    void defaults_to_local_server_and_anonymous() {
        var inv = Cli.parse(new String[]{"realm", "3"});

        assertEquals(Cli.DEFAULT_BASE_URL, inv.baseUrl());
        assertNull(inv.user());
        assertEquals(List.of("3"), inv.args());
    }

    @Test
    void missing_command_and_unknown_option_are_errors() {
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[0]));
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[]{"--user"}));
        assertThrows(Cli.CliException.class, () -> Cli.parse(new String[]{"--verbose", "x", "health"}));
    }

    @Test
    void realm_path_is_url_encoded() {
        HttpRequest req = Cli.request(Cli.parse(new String[]{"realm-path", "/lectures/physics 101"}));

        assertEquals("GET", req.method());
        assertEquals("http://localhost:8080/realms/by-path?path=%2Flectures%2Fphysics+101", req.uri().toString());
    }

    @Test
    void search_passes_optional_limit() {
        HttpRequest withLimit = Cli.request(Cli.parse(new String[]{"search", "quantum", "5"}));
        HttpRequest without = Cli.request(Cli.parse(new String[]{"search", "quantum"}));

        assertEquals("/search", withLimit.uri().getPath());
        assertEquals("q=quantum&limit=5", withLimit.uri().getQuery());
        assertEquals("q=quantum", without.uri().getQuery());
    }

    @Test
    void admin_commands_post_with_identity_headers() {
        HttpRequest req = Cli.request(Cli.parse(new String[]{"--user", "root", "--roles", "ROLE_ADMIN", "reset-cursor"}));

        assertEquals("POST", req.method());
        assertEquals("/admin/sync/reset-cursor", req.uri().getPath());
        assertEquals("root", req.headers().firstValue(Cli.USER_HEADER).orElseThrow());
        assertEquals("ROLE_ADMIN", req.headers().firstValue(Cli.ROLES_HEADER).orElseThrow());
    }

    @Test
    void wrong_arity_and_bad_numbers_are_rejected() {
        assertThrows(Cli.CliException.class, () -> Cli.request(Cli.parse(new String[]{"realm"})));
        assertThrows(Cli.CliException.class, () -> Cli.request(Cli.parse(new String[]{"realm", "abc"})));
        assertThrows(Cli.CliException.class, () -> Cli.request(Cli.parse(new String[]{"health", "extra"})));
        assertThrows(Cli.CliException.class, () -> Cli.request(Cli.parse(new String[]{"frobnicate"})));
    }
}
