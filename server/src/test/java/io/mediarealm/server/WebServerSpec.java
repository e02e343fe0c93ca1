package io.mediarealm.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mediarealm.core.access.AccessControl;
import io.mediarealm.core.access.AccessPolicy;
import io.mediarealm.server.realm.PathLocks;
import io.mediarealm.server.realm.RealmMutations;
import io.mediarealm.server.realm.RealmQueries;
import io.mediarealm.server.search.InMemorySearchBackend;
import io.mediarealm.server.search.SearchIndexer;
import io.mediarealm.server.search.SearchQueries;
import io.mediarealm.server.sync.Backoff;
import io.mediarealm.server.sync.Sleeper;
import io.mediarealm.storage.mirror.DurableMirrorStore;
import io.mediarealm.storage.realm.DurableRealmStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static io.mediarealm.server.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the HTTP façade: routing, identity headers, JSON
 * bodies and the error-kind to status mapping.
 */
class WebServerSpec {

    private static final int PORT = 18080; // test-only port
    private static final String MODERATOR_ROLES = AccessPolicy.DEFAULT_MODERATOR_ROLE;
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir Path dir;
    private DurableRealmStore realms;
    private DurableMirrorStore mirror;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        realms = DurableRealmStore.open(dir.resolve("realms"), 1L << 20, 1000);
        mirror = DurableMirrorStore.open(dir.resolve("mirror"), 1L << 20, 1000);
        var access = new AccessControl(AccessPolicy.defaults());
        var backend = new InMemorySearchBackend();
        var indexer = new SearchIndexer(mirror, backend, new Backoff(Duration.ofMillis(1), Duration.ofMillis(5)),
                Sleeper.monitor(), Duration.ofSeconds(1));

        server = new WebServer(PORT,
                new RealmQueries(realms, mirror, access),
                new RealmMutations(realms, mirror, access, new PathLocks(Duration.ofSeconds(2))),
                new SearchQueries(backend, mirror, access),
                indexer,
                null,
                access);
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
        realms.close();
        mirror.close();
    }

    private HttpResponse<String> call(String method, String path, String body, String user, String roles) throws Exception {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + path))
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/json");
        if (user != null) {
            req.header(WebServer.USER_HEADER, user);
        }
        if (roles != null) {
            req.header(WebServer.ROLES_HEADER, roles);
        }
        return client.send(req.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> asModerator(String method, String path, String body) throws Exception {
        return call(method, path, body, "mod", MODERATOR_ROLES);
    }

    private static JsonNode json(HttpResponse<String> resp) throws Exception {
        return JSON.readTree(resp.body());
    }

    @Test
    void health_is_ok() throws Exception {
        var resp = call("GET", "/admin/health", null, null, null);
        assertEquals(200, resp.statusCode());
        assertEquals("ok", json(resp).get("status").asText());
    }

    @Test
    void create_then_read_a_realm() throws Exception {
        var created = asModerator("POST", "/realms/0/children", "{\"name\": \"Talks\", \"pathSegment\": \"talks\"}");
        assertEquals(201, created.statusCode());
        long id = json(created).get("id").asLong();
        assertEquals("/talks", json(created).get("fullPath").asText());

        var byPath = call("GET", "/realms/by-path?path=/talks", null, null, null);
        assertEquals(200, byPath.statusCode());
        JsonNode view = json(byPath);
        assertEquals(id, view.get("realm").get("id").asLong());
        assertFalse(view.get("canEdit").asBoolean());
        assertEquals("", view.get("ancestors").get(0).get("path").asText());

        var root = call("GET", "/realms/0", null, null, null);
        assertEquals("Talks", json(root).get("children").get(0).get("name").asText());
    }

    @Test
    void duplicate_segment_is_a_400_with_violations() throws Exception {
        asModerator("POST", "/realms/0/children", "{\"name\": \"Talks\", \"pathSegment\": \"talks\"}");
        var resp = asModerator("POST", "/realms/0/children", "{\"name\": \"Talks 2\", \"pathSegment\": \"talks\"}");

        assertEquals(400, resp.statusCode());
        JsonNode body = json(resp);
        assertEquals("VALIDATION", body.get("kind").asText());
        assertEquals("path-collision", body.get("violations").get(0).asText());
    }

    @Test
    void anonymous_mutation_is_403() throws Exception {
        var resp = call("POST", "/realms/0/children", "{\"name\": \"X\", \"pathSegment\": \"xx\"}", null, null);
        assertEquals(403, resp.statusCode());
        assertEquals("NOT_AUTHORIZED", json(resp).get("kind").asText());
    }

    @Test
    void unknown_realm_route_and_method_map_to_404_and_405() throws Exception {
        assertEquals(404, call("GET", "/realms/999", null, null, null).statusCode());
        assertEquals(404, call("GET", "/nothing/here", null, null, null).statusCode());
        assertEquals(404, call("GET", "/realms/by-path?path=/missing", null, null, null).statusCode());
        assertEquals(405, call("PUT", "/realms/0", "{}", null, null).statusCode());
        assertEquals(400, call("GET", "/realms/abc", null, null, null).statusCode());
    }

    @Test
    void invalid_json_returns_400() throws Exception {
        var resp = asModerator("POST", "/realms/0/children", "{ invalid-json");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        String big = "x".repeat(11 * 1024 * 1024);
        var resp = asModerator("POST", "/realms/0/children", big);
        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
    }

    @Test
    void blocks_can_be_added_swapped_and_removed() throws Exception {
        long id = json(asModerator("POST", "/realms/0/children", "{\"name\": \"Page\", \"pathSegment\": \"page\"}"))
                .get("id").asLong();
        String base = "/realms/" + id + "/blocks";

        assertEquals(201, asModerator("POST", base, "{\"content\": {\"type\": \"title\", \"text\": \"Hello\"}}").statusCode());
        assertEquals(201, asModerator("POST", base, "{\"content\": {\"type\": \"text\", \"content\": \"Body\"}}").statusCode());

        var swapped = asModerator("POST", base + "/swap", "{\"indexA\": 0, \"indexB\": 1}");
        assertEquals(200, swapped.statusCode());
        assertEquals("text", json(swapped).get("blocks").get(0).get("content").get("type").asText());

        var updated = asModerator("PUT", base + "/0", "{\"content\": {\"type\": \"text\", \"content\": \"Changed\"}}");
        assertEquals(200, updated.statusCode());
        var wrongType = asModerator("PUT", base + "/0", "{\"content\": {\"type\": \"title\", \"text\": \"x\"}}");
        assertEquals(400, wrongType.statusCode());

        var removed = asModerator("DELETE", base + "/0", null);
        assertEquals(200, removed.statusCode());
        assertEquals(1, json(removed).get("blocks").size());
        assertEquals(0, json(removed).get("blocks").get(0).get("index").asInt());
    }

    @Test
    void deleted_video_renders_as_deleted_marker() throws Exception {
        mirror.applyBatch(List.of(publicEvent("E1", null, "Intro", 1, 10)));
        long id = json(asModerator("POST", "/realms/0/children", "{\"name\": \"Page\", \"pathSegment\": \"page\"}"))
                .get("id").asLong();
        asModerator("POST", "/realms/" + id + "/blocks",
                "{\"content\": {\"type\": \"video\", \"eventId\": \"E1\", \"showTitle\": true, \"showLink\": true}}");
        mirror.applyBatch(List.of(deleteEvent("E1", 2)));

        JsonNode block = json(call("GET", "/realms/" + id, null, null, null)).get("blocks").get(0);
        assertEquals("DELETED", block.get("state").asText());
        assertFalse(block.has("event"));
    }

    @Test
    void user_realm_and_rename_and_delete() throws Exception {
        var home = call("POST", "/user-realm", null, "alice", "ROLE_USER");
        assertEquals(201, home.statusCode());
        long id = json(home).get("id").asLong();
        assertEquals("/@alice", json(home).get("fullPath").asText());

        var child = call("POST", "/realms/" + id + "/children", "{\"name\": \"Notes\", \"pathSegment\": \"notes\"}",
                "alice", "ROLE_USER");
        long childId = json(child).get("id").asLong();

        var renamed = call("PATCH", "/realms/" + childId + "/name", "{\"name\": \"My notes\"}", "alice", null);
        assertEquals("My notes", json(renamed).get("name").asText());

        var moved = call("PATCH", "/realms/" + childId + "/path-segment", "{\"pathSegment\": \"memo\"}", "alice", null);
        assertEquals("/@alice/memo", json(moved).get("fullPath").asText());

        assertEquals(403, call("DELETE", "/realms/" + childId, null, "bob", null).statusCode());
        var deleted = call("DELETE", "/realms/" + childId, null, "alice", null);
        assertEquals(1, json(deleted).get("deleted").asInt());
    }

    @Test
    void search_and_admin_endpoints() throws Exception {
        mirror.applyBatch(List.of(series("S1", "Physics", 1), publicEvent("E1", "S1", "Physics intro", 1, 10)));

        assertEquals(403, call("POST", "/admin/search/rebuild", null, "mod", MODERATOR_ROLES).statusCode());
        var rebuilt = call("POST", "/admin/search/rebuild", null, "root", "ROLE_ADMIN");
        assertEquals(200, rebuilt.statusCode());
        assertEquals(2, json(rebuilt).get("indexed").asInt());

        var hits = call("GET", "/search?q=physics", null, null, null);
        assertEquals(200, hits.statusCode());
        assertEquals(2, json(hits).get("hits").size());

        assertEquals(404, call("GET", "/admin/sync/status", null, null, null).statusCode());
    }
}
