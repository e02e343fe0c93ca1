package io.mediarealm.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mediarealm.core.access.AccessControl;
import io.mediarealm.core.access.User;
import io.mediarealm.core.error.MediaRealmException;
import io.mediarealm.core.error.NotAuthorizedException;
import io.mediarealm.core.error.NotFoundException;
import io.mediarealm.core.error.ValidationException;
import io.mediarealm.server.dto.AddChildRequest;
import io.mediarealm.server.dto.ChildOrderRequest;
import io.mediarealm.server.dto.ErrorResponse;
import io.mediarealm.server.dto.InsertBlockRequest;
import io.mediarealm.server.dto.PathSegmentRequest;
import io.mediarealm.server.dto.RenameRequest;
import io.mediarealm.server.dto.SwapBlocksRequest;
import io.mediarealm.server.dto.SyncStatusResponse;
import io.mediarealm.server.dto.UpdateBlockRequest;
import io.mediarealm.server.realm.RealmMutations;
import io.mediarealm.server.realm.RealmQueries;
import io.mediarealm.server.search.SearchIndexer;
import io.mediarealm.server.search.SearchQueries;
import io.mediarealm.server.sync.SyncDaemon;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Thin HTTP adapter over the realm, search and sync services.
 *
 * Responsibilities:
 *  - Parse HTTP method + path, and the caller identity from trusted proxy headers.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map {@link MediaRealmException} kinds to HTTP status codes.
 *  - Emit one log line per request via {@link RequestLogger}.
 *
 * Path layout:
 *   - GET    /realms/by-path?path=/a/b
 *   - GET    /realms/{id}
 *   - DELETE /realms/{id}
 *   - POST   /realms/{id}/children
 *   - PATCH  /realms/{id}/name
 *   - PATCH  /realms/{id}/path-segment
 *   - PUT    /realms/{id}/child-order
 *   - POST   /realms/{id}/blocks
 *   - POST   /realms/{id}/blocks/swap
 *   - PUT    /realms/{id}/blocks/{index}
 *   - DELETE /realms/{id}/blocks/{index}
 *   - GET    /events/{id}/realms
 *   - POST   /user-realm
 *   - GET    /search?q=...&limit=20
 *   - GET    /admin/health
 *   - GET    /admin/sync/status
 *   - POST   /admin/sync/resume          (admin)
 *   - POST   /admin/sync/reset-cursor    (admin)
 *   - POST   /admin/search/rebuild       (admin)
 *
 * Identity headers:
 *   - X-MediaRealm-User:  username; absent means anonymous
 *   - X-MediaRealm-Roles: comma separated roles of that user
 *
 * Requests are dispatched to Undertow's worker pool before any store is
 * touched; store commits fsync and must not run on an IO thread.
 */
public final class WebServer {
    public static final String USER_HEADER = "X-MediaRealm-User";
    public static final String ROLES_HEADER = "X-MediaRealm-Roles";

    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final int DEFAULT_SEARCH_LIMIT = 20;

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final RealmQueries realms;
    private final RealmMutations mutations;
    private final SearchQueries search;
    private final SearchIndexer indexer;
    private final SyncDaemon sync; // null when no harvest source is configured
    private final AccessControl access;

    public WebServer(int port,
                     RealmQueries realms,
                     RealmMutations mutations,
                     SearchQueries search,
                     SearchIndexer indexer,
                     SyncDaemon sync,
                     AccessControl access) {
        this.realms = realms;
        this.mutations = mutations;
        this.search = search;
        this.indexer = indexer;
        this.sync = sync;
        this.access = access;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    if (exchange.isInIoThread()) {
                        exchange.dispatch(this::handle);
                        return;
                    }
                    handle(exchange);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- request pipeline ----------

    private void handle(HttpServerExchange ex) {
        long start = System.nanoTime();
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        User user = User.anonymous();
        int status;
        long serviceMs = -1L;
        Throwable error = null;
        try {
            user = userOf(ex);
            byte[] body = readBody(ex, method);

            long sStart = System.nanoTime();
            Reply reply = route(ex, method, segments(path), user, body);
            serviceMs = (System.nanoTime() - sStart) / 1_000_000L;

            status = reply.status();
            send(ex, status, reply.body());
        } catch (BodyTooLargeException tooLarge) {
            status = 413;
            send(ex, status, ErrorResponse.of("VALIDATION", "request body too large"));
        } catch (NoRouteException none) {
            status = 404;
            send(ex, status, ErrorResponse.of("NOT_FOUND", "not found"));
        } catch (MethodNotAllowedException notAllowed) {
            status = 405;
            send(ex, status, ErrorResponse.of("VALIDATION", "method not allowed"));
        } catch (MediaRealmException domain) {
            status = statusOf(domain);
            error = status >= 500 ? domain : null;
            send(ex, status, errorBody(domain));
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            ErrorResponse body = ErrorResponse.of("VALIDATION", "invalid JSON");
            body.violations = List.of("invalid-json");
            send(ex, status, body);
        } catch (IllegalArgumentException bad) {
            status = 400;
            send(ex, status, ErrorResponse.of("VALIDATION", bad.getMessage()));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, ErrorResponse.of("INTERNAL", e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(method, path, user.username(), status, totalMs, serviceMs, error);
    }

    private Reply route(HttpServerExchange ex, String method, String[] p, User user, byte[] body) throws IOException {
        if (p.length == 0) {
            throw new NoRouteException();
        }
        return switch (p[0]) {
            case "realms" -> realmRoutes(ex, method, p, user, body);
            case "events" -> {
                if (p.length != 3 || !"realms".equals(p[2])) throw new NoRouteException();
                requireMethod(method, "GET");
                yield Reply.ok(Map.of("realms", realms.realmsReferencingEvent(user, p[1])));
            }
            case "user-realm" -> {
                if (p.length != 1) throw new NoRouteException();
                requireMethod(method, "POST");
                yield new Reply(201, mutations.createUserRealm(user));
            }
            case "search" -> {
                if (p.length != 1) throw new NoRouteException();
                requireMethod(method, "GET");
                String q = firstOrNull(ex.getQueryParameters().get("q"));
                int limit = intParam(ex, "limit", DEFAULT_SEARCH_LIMIT);
                yield Reply.ok(Map.of("hits", search.search(user, q, limit)));
            }
            case "admin" -> adminRoutes(method, p, user);
            default -> throw new NoRouteException();
        };
    }

    private Reply realmRoutes(HttpServerExchange ex, String method, String[] p, User user, byte[] body) throws IOException {
        if (p.length == 2 && "by-path".equals(p[1])) {
            requireMethod(method, "GET");
            String path = firstOrNull(ex.getQueryParameters().get("path"));
            return Reply.ok(realms.byPath(user, path));
        }
        if (p.length < 2) {
            throw new NoRouteException();
        }
        long id = parseId(p[1], "realm id");

        if (p.length == 2) {
            return switch (method) {
                case "GET" -> Reply.ok(realms.byId(user, id));
                case "DELETE" -> Reply.ok(Map.of("deleted", mutations.delete(user, id)));
                default -> throw new MethodNotAllowedException();
            };
        }

        String sub = p[2];
        if (p.length == 3) {
            switch (sub) {
                case "children" -> {
                    requireMethod(method, "POST");
                    var req = parse(body, AddChildRequest.class);
                    return new Reply(201, mutations.addChild(user, id, req.name, req.pathSegment));
                }
                case "name" -> {
                    requireMethod(method, "PATCH");
                    var req = parse(body, RenameRequest.class);
                    return Reply.ok(mutations.rename(user, id, req.name));
                }
                case "path-segment" -> {
                    requireMethod(method, "PATCH");
                    var req = parse(body, PathSegmentRequest.class);
                    return Reply.ok(mutations.changePathSegment(user, id, req.pathSegment));
                }
                case "child-order" -> {
                    requireMethod(method, "PUT");
                    var req = parse(body, ChildOrderRequest.class);
                    return Reply.ok(mutations.setChildOrder(user, id, req.order, req.childIds));
                }
                case "blocks" -> {
                    requireMethod(method, "POST");
                    var req = parse(body, InsertBlockRequest.class);
                    return new Reply(201, req.index == null
                            ? mutations.appendBlock(user, id, req.content)
                            : mutations.insertBlock(user, id, req.index, req.content));
                }
                default -> throw new NoRouteException();
            }
        }

        if (p.length == 4 && "blocks".equals(sub)) {
            if ("swap".equals(p[3])) {
                requireMethod(method, "POST");
                var req = parse(body, SwapBlocksRequest.class);
                return Reply.ok(Map.of("blocks", mutations.swapBlocks(user, id, req.indexA, req.indexB)));
            }
            int index = (int) parseId(p[3], "block index");
            return switch (method) {
                case "PUT" -> {
                    var req = parse(body, UpdateBlockRequest.class);
                    yield Reply.ok(mutations.updateBlock(user, id, index, req.content));
                }
                case "DELETE" -> Reply.ok(Map.of("blocks", mutations.removeBlock(user, id, index)));
                default -> throw new MethodNotAllowedException();
            };
        }
        throw new NoRouteException();
    }

    private Reply adminRoutes(String method, String[] p, User user) {
        String route = String.join("/", Arrays.copyOfRange(p, 1, p.length));
        switch (route) {
            case "health" -> {
                requireMethod(method, "GET");
                return Reply.ok(Map.of("status", "ok"));
            }
            case "sync/status" -> {
                requireMethod(method, "GET");
                return Reply.ok(SyncStatusResponse.of(requireSync().status()));
            }
            case "sync/resume" -> {
                requireMethod(method, "POST");
                requireAdmin(user);
                requireSync().resume();
                return new Reply(202, Map.of("status", "resume requested"));
            }
            case "sync/reset-cursor" -> {
                requireMethod(method, "POST");
                requireAdmin(user);
                requireSync().resetCursor();
                return new Reply(202, Map.of("status", "cursor reset requested"));
            }
            case "search/rebuild" -> {
                requireMethod(method, "POST");
                requireAdmin(user);
                return Reply.ok(Map.of("indexed", indexer.rebuild()));
            }
            default -> throw new NoRouteException();
        }
    }

    // ---------- helpers ----------

    private SyncDaemon requireSync() {
        if (sync == null) {
            throw new NotFoundException("no harvest source configured");
        }
        return sync;
    }

    private void requireAdmin(User user) {
        if (!access.isAdmin(user)) {
            throw new NotAuthorizedException("admin role required");
        }
    }

    /** Caller identity from the trusted proxy headers; no user header means anonymous. */
    static User userOf(HttpServerExchange ex) {
        String name = ex.getRequestHeaders().getFirst(USER_HEADER);
        if (name == null || name.isBlank()) {
            return User.anonymous();
        }
        Set<String> roles = new LinkedHashSet<>();
        String header = ex.getRequestHeaders().getFirst(ROLES_HEADER);
        if (header != null) {
            for (String r : header.split(",")) {
                if (!r.isBlank()) {
                    roles.add(r.trim());
                }
            }
        }
        return new User(name.trim(), name.trim(), roles);
    }

    private static byte[] readBody(HttpServerExchange ex, String method) throws IOException {
        if (!"POST".equals(method) && !"PUT".equals(method) && !"PATCH".equals(method)) {
            return new byte[0];
        }
        ex.startBlocking();
        InputStream in = ex.getInputStream();
        byte[] data = in.readNBytes(MAX_BODY_BYTES + 1);
        if (data.length > MAX_BODY_BYTES) {
            // consume the rest so the client sees the 413 instead of a reset
            in.transferTo(OutputStream.nullOutputStream());
            throw new BodyTooLargeException();
        }
        return data;
    }

    private <T> T parse(byte[] body, Class<T> type) throws IOException {
        if (body.length == 0) {
            throw new IllegalArgumentException("request body required");
        }
        return json.readValue(body, type);
    }

    private static String[] segments(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? new String[0] : trimmed.split("/");
    }

    private static long parseId(String raw, String what) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException(what + " must be a number: " + raw, nfe);
        }
    }

    private static int intParam(HttpServerExchange ex, String name, int fallback) {
        String raw = firstOrNull(ex.getQueryParameters().get(name));
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException(name + " must be an integer", nfe);
        }
    }

    private static void requireMethod(String actual, String expected) {
        if (!expected.equals(actual)) {
            throw new MethodNotAllowedException();
        }
    }

    private static int statusOf(MediaRealmException e) {
        return switch (e.kind()) {
            case VALIDATION -> 400;
            case NOT_AUTHORIZED -> 403;
            case NOT_FOUND -> 404;
            case CONFLICT -> 409;
            default -> 500;
        };
    }

    private static ErrorResponse errorBody(MediaRealmException e) {
        ErrorResponse body = ErrorResponse.of(e.kind().name(), e.getMessage());
        if (e instanceof ValidationException v) {
            body.violations = v.violations();
        }
        return body;
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"kind\":\"INTERNAL\",\"error\":\"serialization\"}");
        }
    }

    private record Reply(int status, Object body) {
        static Reply ok(Object body) {
            return new Reply(200, body);
        }
    }

    private static final class BodyTooLargeException extends RuntimeException {
    }

    private static final class NoRouteException extends RuntimeException {
    }

    private static final class MethodNotAllowedException extends RuntimeException {
    }
}
