package io.mediarealm.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Operator CLI for a running media-realm server.
 *
 * Usage:
 *   media-realm-cli [--base-url URL] [--user NAME] [--roles R1,R2] <command> [args]
 *
 * Commands:
 *   health
 *   realm <id>
 *   realm-path <path>
 *   event-realms <eventId>
 *   search <query> [limit]
 *   sync-status
 *   sync-resume
 *   reset-cursor
 *   rebuild-index
 *
 * Responses are printed as indented JSON.
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:8080";
    static final String USER_HEADER = "X-MediaRealm-User";
    static final String ROLES_HEADER = "X-MediaRealm-Roles";

    private final HttpClient http;
    private final ObjectMapper json = new ObjectMapper();

    private Cli() {
        this.http = HttpClient.newHttpClient();
    }

    /** Parsed command line. {@code user} and {@code roles} may be null. */
    record Invocation(String baseUrl, String user, String roles, String command, List<String> args) {
    }

    public static void main(String[] args) {
        try {
            Invocation inv = parse(args);
            new Cli().run(inv);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            if (e.showUsage) {
                System.err.println(USAGE);
            }
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Invocation parse(String[] args) {
        String baseUrl = DEFAULT_BASE_URL;
        String user = null;
        String roles = null;
        int i = 0;
        while (i < args.length && args[i].startsWith("--")) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                throw new CliException(flag + " requires a value", true);
            }
            String value = args[i + 1];
            switch (flag) {
                case "--base-url" -> baseUrl = value;
                case "--user" -> user = value;
                case "--roles" -> roles = value;
                default -> throw new CliException("unknown option: " + flag, true);
            }
            i += 2;
        }
        if (i >= args.length) {
            throw new CliException("missing command", true);
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        String command = args[i];
        List<String> rest = new ArrayList<>(Arrays.asList(args).subList(i + 1, args.length));
        return new Invocation(baseUrl, user, roles, command, rest);
    }

    /** Maps a command onto the server's HTTP API. */
    static HttpRequest request(Invocation inv) {
        List<String> a = inv.args();
        String target;
        String method = "GET";
        switch (inv.command()) {
            case "health" -> {
                expectArgs(inv, 0, 0);
                target = "/admin/health";
            }
            case "realm" -> {
                expectArgs(inv, 1, 1);
                target = "/realms/" + number(a.get(0), "realm id");
            }
            case "realm-path" -> {
                expectArgs(inv, 1, 1);
                target = "/realms/by-path?path=" + encode(a.get(0));
            }
            case "event-realms" -> {
                expectArgs(inv, 1, 1);
                target = "/events/" + encode(a.get(0)) + "/realms";
            }
            case "search" -> {
                expectArgs(inv, 1, 2);
                target = "/search?q=" + encode(a.get(0));
                if (a.size() == 2) {
                    target += "&limit=" + number(a.get(1), "limit");
                }
            }
            case "sync-status" -> {
                expectArgs(inv, 0, 0);
                target = "/admin/sync/status";
            }
            case "sync-resume" -> {
                expectArgs(inv, 0, 0);
                target = "/admin/sync/resume";
                method = "POST";
            }
            case "reset-cursor" -> {
                expectArgs(inv, 0, 0);
                target = "/admin/sync/reset-cursor";
                method = "POST";
            }
            case "rebuild-index" -> {
                expectArgs(inv, 0, 0);
                target = "/admin/search/rebuild";
                method = "POST";
            }
            default -> throw new CliException("unknown command: " + inv.command(), true);
        }

        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(inv.baseUrl() + target))
                .method(method, HttpRequest.BodyPublishers.noBody());
        if (inv.user() != null) {
            b.header(USER_HEADER, inv.user());
        }
        if (inv.roles() != null) {
            b.header(ROLES_HEADER, inv.roles());
        }
        return b.build();
    }

    private void run(Invocation inv) throws IOException, InterruptedException {
        HttpResponse<String> resp = http.send(request(inv), HttpResponse.BodyHandlers.ofString());
        String body = render(resp.body());
        if (resp.statusCode() >= 400) {
            throw new CliException(inv.command() + " failed (" + resp.statusCode() + "): " + body, false);
        }
        System.out.println(body);
    }

    /** Indented JSON when the body is JSON, the raw body otherwise. */
    String render(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode tree = json.readTree(body);
            return json.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (IOException notJson) {
            return body;
        }
    }

    private static void expectArgs(Invocation inv, int min, int max) {
        int n = inv.args().size();
        if (n < min || n > max) {
            throw new CliException(inv.command() + " takes " + (min == max ? min : min + " to " + max)
                    + " argument(s), got " + n, true);
        }
    }

    private static long number(String raw, String what) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new CliException(what + " must be a number: " + raw, false);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static final String USAGE = """
            Usage:
              media-realm-cli [--base-url URL] [--user NAME] [--roles R1,R2] <command> [args]

            Commands:
              health                   server liveness
              realm <id>               realm page by id
              realm-path <path>        realm page by path, e.g. /lectures/physics
              event-realms <eventId>   realms that embed the event
              search <query> [limit]   full-text search
              sync-status              harvest sync state and cursor
              sync-resume              resume a halted sync (admin)
              reset-cursor             re-harvest from the beginning (admin)
              rebuild-index            rebuild the search index (admin)
            """;

    static final class CliException extends RuntimeException {
        final boolean showUsage;

        CliException(String msg, boolean showUsage) {
            super(msg);
            this.showUsage = showUsage;
        }
    }
}
