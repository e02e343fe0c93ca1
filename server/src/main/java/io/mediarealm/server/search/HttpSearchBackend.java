package io.mediarealm.server.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Meilisearch-compatible HTTP backend.
 *
 * Endpoints used (all under {@code {baseUri}/indexes/{index}}):
 *   - POST   /documents?primaryKey=id     add or replace documents
 *   - POST   /documents/delete-batch      delete by id, body is a JSON array
 *   - DELETE /documents                   delete all documents
 *   - POST   /search                      {"q": "...", "limit": n} -> {"hits": [...]}
 *
 * Writes are accepted asynchronously by the service (HTTP 202); accepted is
 * treated as done. Any non-2xx status, I/O error or timeout becomes an
 * {@link IndexingException}.
 */
public final class HttpSearchBackend implements SearchBackend {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final URI indexUri;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient client;

    public HttpSearchBackend(URI baseUri, String indexName, String apiKey, Duration timeout) {
        Objects.requireNonNull(baseUri, "baseUri");
        Objects.requireNonNull(indexName, "indexName");
        String base = baseUri.toString().endsWith("/") ? baseUri.toString() : baseUri + "/";
        this.indexUri = URI.create(base + "indexes/" + indexName + "/");
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.client = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public void upsert(Collection<SearchDocument> docs) {
        if (docs.isEmpty()) return;
        send("POST", "documents?primaryKey=id", List.copyOf(docs));
    }

    @Override
    public void delete(Collection<String> documentIds) {
        if (documentIds.isEmpty()) return;
        send("POST", "documents/delete-batch", List.copyOf(documentIds));
    }

    @Override
    public void clear() {
        send("DELETE", "documents", null);
    }

    @Override
    public List<SearchDocument> search(String query, int limit) {
        byte[] body = send("POST", "search", Map.of("q", query, "limit", limit));
        try {
            SearchResponseDto dto = MAPPER.readValue(body, SearchResponseDto.class);
            return dto.hits();
        } catch (IOException e) {
            throw new IndexingException("unreadable search response", e);
        }
    }

    private byte[] send(String method, String path, Object body) {
        HttpRequest.BodyPublisher publisher;
        try {
            publisher = body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofByteArray(MAPPER.writeValueAsBytes(body));
        } catch (IOException e) {
            throw new IndexingException("cannot serialize request to search service", e);
        }
        HttpRequest.Builder req = HttpRequest.newBuilder(indexUri.resolve(path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .method(method, publisher);
        if (apiKey != null && !apiKey.isBlank()) {
            req.header("Authorization", "Bearer " + apiKey);
        }
        try {
            HttpResponse<byte[]> resp = client.send(req.build(), HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() / 100 != 2) {
                throw new IndexingException("search service returned HTTP " + resp.statusCode()
                        + " for " + method + " " + path);
            }
            return resp.body();
        } catch (IOException e) {
            throw new IndexingException("search service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndexingException("interrupted while talking to search service", e);
        }
    }

    // ---------- JSON DTOs ----------

    public static final class SearchResponseDto {
        private final List<SearchDocument> hits;

        @JsonCreator
        public SearchResponseDto(@JsonProperty("hits") List<SearchDocument> hits) {
            this.hits = hits != null ? hits : new ArrayList<>();
        }

        public List<SearchDocument> hits() {
            return hits;
        }
    }
}
