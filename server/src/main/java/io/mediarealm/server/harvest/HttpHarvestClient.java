package io.mediarealm.server.harvest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mediarealm.core.mirror.Acl;
import io.mediarealm.core.mirror.ChangeRecord;
import io.mediarealm.core.mirror.EntityKind;
import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.mirror.Series;
import io.mediarealm.core.mirror.Track;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP-based HarvestClient.
 *
 * Talks to the external system's harvest endpoint:
 *
 *   GET {baseUri}/harvest?since=&lt;cursor&gt;&amp;preferredAmount=&lt;n&gt;
 *
 * Response JSON:
 *
 *   {
 *     "includesItemsUntil": 1700000000000,
 *     "hasMore": false,
 *     "items": [
 *       { "kind": "event", "id": "...", "updated": 1699999999000, ... },
 *       { "kind": "series-deleted", "id": "...", "updated": ... }
 *     ]
 *   }
 *
 * The next cursor is {@code includesItemsUntil} as a string. Items of unknown
 * kind are logged and skipped.
 * <p>
 * Error mapping:
 *   - I/O errors, timeouts, 408, 429, 5xx and other non-2xx -> TransientHarvestException
 *   - remaining 4xx, malformed JSON, missing mandatory fields -> ProtocolException
 */
public final class HttpHarvestClient implements HarvestClient {
    private static final Logger LOG = Logger.getLogger(HttpHarvestClient.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final HarvestSource source;
    private final HttpClient client;

    public HttpHarvestClient(HarvestSource source) {
        this.source = Objects.requireNonNull(source, "source");
        this.client = HttpClient.newBuilder()
                .connectTimeout(source.timeout())
                .build();
    }

    @Override
    public HarvestBatch fetch(String cursor) {
        String since = cursor == null ? "0" : cursor;
        String query = String.format("since=%s&preferredAmount=%d", encode(since), source.preferredAmount());
        URI uri = harvestUri(source.baseUri(), query);

        HttpRequest.Builder req = HttpRequest.newBuilder(uri)
                .timeout(source.timeout())
                .header("Accept", "application/json")
                .GET();
        if (source.user() != null) {
            String token = source.user() + ":" + (source.password() == null ? "" : source.password());
            req.header("Authorization", "Basic "
                    + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8)));
        }

        HttpResponse<byte[]> resp;
        try {
            resp = client.send(req.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new TransientHarvestException("harvest request to " + source.name() + " timed out", e);
        } catch (IOException e) {
            throw new TransientHarvestException("harvest request to " + source.name() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientHarvestException("interrupted while harvesting " + source.name(), e);
        }

        int code = resp.statusCode();
        if (code / 100 != 2) {
            if (code / 100 == 4 && code != 408 && code != 429) {
                throw new ProtocolException("source " + source.name() + " rejected harvest request with HTTP " + code);
            }
            throw new TransientHarvestException("source " + source.name() + " returned HTTP " + code);
        }
        return parse(resp.body());
    }

    /** Decode a harvest response body. */
    static HarvestBatch parse(byte[] body) {
        ResponseDto dto;
        try {
            dto = MAPPER.readValue(body, ResponseDto.class);
        } catch (IOException e) {
            throw new ProtocolException("harvest response is not valid JSON", e);
        }
        if (dto.includesItemsUntil() == null) {
            throw new ProtocolException("harvest response lacks 'includesItemsUntil'");
        }

        List<ChangeRecord> records = new ArrayList<>(dto.items().size());
        for (JsonNode item : dto.items()) {
            String kind = item.path("kind").asText(null);
            if (kind == null) {
                throw new ProtocolException("harvest item without 'kind'");
            }
            try {
                switch (kind) {
                    case "event" -> records.add(new ChangeRecord.Upsert(toEvent(MAPPER.treeToValue(item, EventDto.class))));
                    case "series" -> records.add(new ChangeRecord.Upsert(toSeries(MAPPER.treeToValue(item, SeriesDto.class))));
                    case "event-deleted" -> records.add(toDelete(EntityKind.EVENT, MAPPER.treeToValue(item, DeletedDto.class)));
                    case "series-deleted" -> records.add(toDelete(EntityKind.SERIES, MAPPER.treeToValue(item, DeletedDto.class)));
                    default -> LOG.log(Level.WARNING, "skipping harvest item of unknown kind ''{0}''", kind);
                }
            } catch (JsonProcessingException e) {
                throw new ProtocolException("malformed '" + kind + "' item: " + e.getOriginalMessage(), e);
            } catch (ProtocolException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ProtocolException("malformed '" + kind + "' item: " + e, e);
            }
        }
        return new HarvestBatch(records, Long.toString(dto.includesItemsUntil()), dto.hasMore());
    }

    private static Event toEvent(EventDto d) {
        require(d.id, "event.id");
        require(d.updated, "event.updated");
        List<Track> tracks = new ArrayList<>();
        for (TrackDto t : d.tracks) {
            require(t, "event.tracks[]");
            tracks.add(new Track(t.uri, t.flavor, t.mimetype, t.resolution));
        }
        Acl acl = Acl.empty();
        if (d.acl != null) {
            d.acl.read.forEach(role -> require(role, "event.acl.read[]"));
            d.acl.write.forEach(role -> require(role, "event.acl.write[]"));
            acl = new Acl(new HashSet<>(d.acl.read), new HashSet<>(d.acl.write));
        }
        return new Event(d.id, d.partOf, d.title, d.description, d.creator, d.duration, d.thumbnail,
                d.created == null ? 0L : d.created, d.updated, tracks, acl, false);
    }

    private static Series toSeries(SeriesDto d) {
        require(d.id, "series.id");
        require(d.updated, "series.updated");
        return new Series(d.id, d.title, d.description, d.updated, false);
    }

    private static ChangeRecord toDelete(EntityKind kind, DeletedDto d) {
        require(d.id, "deleted.id");
        require(d.updated, "deleted.updated");
        return new ChangeRecord.Delete(kind, d.id, d.updated);
    }

    private static void require(Object value, String field) {
        if (value == null) {
            throw new ProtocolException("harvest item lacks mandatory field '" + field + "'");
        }
    }

    /** {@code {base}/harvest?query}, keeping any path prefix of the base. */
    static URI harvestUri(URI base, String query) {
        String b = base.toString();
        while (b.endsWith("/")) {
            b = b.substring(0, b.length() - 1);
        }
        return URI.create(b + "/harvest?" + query);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    // ---------- JSON DTOs ----------

    public static final class ResponseDto {
        private final Long includesItemsUntil;
        private final boolean hasMore;
        private final List<JsonNode> items;

        @JsonCreator
        public ResponseDto(
                @JsonProperty("includesItemsUntil") Long includesItemsUntil,
                @JsonProperty("hasMore") boolean hasMore,
                @JsonProperty("items") List<JsonNode> items
        ) {
            this.includesItemsUntil = includesItemsUntil;
            this.hasMore = hasMore;
            this.items = items != null ? items : List.of();
        }

        public Long includesItemsUntil() {
            return includesItemsUntil;
        }

        public boolean hasMore() {
            return hasMore;
        }

        public List<JsonNode> items() {
            return items;
        }
    }

    public static final class EventDto {
        final String id;
        final String title;
        final String description;
        final String partOf;
        final Long created;
        final Long updated;
        final String creator;
        final Long duration;
        final String thumbnail;
        final List<TrackDto> tracks;
        final AclDto acl;

        @JsonCreator
        public EventDto(
                @JsonProperty("id") String id,
                @JsonProperty("title") String title,
                @JsonProperty("description") String description,
                @JsonProperty("partOf") String partOf,
                @JsonProperty("created") Long created,
                @JsonProperty("updated") Long updated,
                @JsonProperty("creator") String creator,
                @JsonProperty("duration") Long duration,
                @JsonProperty("thumbnail") String thumbnail,
                @JsonProperty("tracks") List<TrackDto> tracks,
                @JsonProperty("acl") AclDto acl
        ) {
            this.id = id;
            this.title = title;
            this.description = description;
            this.partOf = partOf;
            this.created = created;
            this.updated = updated;
            this.creator = creator;
            this.duration = duration;
            this.thumbnail = thumbnail;
            this.tracks = tracks != null ? tracks : List.of();
            this.acl = acl;
        }
    }

    public static final class TrackDto {
        final String uri;
        final String flavor;
        final String mimetype;
        final List<Integer> resolution;

        @JsonCreator
        public TrackDto(
                @JsonProperty("uri") String uri,
                @JsonProperty("flavor") String flavor,
                @JsonProperty("mimetype") String mimetype,
                @JsonProperty("resolution") List<Integer> resolution
        ) {
            this.uri = uri;
            this.flavor = flavor;
            this.mimetype = mimetype;
            this.resolution = resolution;
        }
    }

    public static final class AclDto {
        final List<String> read;
        final List<String> write;

        @JsonCreator
        public AclDto(
                @JsonProperty("read") List<String> read,
                @JsonProperty("write") List<String> write
        ) {
            this.read = read != null ? read : List.of();
            this.write = write != null ? write : List.of();
        }
    }

    public static final class SeriesDto {
        final String id;
        final String title;
        final String description;
        final Long updated;

        @JsonCreator
        public SeriesDto(
                @JsonProperty("id") String id,
                @JsonProperty("title") String title,
                @JsonProperty("description") String description,
                @JsonProperty("updated") Long updated
        ) {
            this.id = id;
            this.title = title;
            this.description = description;
            this.updated = updated;
        }
    }

    public static final class DeletedDto {
        final String id;
        final Long updated;

        @JsonCreator
        public DeletedDto(
                @JsonProperty("id") String id,
                @JsonProperty("updated") Long updated
        ) {
            this.id = id;
            this.updated = updated;
        }
    }
}
