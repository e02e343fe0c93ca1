package io.mediarealm.server.search;

import io.mediarealm.core.access.AccessControl;
import io.mediarealm.core.access.User;
import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.mirror.MirroredEntity;
import io.mediarealm.storage.mirror.MirrorStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read side of search: asks the backend, then drops what the caller may not
 * read and anything the mirror store knows to be deleted (the index may lag).
 */
public final class SearchQueries {
    static final int MAX_LIMIT = 100;

    private final SearchBackend backend;
    private final MirrorStore mirror;
    private final AccessControl access;

    public SearchQueries(SearchBackend backend, MirrorStore mirror, AccessControl access) {
        this.backend = backend;
        this.mirror = mirror;
        this.access = access;
    }

    public List<SearchDocument> search(User user, String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        int capped = Math.max(1, Math.min(limit, MAX_LIMIT));
        // Over-fetch so that filtering rarely leaves the page short.
        List<SearchDocument> candidates = backend.search(query.trim(), capped * 3);
        List<SearchDocument> out = new ArrayList<>();
        for (SearchDocument doc : candidates) {
            if (out.size() == capped) {
                break;
            }
            Optional<MirroredEntity> entity = mirror.find(doc.ref());
            if (entity.isEmpty() || entity.get().tombstone()) {
                continue;
            }
            // The stored ACL is authoritative; the document's copy may be stale.
            if (entity.get() instanceof Event e && !access.canRead(user, e)) {
                continue;
            }
            out.add(doc);
        }
        return out;
    }
}
