package io.mediarealm.server.search;

import java.util.Collection;
import java.util.List;

/**
 * Full-text index the indexer writes to. Eventually consistent with the
 * mirror store; no transactional guarantees.
 * <p>
 * Every method may throw {@link IndexingException}.
 */
public interface SearchBackend {

    void upsert(Collection<SearchDocument> docs);

    void delete(Collection<String> documentIds);

    /** Remove every document. First step of a rebuild. */
    void clear();

    /** Best matches first. */
    List<SearchDocument> search(String query, int limit);
}
