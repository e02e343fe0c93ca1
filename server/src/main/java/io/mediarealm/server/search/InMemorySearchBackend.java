package io.mediarealm.server.search;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-process inverted index. Used when no search service is configured, and
 * in tests.
 * <p>
 * Matching: every query token must be a prefix of some token of the
 * document. Ranking: title matches weigh more than other fields; ties are
 * broken by newest {@code updated}.
 */
public final class InMemorySearchBackend implements SearchBackend {

    private final Map<String, SearchDocument> docs = new HashMap<>();
    // token -> document ids; sorted so prefix lookups are a range scan
    private final TreeMap<String, Set<String>> index = new TreeMap<>();

    @Override
    public synchronized void upsert(Collection<SearchDocument> batch) {
        for (SearchDocument doc : batch) {
            remove(doc.id());
            docs.put(doc.id(), doc);
            for (String token : tokensOf(doc)) {
                index.computeIfAbsent(token, k -> new HashSet<>()).add(doc.id());
            }
        }
    }

    @Override
    public synchronized void delete(Collection<String> documentIds) {
        documentIds.forEach(this::remove);
    }

    @Override
    public synchronized void clear() {
        docs.clear();
        index.clear();
    }

    @Override
    public synchronized List<SearchDocument> search(String query, int limit) {
        List<String> terms = tokenize(query);
        if (terms.isEmpty()) {
            return List.of();
        }
        Set<String> hits = null;
        for (String term : terms) {
            Set<String> matching = new HashSet<>();
            for (Set<String> ids : index.subMap(term, true, term + Character.MAX_VALUE, true).values()) {
                matching.addAll(ids);
            }
            if (hits == null) {
                hits = matching;
            } else {
                hits.retainAll(matching);
            }
        }

        List<SearchDocument> out = new ArrayList<>();
        for (String id : hits) {
            out.add(docs.get(id));
        }
        out.sort(Comparator.comparingInt((SearchDocument d) -> -titleScore(d, terms))
                .thenComparing(Comparator.comparingLong(SearchDocument::updated).reversed()));
        return out.size() > limit ? out.subList(0, limit) : out;
    }

    public synchronized int size() {
        return docs.size();
    }

    private void remove(String docId) {
        SearchDocument old = docs.remove(docId);
        if (old == null) {
            return;
        }
        for (String token : tokensOf(old)) {
            Set<String> ids = index.get(token);
            if (ids != null) {
                ids.remove(docId);
                if (ids.isEmpty()) {
                    index.remove(token);
                }
            }
        }
    }

    private static int titleScore(SearchDocument d, List<String> terms) {
        List<String> titleTokens = tokenize(d.title());
        int score = 0;
        for (String term : terms) {
            if (titleTokens.stream().anyMatch(t -> t.startsWith(term))) {
                score++;
            }
        }
        return score;
    }

    private static Set<String> tokensOf(SearchDocument d) {
        Set<String> out = new HashSet<>();
        out.addAll(tokenize(d.title()));
        out.addAll(tokenize(d.description()));
        out.addAll(tokenize(d.creator()));
        out.addAll(tokenize(d.seriesTitle()));
        return out;
    }

    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String folded = Normalizer.normalize(text, Normalizer.Form.NFKD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT);
        List<String> out = new ArrayList<>();
        for (String t : folded.split("[^\\p{L}\\p{N}]+")) {
            if (!t.isEmpty()) {
                out.add(t);
            }
        }
        return out;
    }
}
