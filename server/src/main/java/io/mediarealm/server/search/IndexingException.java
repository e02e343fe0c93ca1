package io.mediarealm.server.search;

import io.mediarealm.core.error.ErrorKind;
import io.mediarealm.core.error.MediaRealmException;

/** Search backend unavailable or refusing writes. Retried by the indexer, never blocks sync. */
public class IndexingException extends MediaRealmException {
    public IndexingException(String message) {
        super(ErrorKind.INDEXING, message);
    }

    public IndexingException(String message, Throwable cause) {
        super(ErrorKind.INDEXING, message, cause);
    }
}
