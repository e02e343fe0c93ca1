package io.mediarealm.storage.mirror;

import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.mirror.Series;

import java.util.List;

/** Snapshot form of the mirror store. */
public record MirrorState(List<Series> series, List<Event> events, List<IndexTicket> indexQueue) {

    public MirrorState {
        series = series == null ? List.of() : series;
        events = events == null ? List.of() : events;
        indexQueue = indexQueue == null ? List.of() : indexQueue;
    }
}
