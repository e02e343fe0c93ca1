package io.mediarealm.core.mirror;

import java.util.List;

/** One playable media track of an event. {@code resolution} is [width, height] or null. */
public record Track(String uri, String flavor, String mimetype, List<Integer> resolution) {

    public Track {
        resolution = resolution == null ? null : List.copyOf(resolution);
    }
}
