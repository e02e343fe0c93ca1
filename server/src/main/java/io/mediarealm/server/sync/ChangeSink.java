package io.mediarealm.server.sync;

import io.mediarealm.core.mirror.ChangeEvent;

import java.util.List;

/** Receives the change events of every committed batch. Must not block on the search backend. */
@FunctionalInterface
public interface ChangeSink {
    void handOff(List<ChangeEvent> changes);
}
