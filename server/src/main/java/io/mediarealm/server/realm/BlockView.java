package io.mediarealm.server.realm;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.mirror.Series;
import io.mediarealm.core.realm.BlockContent;
import io.mediarealm.core.realm.BlockKind;

import java.util.List;

/**
 * A block as rendered for one caller. For title/text blocks only
 * {@code content} is set. Video blocks carry {@code event} when LIVE; series
 * blocks carry {@code series} plus the readable events in display order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlockView(
        long id,
        int index,
        BlockKind kind,
        BlockContent content,
        RefState state,
        Series series,
        Event event,
        List<Event> events
) {
    static BlockView plain(long id, int index, BlockContent content) {
        return new BlockView(id, index, content.kind(), content, null, null, null, null);
    }
}
