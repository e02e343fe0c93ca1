package io.mediarealm.core.realm;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Type-specific payload of a block. Closed set; consumers dispatch with an
 * exhaustive {@code switch} over {@link #kind()} so that adding a variant
 * breaks every place that has to handle it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BlockContent.Title.class, name = "title"),
        @JsonSubTypes.Type(value = BlockContent.Text.class, name = "text"),
        @JsonSubTypes.Type(value = BlockContent.SeriesRef.class, name = "series"),
        @JsonSubTypes.Type(value = BlockContent.VideoRef.class, name = "video")
})
public sealed interface BlockContent {

    @JsonIgnore
    BlockKind kind();

    record Title(String text) implements BlockContent {
        @Override public BlockKind kind() { return BlockKind.TITLE; }
    }

    record Text(String content) implements BlockContent {
        @Override public BlockKind kind() { return BlockKind.TEXT; }
    }

    /** {@code seriesId} may be null once the series is gone; rendered as deleted. */
    record SeriesRef(
            String seriesId,
            boolean showTitle,
            boolean showMetadata,
            VideoListOrder order
    ) implements BlockContent {
        public SeriesRef {
            order = order == null ? VideoListOrder.NEW_TO_OLD : order;
        }

        @Override public BlockKind kind() { return BlockKind.SERIES; }
    }

    /** {@code eventId} may be null once the event is gone; rendered as deleted. */
    record VideoRef(String eventId, boolean showTitle, boolean showLink) implements BlockContent {
        @Override public BlockKind kind() { return BlockKind.VIDEO; }
    }
}
