package io.mediarealm.server.harvest;

import io.mediarealm.core.mirror.ChangeRecord;

import java.util.List;

/**
 * One page of the change feed.
 *
 * @param records    change records in source revision order (may contain duplicates)
 * @param nextCursor cursor to resume after this batch once it is applied
 * @param hasMore    true if the source already has more changes after {@code nextCursor}
 */
public record HarvestBatch(List<ChangeRecord> records, String nextCursor, boolean hasMore) {

    public HarvestBatch {
        records = List.copyOf(records);
    }
}
