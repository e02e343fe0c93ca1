package io.mediarealm.server.dto;

import io.mediarealm.core.realm.BlockContent;

/**
 * JSON body for POST /realms/{id}/blocks.
 * Example:
 *   { "index": 0, "content": { "type": "title", "text": "Welcome" } }
 * A missing index appends at the end.
 */
public class InsertBlockRequest {
    public Integer index;
    public BlockContent content;
}
