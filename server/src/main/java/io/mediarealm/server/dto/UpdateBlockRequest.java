package io.mediarealm.server.dto;

import io.mediarealm.core.realm.BlockContent;

/** JSON body for PUT /realms/{id}/blocks/{index}. */
public class UpdateBlockRequest {
    public BlockContent content;
}
