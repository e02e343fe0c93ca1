package io.mediarealm.server.dto;

/**
 * JSON body for POST /realms/{id}/blocks/swap.
 * Example:
 *   { "indexA": 1, "indexB": 2 }
 */
public class SwapBlocksRequest {
    public int indexA;
    public int indexB;
}
