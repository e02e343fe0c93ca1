package io.mediarealm.server.dto;

import io.mediarealm.core.realm.RealmOrder;

import java.util.List;

/**
 * JSON body for PUT /realms/{id}/child-order.
 * Example:
 *   { "order": "BY_INDEX", "childIds": [4, 2, 7] }
 * {@code childIds} is optional and only meaningful for BY_INDEX.
 */
public class ChildOrderRequest {
    public RealmOrder order;
    public List<Long> childIds;
}
