package io.mediarealm.storage.realm;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.mediarealm.core.realm.Block;
import io.mediarealm.core.realm.Realm;

import java.util.List;
import java.util.Objects;

/**
 * Primitive change to the realm tree. Mutations are expressed as a list of
 * these inside one {@link RealmTx}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "op")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RealmOp.PutRealm.class, name = "put-realm"),
        @JsonSubTypes.Type(value = RealmOp.DeleteRealms.class, name = "delete-realms"),
        @JsonSubTypes.Type(value = RealmOp.PutBlocks.class, name = "put-blocks")
})
public sealed interface RealmOp {

    /** Create the realm or replace the stored version with the same id. */
    record PutRealm(Realm realm) implements RealmOp {
        public PutRealm {
            Objects.requireNonNull(realm, "realm");
        }
    }

    /** Remove the realms and all blocks they own. */
    record DeleteRealms(List<Long> ids) implements RealmOp {
        public DeleteRealms {
            ids = List.copyOf(ids);
        }
    }

    /** Replace the full block list of a realm. Indices must already be dense. */
    record PutBlocks(long realmId, List<Block> blocks) implements RealmOp {
        public PutBlocks {
            blocks = List.copyOf(blocks);
            for (int i = 0; i < blocks.size(); i++) {
                Block b = blocks.get(i);
                if (b.index() != i || b.realmId() != realmId) {
                    throw new IllegalArgumentException("block list of realm " + realmId + " is not dense at " + i);
                }
            }
        }
    }
}
