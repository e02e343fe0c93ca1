package io.mediarealm.storage.realm;

import java.util.List;

/** Ops that commit together: one WAL record, applied under one write lock. */
public record RealmTx(List<RealmOp> ops) {

    public RealmTx {
        ops = List.copyOf(ops);
    }

    public static RealmTx of(RealmOp... ops) {
        return new RealmTx(List.of(ops));
    }
}
