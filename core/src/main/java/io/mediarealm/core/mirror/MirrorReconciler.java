package io.mediarealm.core.mirror;

/**
 * Last-writer-wins-by-revision reconciliation of a single change record
 * against the currently stored version of the entity.
 * <p>
 * Rules:
 *  - Upsert applies if nothing is stored, or the incoming revision is strictly
 *    newer than the stored one. Equal or older revisions are no-ops, which is
 *    what makes re-applying a batch idempotent.
 *  - Delete tombstones the entity if it is not tombstoned yet and the delete is
 *    not older than the stored revision. Unknown ids get a tombstone stub so a
 *    late, stale upsert cannot resurrect them.
 *  - A newer upsert after a tombstone brings the entity back.
 * <p>
 * Pure: no I/O, no clock, no shared state.
 */
public final class MirrorReconciler {

    private MirrorReconciler() {
    }

    /** Outcome of reconciling one record. {@code next} is null when nothing changes. */
    public record Outcome(MirroredEntity next, ChangeEvent event) {
        static final Outcome NO_OP = new Outcome(null, null);

        public boolean changed() {
            return next != null;
        }
    }

    public static Outcome reconcile(MirroredEntity stored, ChangeRecord incoming) {
        if (stored != null && stored.kind() != incoming.entityKind()) {
            throw new IllegalArgumentException(
                    "kind mismatch for " + incoming.entityId() + ": stored " + stored.kind()
                            + ", incoming " + incoming.entityKind());
        }

        if (incoming instanceof ChangeRecord.Upsert upsert) {
            MirroredEntity entity = upsert.entity();
            if (stored != null && stored.updated() >= entity.updated()) {
                return Outcome.NO_OP;
            }
            return new Outcome(entity, new ChangeEvent(
                    entity.kind(), entity.id(), ChangeEvent.Type.UPSERTED, entity.updated()));
        }

        ChangeRecord.Delete delete = (ChangeRecord.Delete) incoming;
        if (stored != null && (stored.tombstone() || stored.updated() > delete.revision())) {
            return Outcome.NO_OP;
        }
        MirroredEntity next = stored != null
                ? stored.asTombstone(delete.revision())
                : stub(delete);
        return new Outcome(next, new ChangeEvent(
                delete.entityKind(), delete.entityId(), ChangeEvent.Type.TOMBSTONED, delete.revision()));
    }

    private static MirroredEntity stub(ChangeRecord.Delete delete) {
        return switch (delete.entityKind()) {
            case SERIES -> Series.deletedStub(delete.entityId(), delete.revision());
            case EVENT -> Event.deletedStub(delete.entityId(), delete.revision());
        };
    }
}
