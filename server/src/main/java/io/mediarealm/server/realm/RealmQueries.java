package io.mediarealm.server.realm;

import io.mediarealm.core.access.AccessControl;
import io.mediarealm.core.access.User;
import io.mediarealm.core.error.NotFoundException;
import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.mirror.Series;
import io.mediarealm.core.realm.Block;
import io.mediarealm.core.realm.BlockContent;
import io.mediarealm.core.realm.Realm;
import io.mediarealm.core.realm.RealmPaths;
import io.mediarealm.core.realm.VideoListOrder;
import io.mediarealm.storage.mirror.MirrorStore;
import io.mediarealm.storage.realm.RealmStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the realm tree. Resolves block references against the mirror
 * so that deleted or unreadable content degrades to a marker instead of
 * failing the whole page.
 */
public final class RealmQueries {

    private static final Comparator<Realm> BY_NAME = Comparator
            .comparing((Realm r) -> displayName(r), String.CASE_INSENSITIVE_ORDER)
            .thenComparingLong(Realm::id);

    private static final Comparator<Realm> BY_INDEX = Comparator
            .comparingInt(Realm::index)
            .thenComparingLong(Realm::id);

    private static final Comparator<Event> BY_CREATED = Comparator
            .comparingLong(Event::created)
            .thenComparing(Event::id);

    private static final Comparator<Event> BY_TITLE = Comparator
            .comparing((Event e) -> e.title() == null ? "" : e.title(), String.CASE_INSENSITIVE_ORDER)
            .thenComparing(Event::id);

    private final RealmStore store;
    private final MirrorStore mirror;
    private final AccessControl access;

    public RealmQueries(RealmStore store, MirrorStore mirror, AccessControl access) {
        this.store = store;
        this.mirror = mirror;
        this.access = access;
    }

    public RealmView byPath(User user, String path) {
        String normalized = RealmPaths.normalize(path);
        Realm realm = store.realmByPath(normalized)
                .orElseThrow(() -> new NotFoundException("no realm at " + (normalized.isEmpty() ? "/" : normalized)));
        return view(user, realm);
    }

    public RealmView byId(User user, long id) {
        return view(user, require(id));
    }

    public Realm realm(long id) {
        return require(id);
    }

    /** Children in the parent's configured order. */
    public List<Realm> orderedChildren(long realmId) {
        Realm realm = require(realmId);
        List<Realm> children = new ArrayList<>(store.children(realmId));
        switch (realm.childOrder()) {
            case ALPHABETIC_ASC -> children.sort(BY_NAME);
            case ALPHABETIC_DESC -> children.sort(BY_NAME.reversed());
            case BY_INDEX -> children.sort(BY_INDEX);
        }
        return children;
    }

    /** Root first, excluding the realm itself. */
    public List<Realm> ancestors(long realmId) {
        List<Realm> chain = new ArrayList<>();
        Realm current = require(realmId);
        while (current.parentId() != null) {
            current = require(current.parentId());
            chain.add(current);
        }
        Collections.reverse(chain);
        return chain;
    }

    public int descendantCount(long realmId) {
        require(realmId);
        return store.descendants(realmId).size();
    }

    /** Realms with a video block pointing at {@code eventId}, each listed once. */
    public List<Realm> realmsReferencingEvent(User user, String eventId) {
        Event event = mirror.findEvent(eventId)
                .filter(e -> !e.tombstone())
                .orElseThrow(() -> new NotFoundException("event " + eventId + " does not exist"));
        if (!access.canRead(user, event)) {
            return List.of();
        }
        Map<Long, Realm> out = new LinkedHashMap<>();
        for (Block b : store.findBlocks(blk -> blk.content() instanceof BlockContent.VideoRef v
                && eventId.equals(v.eventId()))) {
            store.realm(b.realmId()).ifPresent(r -> out.putIfAbsent(r.id(), r));
        }
        List<Realm> realms = new ArrayList<>(out.values());
        realms.sort(Comparator.comparing(Realm::fullPath));
        return realms;
    }

    /** Live, readable events of a series in the requested order. */
    public List<Event> seriesEvents(User user, String seriesId, VideoListOrder order) {
        List<Event> events = new ArrayList<>();
        for (Event e : mirror.liveEventsOfSeries(seriesId)) {
            if (access.canRead(user, e)) {
                events.add(e);
            }
        }
        switch (order == null ? VideoListOrder.NEW_TO_OLD : order) {
            case NEW_TO_OLD -> events.sort(BY_CREATED.reversed());
            case OLD_TO_NEW -> events.sort(BY_CREATED);
            case AZ -> events.sort(BY_TITLE);
            case ZA -> events.sort(BY_TITLE.reversed());
        }
        return events;
    }

    private RealmView view(User user, Realm realm) {
        List<RealmSummary> ancestors = ancestors(realm.id()).stream().map(RealmSummary::of).toList();
        List<RealmSummary> children = orderedChildren(realm.id()).stream().map(RealmSummary::of).toList();
        List<BlockView> blocks = new ArrayList<>();
        for (Block b : store.blocks(realm.id())) {
            blocks.add(resolve(user, b));
        }
        return new RealmView(realm, ancestors, children, blocks,
                store.descendants(realm.id()).size(), access.canWrite(user, realm));
    }

    BlockView resolve(User user, Block block) {
        BlockContent content = block.content();
        switch (content.kind()) {
            case VIDEO: {
                BlockContent.VideoRef ref = (BlockContent.VideoRef) content;
                Optional<Event> event = ref.eventId() == null ? Optional.empty() : mirror.findEvent(ref.eventId());
                if (event.isEmpty() || event.get().tombstone()) {
                    return refView(block, RefState.DELETED, null, null, null);
                }
                if (!access.canRead(user, event.get())) {
                    return refView(block, RefState.NOT_ALLOWED, null, null, null);
                }
                return refView(block, RefState.LIVE, null, event.get(), null);
            }
            case SERIES: {
                BlockContent.SeriesRef ref = (BlockContent.SeriesRef) content;
                Optional<Series> series = ref.seriesId() == null ? Optional.empty() : mirror.findSeries(ref.seriesId());
                if (series.isEmpty() || series.get().tombstone()) {
                    return refView(block, RefState.DELETED, null, null, null);
                }
                return refView(block, RefState.LIVE, series.get(), null,
                        seriesEvents(user, ref.seriesId(), ref.order()));
            }
            default:
                return BlockView.plain(block.id(), block.index(), content);
        }
    }

    private static BlockView refView(Block b, RefState state, Series series, Event event, List<Event> events) {
        return new BlockView(b.id(), b.index(), b.kind(), b.content(), state, series, event, events);
    }

    private Realm require(long id) {
        return store.realm(id).orElseThrow(() -> new NotFoundException("realm " + id + " does not exist"));
    }

    private static String displayName(Realm r) {
        return r.name() != null ? r.name() : r.pathSegment();
    }
}
