package io.mediarealm.server.realm;

import io.mediarealm.core.access.User;
import io.mediarealm.core.error.NotFoundException;
import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.realm.BlockContent;
import io.mediarealm.core.realm.Realm;
import io.mediarealm.core.realm.RealmOrder;
import io.mediarealm.core.realm.VideoListOrder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.mediarealm.server.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class RealmQueriesSpec extends RealmTestBase {

    private static final User STUDENT = User.of("sam", "ROLE_STUDENT");

    private Realm add(long parentId, String name, String segment) {
        return mutations.addChild(MODERATOR, parentId, name, segment);
    }

    private static List<String> names(List<RealmSummary> realms) {
        return realms.stream().map(RealmSummary::name).toList();
    }

    @Test
    void root_resolves_from_slash_and_empty_path() {
        assertTrue(queries.byPath(User.anonymous(), "/").realm().isRoot());
        assertTrue(queries.byPath(User.anonymous(), "").realm().isRoot());
        assertTrue(queries.byPath(User.anonymous(), null).realm().isRoot());
    }

    @Test
    void unknown_path_is_not_found() {
        assertThrows(NotFoundException.class, () -> queries.byPath(User.anonymous(), "/nope"));
        assertThrows(NotFoundException.class, () -> queries.byId(User.anonymous(), 999));
    }

    @Test
    void view_has_breadcrumbs_children_and_descendant_count() {
        Realm a = add(Realm.ROOT_ID, "Alpha", "alpha");
        Realm b = add(a.id(), "Beta", "beta");
        add(b.id(), "Gamma", "gamma");
        add(b.id(), "Delta", "delta");

        RealmView view = queries.byPath(User.anonymous(), "/alpha/beta/");

        assertEquals(b.id(), view.realm().id());
        assertEquals(List.of("", "/alpha"), view.ancestors().stream().map(RealmSummary::path).toList());
        assertEquals(List.of("Delta", "Gamma"), names(view.children()));
        assertEquals(2, view.descendantCount());
        assertFalse(view.canEdit());
        assertTrue(queries.byId(MODERATOR, b.id()).canEdit());
        assertEquals(3, queries.descendantCount(a.id()));
    }

    @Test
    void children_follow_the_configured_order() {
        add(Realm.ROOT_ID, "banana", "banana");
        add(Realm.ROOT_ID, "Apple", "apple");
        add(Realm.ROOT_ID, "cherry", "cherry");

        assertEquals(List.of("Apple", "banana", "cherry"),
                names(queries.byId(User.anonymous(), Realm.ROOT_ID).children()));

        mutations.setChildOrder(MODERATOR, Realm.ROOT_ID, RealmOrder.ALPHABETIC_DESC, null);
        assertEquals(List.of("cherry", "banana", "Apple"),
                names(queries.byId(User.anonymous(), Realm.ROOT_ID).children()));

        mutations.setChildOrder(MODERATOR, Realm.ROOT_ID, RealmOrder.BY_INDEX, null);
        assertEquals(List.of("banana", "Apple", "cherry"),
                names(queries.byId(User.anonymous(), Realm.ROOT_ID).children()));
    }

    @Test
    void video_block_degrades_when_the_event_is_deleted() {
        mirror.applyBatch(List.of(publicEvent("E1", null, "Intro", 1, 10)));
        Realm r = add(Realm.ROOT_ID, "Page", "page");
        mutations.appendBlock(MODERATOR, r.id(), new BlockContent.VideoRef("E1", true, true));

        BlockView live = queries.byId(User.anonymous(), r.id()).blocks().get(0);
        assertEquals(RefState.LIVE, live.state());
        assertEquals("Intro", live.event().title());

        mirror.applyBatch(List.of(deleteEvent("E1", 2)));

        RealmView view = queries.byId(User.anonymous(), r.id());
        assertEquals(1, view.blocks().size(), "the block itself stays");
        assertEquals(RefState.DELETED, view.blocks().get(0).state());
        assertNull(view.blocks().get(0).event());
    }

    @Test
    void restricted_event_is_hidden_from_callers_without_read_role() {
        mirror.applyBatch(List.of(event("E1", null, "Exam", 1, 10, "ROLE_STUDENT")));
        Realm r = add(Realm.ROOT_ID, "Page", "page");
        mutations.appendBlock(MODERATOR, r.id(), new BlockContent.VideoRef("E1", true, false));

        assertEquals(RefState.NOT_ALLOWED, queries.byId(User.anonymous(), r.id()).blocks().get(0).state());
        assertEquals(RefState.LIVE, queries.byId(STUDENT, r.id()).blocks().get(0).state());
    }

    @Test
    void series_block_lists_readable_events_in_block_order() {
        mirror.applyBatch(List.of(
                series("S1", "Course", 1),
                publicEvent("E1", "S1", "Bravo", 1, 200),
                publicEvent("E2", "S1", "alpha", 1, 100),
                publicEvent("E3", "S1", "Charlie", 1, 300),
                event("E4", "S1", "Secret", 1, 400, "ROLE_STUDENT")));
        Realm r = add(Realm.ROOT_ID, "Page", "page");
        mutations.appendBlock(MODERATOR, r.id(), new BlockContent.SeriesRef("S1", true, true, VideoListOrder.AZ));
        mutations.appendBlock(MODERATOR, r.id(), new BlockContent.SeriesRef("S1", true, true, null));

        List<BlockView> blocks = queries.byId(User.anonymous(), r.id()).blocks();
        assertEquals(List.of("alpha", "Bravo", "Charlie"), titles(blocks.get(0).events()));
        assertEquals(List.of("E3", "E1", "E2"), blocks.get(1).events().stream().map(Event::id).toList());
        assertEquals("Course", blocks.get(0).series().title());

        assertEquals(List.of("E1", "E2", "E3", "E4"),
                queries.seriesEvents(STUDENT, "S1", VideoListOrder.OLD_TO_NEW).stream()
                        .map(Event::id).sorted().toList());
        assertEquals(List.of("Secret", "Charlie", "Bravo", "alpha"),
                titles(queries.seriesEvents(STUDENT, "S1", VideoListOrder.ZA)));

        mirror.applyBatch(List.of(deleteSeries("S1", 2)));
        assertEquals(RefState.DELETED, queries.byId(User.anonymous(), r.id()).blocks().get(0).state());
    }

    private static List<String> titles(List<Event> events) {
        return events.stream().map(Event::title).toList();
    }

    @Test
    void text_blocks_carry_no_reference_state() {
        Realm r = add(Realm.ROOT_ID, "Page", "page");
        mutations.appendBlock(MODERATOR, r.id(), new BlockContent.Text("hello"));

        BlockView v = queries.byId(User.anonymous(), r.id()).blocks().get(0);
        assertNull(v.state());
        assertEquals(new BlockContent.Text("hello"), v.content());
    }

    @Test
    void pages_referencing_an_event_are_listed_once() {
        mirror.applyBatch(List.of(publicEvent("E1", null, "Intro", 1, 10), publicEvent("E2", null, "Other", 1, 10)));
        Realm p = add(Realm.ROOT_ID, "P", "pp");
        Realm q = add(Realm.ROOT_ID, "Q", "qq");
        mutations.appendBlock(MODERATOR, p.id(), new BlockContent.VideoRef("E1", true, true));
        mutations.appendBlock(MODERATOR, p.id(), new BlockContent.VideoRef("E1", false, false));
        mutations.appendBlock(MODERATOR, q.id(), new BlockContent.VideoRef("E2", true, true));

        List<Realm> refs = queries.realmsReferencingEvent(User.anonymous(), "E1");

        assertEquals(List.of("/pp"), refs.stream().map(Realm::fullPath).toList());
        assertThrows(NotFoundException.class, () -> queries.realmsReferencingEvent(User.anonymous(), "E9"));
    }
}
