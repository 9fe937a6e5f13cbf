package com.memfacade.store;

import com.memfacade.memory.Identity;
import com.memfacade.memory.ResultNormalizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LuceneMemoryStoreTest {

    private static final Identity ALICE = Identity.ofUser("alice");
    private static final Identity BOB = Identity.ofUser("bob");

    @TempDir Path tempDir;
    private TickingClock clock;
    private LuceneMemoryStore store;

    @BeforeEach
    void setUp() throws Exception {
        clock = new TickingClock(Instant.parse("2024-03-01T00:00:00Z"));
        store = new LuceneMemoryStore(tempDir.toString(), clock);
    }

    @AfterEach
    void tearDown() { store.close(); }

    private String add(String content, Identity identity, Map<String, Object> metadata) {
        var result = store.add(content, identity, metadata, null, null, null, false);
        return ResultNormalizer.extractCreatedId(result);
    }

    private static List<Object> contents(Map<String, Object> response) {
        return ResultNormalizer.results(response).stream()
                .map(e -> ((Map<?, ?>) e).get("memory"))
                .collect(Collectors.toList());
    }

    @Test
    void addedMemoryIsReadableAsMemoryKey() {
        var result = store.add("likes green tea", ALICE, Map.of("source", "chat"), null, "session", "preference", true);
        var entry = (Map<?, ?>) ResultNormalizer.results(result).get(0);
        assertEquals("ADD", entry.get("event"));

        var payload = store.get(entry.get("id").toString(), ALICE);
        assertEquals("likes green tea", payload.get("memory"));
        assertEquals("alice", payload.get("user_id"));
        assertEquals("preference", payload.get("type"));
        assertEquals("session", payload.get("scope"));
        assertEquals(Map.of("source", "chat"), payload.get("metadata"));
        assertEquals("2024-03-01T00:00:00Z", payload.get("created_at"));
        assertEquals(0, payload.get("access_count"));
    }

    @Test
    void identityScopesReads() {
        var id = add("alice only", ALICE, null);
        assertNotNull(store.get(id, ALICE));
        assertNull(store.get(id, BOB));
        assertNotNull(store.get(id, Identity.none()));
        assertNull(store.get("missing", ALICE));
    }

    @Test
    void inferSuppressesExactDuplicateWithinScope() {
        store.add("same fact", ALICE, null, null, null, null, true);
        var dup = store.add("  same fact ", ALICE, null, null, null, null, true);
        assertTrue(ResultNormalizer.results(dup).isEmpty());

        var otherUser = store.add("same fact", BOB, null, null, null, null, true);
        assertEquals(1, ResultNormalizer.results(otherUser).size());

        var forced = store.add("same fact", ALICE, null, null, null, null, false);
        assertEquals(1, ResultNormalizer.results(forced).size());
    }

    @Test
    void blankContentIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.add("  ", ALICE, null, null, null, null, false));
    }

    @Test
    void rawPayloadReportsContentUnderData() {
        var id = add("raw text", ALICE, null);
        var raw = store.getRawPayload(id);
        assertEquals("raw text", raw.get("data"));
        assertNull(store.getRawPayload("missing"));
    }

    @Test
    void updateReplacesContentAndMetadataWithoutId() {
        var id = add("old text", ALICE, Map.of("a", 1));
        clock.advance(Duration.ofHours(1));

        var payload = store.update(id, "new text", ALICE, Map.of("a", 2, "b", true));

        assertFalse(payload.containsKey("id"));
        assertEquals("new text", payload.get("memory"));
        var reread = store.get(id, ALICE);
        assertEquals("new text", reread.get("memory"));
        assertEquals(Map.of("a", 2, "b", true), reread.get("metadata"));
        assertEquals("2024-03-01T00:00:00Z", reread.get("created_at"));
        assertEquals("2024-03-01T01:00:00Z", reread.get("updated_at"));
        assertEquals("alice", reread.get("user_id"));
    }

    @Test
    void updateOfMissingMemoryFails() {
        assertThrows(IllegalStateException.class, () -> store.update("missing", "x", ALICE, Map.of()));
    }

    @Test
    void deleteReportsWhetherAnythingWasRemoved() {
        var id = add("short lived", ALICE, null);
        assertFalse(store.delete(id, BOB));
        assertTrue(store.delete(id, ALICE));
        assertNull(store.get(id, ALICE));
        assertFalse(store.delete(id, ALICE));
    }

    @Test
    void deleteAllHonoursIdentity() {
        add("a1", ALICE, null);
        add("a2", ALICE, null);
        add("b1", BOB, null);

        assertEquals(2, store.deleteAll(ALICE));
        assertEquals(List.of("bob"), store.getUsers());
        assertEquals(1, store.deleteAll(Identity.none()));
        assertTrue(store.getUsers().isEmpty());
    }

    @Test
    void listSortsAndPages() {
        for (var content : List.of("first", "second", "third", "fourth")) {
            add(content, ALICE, null);
            clock.advance(Duration.ofMinutes(1));
        }
        add("bob's", BOB, null);

        assertEquals(List.of("third", "second"), contents(store.getAll(ALICE, 2, 1, "created_at", "desc")));
        assertEquals(List.of("first", "second", "third", "fourth"),
                contents(store.getAll(ALICE, 10, 0, "created_at", "asc")));

        assertEquals(5, ResultNormalizer.results(store.getAll(Identity.none(), 100, 0, null, "desc")).size());
        assertTrue(ResultNormalizer.results(store.getAll(ALICE, 10, 50, null, "desc")).isEmpty());
    }

    @Test
    void usersAreListedInFirstSeenOrder() {
        add("x", BOB, null);
        add("y", ALICE, null);
        add("z", BOB, null);
        add("anonymous", Identity.none(), null);
        assertEquals(List.of("bob", "alice"), store.getUsers());
    }

    @Test
    void statisticsAggregateTheScope() {
        add("one", ALICE, Map.of("importance", 0.9));
        store.add("two", ALICE, null, null, null, "fact", false);
        add("three", BOB, null);

        var stats = store.getStatistics(ALICE);

        assertEquals(2L, stats.get("total_memories"));
        assertEquals(Map.of("unknown", 1L, "fact", 1L), stats.get("by_type"));
        assertEquals((0.9 + 0.5) / 2, (Double) stats.get("avg_importance"), 1e-9);
        assertEquals(Map.of("2024-03-01", 2L), stats.get("growth_trend"));
    }

    @Test
    void memoriesSurviveReopen() throws Exception {
        var id = add("persistent", ALICE, Map.of("k", "v"));
        store.close();
        store = new LuceneMemoryStore(tempDir.toString(), clock);

        var payload = store.get(id, ALICE);
        assertEquals("persistent", payload.get("memory"));
        assertEquals(Map.of("k", "v"), payload.get("metadata"));
    }

    /** Fixed clock that tests move forward explicitly. */
    static final class TickingClock extends Clock {
        private Instant now;

        TickingClock(Instant start) { this.now = start; }

        void advance(Duration duration) { now = now.plus(duration); }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }

        @Override public Clock withZone(ZoneId zone) { return this; }

        @Override public Instant instant() { return now; }
    }
}
