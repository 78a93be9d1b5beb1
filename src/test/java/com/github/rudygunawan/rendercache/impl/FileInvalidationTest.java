package com.github.rudygunawan.rendercache.impl;

import com.github.rudygunawan.rendercache.api.RenderCache;
import com.github.rudygunawan.rendercache.builder.RenderCacheBuilder;
import com.github.rudygunawan.rendercache.model.BatchOperationResult;
import com.github.rudygunawan.rendercache.model.CacheKeyParams;
import com.github.rudygunawan.rendercache.model.FileChangeEvent;
import com.github.rudygunawan.rendercache.model.InvalidationEvent;
import com.github.rudygunawan.rendercache.policy.InvalidationReason;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for invalidation driven by source file changes.
 */
class FileInvalidationTest {

    private final List<InvalidationEvent> events = new CopyOnWriteArrayList<>();
    private RenderCache<String> cache;

    @BeforeEach
    void setUp() {
        events.clear();
        cache = RenderCacheBuilder.newBuilder()
                .listener(events::add)
                .build();
    }

    private String render(String source, String filePath, Long modifiedAt) {
        return cache.put(CacheKeyParams.of(source, filePath), "<p>" + source + "</p>", modifiedAt);
    }

    @Test
    void testChangedFileRemovesItsEntries() {
        String light = cache.put(CacheKeyParams.builder("# A").filePath("docs/a.md").theme("light").build(), "a", 100L);
        String dark = cache.put(CacheKeyParams.builder("# A").filePath("docs/a.md").theme("dark").build(), "a", 100L);
        String other = render("# B", "docs/b.md", 100L);

        int removed = cache.onFileChange(FileChangeEvent.changed("docs/a.md", 200L));

        assertEquals(2, removed);
        assertFalse(cache.containsKey(light));
        assertFalse(cache.containsKey(dark));
        assertTrue(cache.containsKey(other));

        assertEquals(2, events.size());
        for (InvalidationEvent event : events) {
            assertEquals(InvalidationReason.FILE_CHANGED, event.getReason());
            assertEquals("docs/a.md", event.getEntry().getSourceFilePath());
        }
        assertEquals(Set.of(light, dark), Set.of(events.get(0).getKey(), events.get(1).getKey()));
        assertEquals(2, cache.statistics().getInvalidations());
        assertEquals(0, cache.statistics().getEvictions());
    }

    @Test
    void testUnchangedModificationTimeKeepsEntries() {
        String key = render("# A", "docs/a.md", 100L);

        assertEquals(0, cache.onFileChange(FileChangeEvent.changed("docs/a.md", 100L)));

        assertTrue(cache.containsKey(key));
        assertTrue(events.isEmpty());
    }

    @Test
    void testUnlinkAlwaysRemoves() {
        String key = render("# A", "docs/a.md", 100L);

        assertEquals(1, cache.onFileChange(FileChangeEvent.unlinked("docs/a.md")));

        assertFalse(cache.containsKey(key));
        assertEquals(InvalidationReason.FILE_CHANGED, events.get(0).getReason());
    }

    @Test
    void testUnlinkRemovesEntriesStoredWithoutModificationTime() {
        CacheKeyParams params = CacheKeyParams.of("# A", "docs/a.md");
        cache.getOrCompute(params, () -> "<p>A</p>");

        assertEquals(1, cache.onFileChange(FileChangeEvent.unlinked("docs/a.md")));

        assertFalse(cache.peek(params).isFound());
        assertEquals(InvalidationReason.FILE_CHANGED, events.get(0).getReason());
    }

    @Test
    void testAddIsIgnored() {
        String key = render("# A", "docs/a.md", 100L);

        assertEquals(0, cache.onFileChange(FileChangeEvent.added("docs/a.md", 300L)));

        assertTrue(cache.containsKey(key));
    }

    @Test
    void testUnknownPathIsNoOp() {
        render("# A", "docs/a.md", 100L);

        assertEquals(0, cache.onFileChange(FileChangeEvent.changed("docs/unknown.md", 200L)));
        assertEquals(0, cache.invalidateByFilePath("docs/unknown.md"));
        assertEquals(1, cache.size());
        assertTrue(events.isEmpty());
    }

    @Test
    void testEntriesWithoutModificationTimeAreRemovedOnChange() {
        String key = render("# A", "docs/a.md", null);

        assertEquals(1, cache.onFileChange(FileChangeEvent.changed("docs/a.md", 100L)));
        assertFalse(cache.containsKey(key));
    }

    @Test
    void testWatcherNotificationsIgnoredWhenFileInvalidationDisabled() {
        RenderCache<String> noWatch = RenderCacheBuilder.newBuilder()
                .fileBasedInvalidation(false)
                .build();
        String key = noWatch.put(CacheKeyParams.of("# A", "docs/a.md"), "a", 100L);

        assertEquals(0, noWatch.onFileChange(FileChangeEvent.changed("docs/a.md", 200L)));
        assertTrue(noWatch.containsKey(key));

        // explicit invalidation still works
        assertEquals(1, noWatch.invalidateByFilePath("docs/a.md"));
        assertFalse(noWatch.containsKey(key));
    }

    @Test
    void testInvalidateByFilePathKeepsCurrentVersion() {
        String stale = cache.put(CacheKeyParams.builder("# A v1").filePath("docs/a.md").build(), "v1", 100L);
        String current = cache.put(CacheKeyParams.builder("# A v2").filePath("docs/a.md").build(), "v2", 200L);

        assertEquals(1, cache.invalidateByFilePath("docs/a.md", 200L));

        assertFalse(cache.containsKey(stale));
        assertTrue(cache.containsKey(current));
    }

    @Test
    void testInvalidateAllEmitsOneBatchEvent() {
        String a = render("# A", "docs/a.md", 1L);
        String a2 = cache.put(CacheKeyParams.builder("# A").filePath("docs/a.md").theme("dark").build(), "a", 1L);
        String b = render("# B", "docs/b.md", 1L);
        String c = render("# C", "docs/c.md", 1L);

        int removed = cache.invalidateAll(Arrays.asList("docs/a.md", "docs/b.md", "docs/missing.md"));

        assertEquals(3, removed);
        assertEquals(List.of(c), cache.keys());
        assertEquals(1, events.size());
        InvalidationEvent event = events.get(0);
        assertEquals(InvalidationReason.BATCH, event.getReason());
        assertTrue(event.isSummary());
        assertNull(event.getKey());
        assertEquals(Set.of(a, a2, b), Set.copyOf(event.getKeys()));
        assertEquals(3, cache.statistics().getInvalidations());
    }

    @Test
    void testInvalidateKeysReportsMissingKeys() {
        String a = render("# A", "docs/a.md", 1L);
        String b = render("# B", "docs/b.md", 1L);

        BatchOperationResult result = cache.invalidateKeys(List.of(a, "not-a-key", b));

        assertEquals(2, result.getSuccessCount());
        assertEquals(1, result.getFailureCount());
        assertEquals(List.of("not-a-key"), result.getFailedKeys());
        assertEquals(0, cache.size());
        assertEquals(1, events.size());
        assertEquals(List.of(a, b), events.get(0).getKeys());
    }

    @Test
    void testEmptyBatchEmitsNothing() {
        render("# A", "docs/a.md", 1L);

        assertEquals(0, cache.invalidateAll(List.of("docs/other.md")));
        assertEquals(1, cache.invalidateKeys(List.of("nope")).getFailureCount());
        assertTrue(events.isEmpty());
    }

    @Test
    void testClearEmitsOneSummaryEvent() {
        render("# A", "docs/a.md", 1L);
        render("# B", "docs/b.md", 1L);

        cache.clear(InvalidationReason.FILE_CHANGED);
        cache.clear();

        assertEquals(1, events.size());
        assertEquals(InvalidationReason.FILE_CHANGED, events.get(0).getReason());
        assertEquals(2, events.get(0).getKeys().size());
    }

    @Test
    void testFileIndexIsMaintainedAcrossReplacement() {
        CacheKeyParams params = CacheKeyParams.of("# A", "docs/a.md");
        cache.put(params, "v1", 100L);
        cache.put(params, "v2", 100L);

        assertEquals(1, cache.size());
        assertEquals(1, cache.invalidateByFilePath("docs/a.md"));
        assertEquals(0, cache.size());
        assertEquals(0, cache.statistics().getCurrentTotalBytes());
    }
}
