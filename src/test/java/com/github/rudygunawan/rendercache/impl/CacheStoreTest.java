package com.github.rudygunawan.rendercache.impl;

import com.github.rudygunawan.rendercache.api.ByteSizer;
import com.github.rudygunawan.rendercache.model.CacheClearResult;
import com.github.rudygunawan.rendercache.model.CacheEntry;
import com.github.rudygunawan.rendercache.model.CacheLimits;
import com.github.rudygunawan.rendercache.model.CacheQueryResult;
import com.github.rudygunawan.rendercache.policy.CapacityEvictionPolicy;
import com.github.rudygunawan.rendercache.policy.InvalidationReason;
import com.github.rudygunawan.rendercache.time.FakeTicker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CacheStoreTest {

    private final FakeTicker ticker = new FakeTicker();

    private CacheStore<String> newStore(long maxEntries, long maxTotalBytes, long ttlMillis) {
        CacheLimits limits = new CacheLimits(maxEntries, maxTotalBytes, ttlMillis, true, true);
        return new CacheStore<>(limits, ticker, ByteSizer.utf8Sizer(),
                new StatisticsRecorder(limits, ticker.read()), new CapacityEvictionPolicy(limits));
    }

    @Test
    void testPutAndGet() {
        CacheStore<String> store = newStore(10, 1000, 0);
        List<CacheEntry<String>> evicted = new ArrayList<>();

        assertTrue(store.put("k1", "hello", "docs/a.md", 42L, evicted));
        ticker.advance(5);
        CacheQueryResult<String> result = store.get("k1", true, new ArrayList<>());

        assertTrue(result.isHit());
        CacheEntry<String> entry = result.getEntry();
        assertEquals("hello", entry.getValue());
        assertEquals(5, entry.getByteSize());
        assertEquals("docs/a.md", entry.getSourceFilePath());
        assertEquals(Long.valueOf(42L), entry.getSourceFileModifiedAt());
        assertEquals(1, entry.getAccessCount());
        assertEquals(entry.getCreatedAt() + 5, entry.getLastAccessedAt());
        assertTrue(evicted.isEmpty());
    }

    @Test
    void testReturnedEntryIsDetached() {
        CacheStore<String> store = newStore(10, 1000, 0);
        store.put("k1", "hello", null, null, new ArrayList<>());

        CacheEntry<String> first = store.get("k1", true, new ArrayList<>()).getEntry();
        store.get("k1", true, new ArrayList<>());

        assertEquals(1, first.getAccessCount());
        assertEquals(2, store.snapshot().get(0).getAccessCount());
    }

    @Test
    void testReplacementIsNotCountedAsRemoval() {
        CacheStore<String> store = newStore(10, 1000, 0);
        List<CacheEntry<String>> evicted = new ArrayList<>();

        store.put("k1", "short", "docs/a.md", 1L, evicted);
        store.put("k1", "much longer", "docs/b.md", 2L, evicted);

        assertEquals(1, store.size());
        assertEquals(11, store.totalBytes());
        assertTrue(evicted.isEmpty());
        assertTrue(store.keysForFilePath("docs/a.md").isEmpty());
        assertEquals(Set.of("k1"), store.keysForFilePath("docs/b.md"));
        assertEquals(0, store.statistics().getEvictions());
        assertEquals(0, store.statistics().getInvalidations());
    }

    @Test
    void testExpiredEntryIsRemovedOnRead() {
        CacheStore<String> store = newStore(10, 1000, 100);
        store.put("k1", "hello", "docs/a.md", null, new ArrayList<>());
        ticker.advance(101);

        List<CacheEntry<String>> expired = new ArrayList<>();
        CacheQueryResult<String> result = store.get("k1", true, expired);

        assertFalse(result.isFound());
        assertNull(result.getValue());
        assertEquals(1, expired.size());
        assertEquals("k1", expired.get(0).getKey());
        assertEquals(0, store.size());
        assertEquals(0, store.totalBytes());
        assertTrue(store.keysForFilePath("docs/a.md").isEmpty());
        assertEquals(1, store.statistics().getEvictions());
        assertEquals(1, store.statistics().getMisses());
    }

    @Test
    void testLookupWithoutStatistics() {
        CacheStore<String> store = newStore(10, 1000, 0);
        store.put("k1", "hello", null, null, new ArrayList<>());

        store.get("k1", false, new ArrayList<>());
        store.get("missing", false, new ArrayList<>());

        assertEquals(0, store.statistics().getTotalAccess());
        assertEquals(1, store.snapshot().get(0).getAccessCount());
    }

    @Test
    void testCapacityEvictionReportsVictims() {
        CacheStore<String> store = newStore(2, 1000, 0);
        List<CacheEntry<String>> evicted = new ArrayList<>();

        store.put("k1", "a", null, null, evicted);
        ticker.advance(1);
        store.put("k2", "b", null, null, evicted);
        ticker.advance(1);
        store.put("k3", "c", null, null, evicted);

        assertEquals(1, evicted.size());
        assertEquals("k1", evicted.get(0).getKey());
        assertEquals(List.of("k2", "k3"), store.keys());
        assertEquals(1, store.statistics().getEvictions());
    }

    @Test
    void testEntryCountLimitIsEnforcedBeforeByteLimit() {
        CacheStore<String> store = newStore(2, 10, 0);
        List<CacheEntry<String>> evicted = new ArrayList<>();

        store.put("k1", "aaaa", null, null, evicted);
        ticker.advance(1);
        store.put("k2", "bbbb", null, null, evicted);
        ticker.advance(1);
        // 3 entries and 12 bytes: the count pass removes k1, after which 8 bytes fit
        store.put("k3", "cccc", null, null, evicted);

        assertEquals(1, evicted.size());
        assertEquals("k1", evicted.get(0).getKey());
        assertEquals(8, store.totalBytes());
    }

    @Test
    void testUnsizableValueIsNotStored() {
        CacheLimits limits = new CacheLimits(10, 1000, 0, true, true);
        CacheStore<Object> store = new CacheStore<>(limits, ticker, ByteSizer.defaultSizer(),
                new StatisticsRecorder(limits, ticker.read()), new CapacityEvictionPolicy(limits));

        assertFalse(store.put("k1", 3.14, null, null, new ArrayList<>()));
        assertTrue(store.put("k2", new byte[]{1, 2, 3}, null, null, new ArrayList<>()));

        assertEquals(List.of("k2"), store.keys());
        assertEquals(3, store.totalBytes());
    }

    @Test
    void testNegativeSizeIsRejected() {
        CacheLimits limits = new CacheLimits(10, 1000, 0, true, true);
        CacheStore<String> store = new CacheStore<>(limits, ticker, value -> -1L,
                new StatisticsRecorder(limits, ticker.read()), new CapacityEvictionPolicy(limits));

        assertFalse(store.put("k1", "hello", null, null, new ArrayList<>()));
        assertEquals(0, store.size());
    }

    @Test
    void testRemoveByFilePathUsesFilter() {
        CacheStore<String> store = newStore(10, 1000, 0);
        store.put("k1", "a", "docs/a.md", 1L, new ArrayList<>());
        store.put("k2", "b", "docs/a.md", 2L, new ArrayList<>());
        store.put("k3", "c", "docs/b.md", 1L, new ArrayList<>());

        List<CacheEntry<String>> removed = new ArrayList<>();
        int count = store.removeByFilePath("docs/a.md", e -> e.getSourceFileModifiedAt() == 1L,
                InvalidationReason.FILE_CHANGED, removed);

        assertEquals(1, count);
        assertEquals("k1", removed.get(0).getKey());
        assertEquals(Set.of("k2"), store.keysForFilePath("docs/a.md"));
        assertEquals(1, store.statistics().getInvalidations());
    }

    @Test
    void testRemoveUnknownKey() {
        CacheStore<String> store = newStore(10, 1000, 0);

        assertNull(store.remove("missing", InvalidationReason.MANUAL));
        assertEquals(0, store.statistics().getInvalidations());
    }

    @Test
    void testClearResetsIndexAndBytes() {
        CacheStore<String> store = newStore(10, 1000, 0);
        store.put("k1", "abc", "docs/a.md", null, new ArrayList<>());
        store.put("k2", "de", null, null, new ArrayList<>());

        List<CacheEntry<String>> removed = new ArrayList<>();
        CacheClearResult result = store.clear(InvalidationReason.MANUAL, removed);

        assertEquals(2, result.getBeforeSize());
        assertEquals(5, result.getBeforeByteSize());
        assertEquals(2, result.getClearedCount());
        assertEquals(2, removed.size());
        assertEquals(0, store.size());
        assertEquals(0, store.totalBytes());
        assertTrue(store.keysForFilePath("docs/a.md").isEmpty());
    }

    @Test
    void testSweepExpired() {
        CacheStore<String> store = newStore(10, 1000, 100);
        store.put("old", "a", null, null, new ArrayList<>());
        ticker.advance(80);
        store.put("new", "b", null, null, new ArrayList<>());
        ticker.advance(30);

        List<CacheEntry<String>> expired = new ArrayList<>();
        assertEquals(1, store.sweepExpired(expired));

        assertEquals("old", expired.get(0).getKey());
        assertEquals(List.of("new"), store.keys());
        assertFalse(store.containsKey("old"));
        assertTrue(store.containsKey("new"));
    }

    @Test
    void testContainsKeyIgnoresExpiredEntryWithoutRemovingIt() {
        CacheStore<String> store = newStore(10, 1000, 100);
        store.put("k1", "a", null, null, new ArrayList<>());
        ticker.advance(200);

        assertFalse(store.containsKey("k1"));
        assertEquals(1, store.size());
        assertEquals(0, store.statistics().getTotalAccess());
    }
}
