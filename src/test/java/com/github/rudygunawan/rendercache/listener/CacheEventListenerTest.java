package com.github.rudygunawan.rendercache.listener;

import com.github.rudygunawan.rendercache.api.RenderCache;
import com.github.rudygunawan.rendercache.builder.RenderCacheBuilder;
import com.github.rudygunawan.rendercache.model.CacheKeyParams;
import com.github.rudygunawan.rendercache.model.InvalidationEvent;
import com.github.rudygunawan.rendercache.policy.InvalidationReason;
import com.github.rudygunawan.rendercache.time.FakeTicker;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CacheEventListenerTest {

    private static final CacheKeyParams INTRO = CacheKeyParams.of("# Intro", "docs/intro.md");

    @Test
    void testThrowingListenerDoesNotStopOthers() {
        List<InvalidationEvent> received = new CopyOnWriteArrayList<>();
        RenderCache<String> cache = RenderCacheBuilder.newBuilder()
                .listener(event -> {
                    throw new IllegalStateException("listener bug");
                })
                .listener(received::add)
                .build();
        String key = cache.put(INTRO, "intro", null);

        assertTrue(cache.invalidate(key));

        assertEquals(1, received.size());
        assertFalse(cache.containsKey(key));
    }

    @Test
    void testEventCarriesRemovedEntrySnapshot() {
        FakeTicker ticker = new FakeTicker();
        List<InvalidationEvent> received = new CopyOnWriteArrayList<>();
        RenderCache<String> cache = RenderCacheBuilder.newBuilder()
                .ticker(ticker)
                .listener(received::add)
                .build();
        String key = cache.put(INTRO, "intro", 7L);
        ticker.advance(25);

        cache.invalidate(key);

        InvalidationEvent event = received.get(0);
        assertEquals(key, event.getKey());
        assertEquals(List.of(key), event.getKeys());
        assertEquals(InvalidationReason.MANUAL, event.getReason());
        assertEquals(ticker.read(), event.getTimestamp());
        assertFalse(event.isSummary());
        assertEquals("intro", event.getEntry().getValue());
        assertEquals("docs/intro.md", event.getEntry().getSourceFilePath());
        assertEquals(Long.valueOf(7L), event.getEntry().getSourceFileModifiedAt());
    }

    @Test
    void testListenerRegistrationAtRuntime() {
        RenderCache<String> cache = RenderCacheBuilder.newBuilder().build();
        AtomicInteger calls = new AtomicInteger();
        CacheEventListener listener = event -> calls.incrementAndGet();

        cache.addListener(listener);
        cache.invalidate(cache.put(INTRO, "intro", null));
        assertTrue(cache.removeListener(listener));
        cache.invalidate(cache.put(INTRO, "intro", null));

        assertEquals(1, calls.get());
        assertFalse(cache.removeListener(listener));
    }

    @Test
    void testListenerMayUseTheCache() {
        RenderCache<String> cache = RenderCacheBuilder.newBuilder().build();
        CacheKeyParams other = CacheKeyParams.of("# Other", "docs/other.md");
        cache.addListener(event -> cache.put(other, "re-rendered", null));

        cache.invalidate(cache.put(INTRO, "intro", null));

        assertTrue(cache.peek(other).isHit());
    }

    @Test
    void testEachRemovalNotifiedOnce() {
        List<InvalidationEvent> received = new CopyOnWriteArrayList<>();
        RenderCache<String> cache = RenderCacheBuilder.newBuilder()
                .listener(received::add)
                .build();
        String key = cache.put(INTRO, "intro", 1L);

        cache.invalidate(key);
        cache.invalidate(key);
        cache.invalidateByFilePath("docs/intro.md");
        cache.clear();

        assertEquals(1, received.size());
    }
}
