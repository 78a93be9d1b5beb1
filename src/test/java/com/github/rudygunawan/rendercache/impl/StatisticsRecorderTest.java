package com.github.rudygunawan.rendercache.impl;

import com.github.rudygunawan.rendercache.model.CacheHealthStatus;
import com.github.rudygunawan.rendercache.model.CacheLimits;
import com.github.rudygunawan.rendercache.model.CacheStatistics;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsRecorderTest {

    private static final CacheLimits LIMITS = new CacheLimits(10, 1000, 0, true, true);

    @Test
    void testCountersAndSnapshot() {
        StatisticsRecorder recorder = new StatisticsRecorder(LIMITS, 100);

        recorder.recordHit(110);
        recorder.recordHit(120);
        recorder.recordMiss(130);
        recorder.recordEvictions(2, 140);
        recorder.recordInvalidations(3, 150);

        CacheStatistics stats = recorder.snapshot(4, 400);
        assertEquals(2, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(3, stats.getTotalAccess());
        assertEquals(2.0 / 3, stats.getHitRate(), 0.0001);
        assertEquals(2, stats.getEvictions());
        assertEquals(3, stats.getInvalidations());
        assertEquals(4, stats.getCurrentEntryCount());
        assertEquals(400, stats.getCurrentTotalBytes());
        assertEquals(10, stats.getMaxEntries());
        assertEquals(1000, stats.getMaxTotalBytes());
        assertEquals(100, stats.getCreatedAt());
        assertEquals(150, stats.getLastUpdatedAt());
    }

    @Test
    void testLastUpdatedNeverMovesBackwards() {
        StatisticsRecorder recorder = new StatisticsRecorder(LIMITS, 100);

        recorder.touch(200);
        recorder.recordHit(150);

        assertEquals(200, recorder.snapshot(0, 0).getLastUpdatedAt());
    }

    @Test
    void testDisabledRecorderCountsNothing() {
        StatisticsRecorder recorder = new StatisticsRecorder(new CacheLimits(10, 1000, 0, true, false), 0);

        recorder.recordHit(1);
        recorder.recordMiss(2);
        recorder.recordEvictions(1, 3);
        recorder.recordInvalidations(1, 4);

        CacheStatistics stats = recorder.snapshot(0, 0);
        assertEquals(0, stats.getTotalAccess());
        assertEquals(0, stats.getEvictions());
        assertEquals(0, stats.getInvalidations());
        assertEquals(0.0, stats.getHitRate());
        assertEquals(4, stats.getLastUpdatedAt());
    }

    @Test
    void testReset() {
        StatisticsRecorder recorder = new StatisticsRecorder(LIMITS, 0);
        recorder.recordHit(1);
        recorder.recordEvictions(5, 2);

        recorder.reset(3);

        assertEquals(0, recorder.hitCount());
        assertEquals(0, recorder.missCount());
        assertEquals(0, recorder.evictionCount());
        assertEquals(0, recorder.invalidationCount());
        assertTrue(recorder.healthStatus(0, 0).isHealthy());
    }

    @Test
    void testHealthyWithinLimits() {
        StatisticsRecorder recorder = new StatisticsRecorder(LIMITS, 0);
        recorder.recordHit(1);
        recorder.recordMiss(2);

        CacheHealthStatus health = recorder.healthStatus(5, 500);

        assertTrue(health.isHealthy());
        assertTrue(health.getErrors().isEmpty());
        assertTrue(health.getWarnings().isEmpty());
        assertEquals(0.5, health.getUtilization(), 0.0001);
        assertEquals(0.5, health.getMemoryUtilization(), 0.0001);
        assertEquals(0.5, health.getHitRate(), 0.0001);
    }

    @Test
    void testWarningAboveNinetyPercent() {
        StatisticsRecorder recorder = new StatisticsRecorder(LIMITS, 0);

        CacheHealthStatus full = recorder.healthStatus(10, 950);

        assertTrue(full.isHealthy());
        assertEquals(2, full.getWarnings().size());
        assertTrue(full.getWarnings().get(0).contains("100.0%"));
        assertTrue(full.getWarnings().get(1).contains("95.0%"));
    }

    @Test
    void testErrorAboveLimit() {
        StatisticsRecorder recorder = new StatisticsRecorder(LIMITS, 0);

        CacheHealthStatus over = recorder.healthStatus(11, 1001);

        assertFalse(over.isHealthy());
        assertEquals(2, over.getErrors().size());
        assertTrue(over.getErrors().get(0).contains("maxEntries"));
        assertTrue(over.getErrors().get(1).contains("maxTotalBytes"));
        assertTrue(over.getWarnings().isEmpty());
    }

    @Test
    void testCountersStayConsistentUnderConcurrency() throws Exception {
        StatisticsRecorder recorder = new StatisticsRecorder(LIMITS, 0);
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            final boolean hits = t % 2 == 0;
            threads.add(new Thread(() -> {
                for (int i = 0; i < 10_000; i++) {
                    if (hits) {
                        recorder.recordHit(i);
                    } else {
                        recorder.recordMiss(i);
                    }
                }
            }));
        }
        for (Thread thread : threads) {
            thread.start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        assertEquals(20_000, recorder.hitCount());
        assertEquals(20_000, recorder.missCount());
        assertTrue(recorder.healthStatus(0, 0).isHealthy());
    }
}
