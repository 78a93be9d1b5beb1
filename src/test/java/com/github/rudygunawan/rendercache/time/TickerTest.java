package com.github.rudygunawan.rendercache.time;

import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

import static org.junit.jupiter.api.Assertions.*;

class TickerTest {

    @Test
    void testMonotonicHoldsWhenSourceStepsBack() {
        Deque<Long> readings = new ArrayDeque<>(Arrays.asList(1_000L, 1_500L, 900L, 1_200L, 1_600L));
        Ticker ticker = Ticker.monotonic(readings::poll);

        assertEquals(1_000L, ticker.read());
        assertEquals(1_500L, ticker.read());
        assertEquals(1_500L, ticker.read());
        assertEquals(1_500L, ticker.read());
        assertEquals(1_600L, ticker.read());
    }

    @Test
    void testSystemTickerNeverDecreases() {
        Ticker ticker = Ticker.systemTicker();
        long previous = ticker.read();
        for (int i = 0; i < 10_000; i++) {
            long now = ticker.read();
            assertTrue(now >= previous);
            previous = now;
        }
    }

    @Test
    void testMonotonicRejectsNullSource() {
        assertThrows(NullPointerException.class, () -> Ticker.monotonic(null));
    }
}
