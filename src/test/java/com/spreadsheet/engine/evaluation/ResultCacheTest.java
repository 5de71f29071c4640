package com.spreadsheet.engine.evaluation;

import com.spreadsheet.engine.values.NumberValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultCacheTest {

    private MutableClock clock;
    private ResultCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        cache = new ResultCache(Duration.ofSeconds(5), clock);
    }

    @Test
    void testEntryIsServedWithinTtl() {
        cache.put("A1", NumberValue.of(3));
        clock.advance(Duration.ofSeconds(4));
        assertEquals(NumberValue.of(3), cache.get("A1"));
    }

    @Test
    void testEntryExpiresAfterTtl() {
        cache.put("A1", NumberValue.of(3));
        clock.advance(Duration.ofSeconds(6));
        assertNull(cache.get("A1"));
        assertEquals(0, cache.size());
    }

    @Test
    void testInvalidate() {
        cache.put("A1", NumberValue.of(1));
        cache.put("B1", NumberValue.of(2));
        cache.put("C1", NumberValue.of(3));

        cache.invalidate("A1");
        cache.invalidateAll(List.of("B1"));

        assertNull(cache.get("A1"));
        assertNull(cache.get("B1"));
        assertEquals(NumberValue.of(3), cache.get("C1"));

        cache.clear();
        assertEquals(0, cache.size());
    }
}
