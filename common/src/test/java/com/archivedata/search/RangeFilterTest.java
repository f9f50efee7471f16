package com.archivedata.search;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RangeFilterTest {

    @Test
    void halfOpenRangeUsesLessThan() {
        Map<String, Object> query = RangeFilter.halfOpen("ts", "a", "b").toQuery();

        assertEquals(Map.of("range", Map.of("ts", Map.of("gte", "a", "lt", "b"))), query);
    }

    @Test
    void closedRangeUsesLessThanOrEqual() {
        Map<String, Object> query = RangeFilter.closed("ts", "a", "b").toQuery();

        assertEquals(Map.of("range", Map.of("ts", Map.of("gte", "a", "lte", "b"))), query);
    }

    @Test
    void formatIsSentWithTheRange() {
        Map<String, Object> query = RangeFilter.halfOpen("ts", "a", "b").withFormat("epoch_millis").toQuery();

        assertEquals(Map.of("range", Map.of("ts", Map.of("gte", "a", "lt", "b", "format", "epoch_millis"))), query);
        assertEquals("ts:[a, b)", RangeFilter.halfOpen("ts", "a", "b").withFormat("epoch_millis").toString());
    }

    @Test
    void unboundedFilterMatchesEverything() {
        assertEquals(Map.of("match_all", Map.of()), RangeFilter.all("ts").toQuery());
        assertEquals("ts:*", RangeFilter.all("ts").toString());
    }

    @Test
    void describesItsBounds() {
        assertEquals("ts:[1, 5)", RangeFilter.halfOpen("ts", "1", "5").toString());
        assertEquals("ts:[1, 5]", RangeFilter.closed("ts", "1", "5").toString());
    }
}
