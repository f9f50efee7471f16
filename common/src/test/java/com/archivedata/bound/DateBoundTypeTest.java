package com.archivedata.bound;

import com.archivedata.exception.InvalidBoundFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DateBoundTypeTest {

    private final DateBoundType type = DateBoundType.INSTANCE;

    @Test
    void formatsAsUtcWithMilliseconds() {
        assertEquals("2024-03-01T10:15:30.000Z", type.format(Instant.parse("2024-03-01T10:15:30Z")));
        assertEquals("2024-03-01T10:15:30.123Z", type.format(Instant.parse("2024-03-01T10:15:30.123Z")));
    }

    @Test
    void parsesOffsetsBareDatesAndLocalDateTimes() {
        assertEquals(Instant.parse("2024-03-01T08:15:30Z"), type.parse("2024-03-01T10:15:30+02:00"));
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), type.parse("2024-03-01"));
        assertEquals(Instant.parse("2024-03-01T10:15:00Z"), type.parse("2024-03-01T10:15"));
    }

    @Test
    void truncatesToMilliseconds() {
        assertEquals(Instant.parse("2024-03-01T10:15:30.123Z"), type.parse("2024-03-01T10:15:30.123456789Z"));
    }

    @Test
    void canonicalFormParsesBackToTheSameInstant() {
        Instant value = Instant.parse("1999-12-31T23:59:59.999Z");
        assertEquals(value, type.parse(type.format(value)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "yesterday", "2024-13-01", "2024-03-01T25:00:00Z", "1709287200000"})
    void rejectsMalformedBounds(String text) {
        assertThrows(InvalidBoundFormatException.class, () -> type.parse(text));
    }

    @Test
    void readsSortValuesAsEpochMillis() {
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), type.fromSortValue(1_700_000_000_000L));
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), type.fromSortValue("1700000000000"));
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), type.fromSortValue("2024-03-01T00:00:00Z"));
        assertThrows(InvalidBoundFormatException.class, () -> type.fromSortValue(true));
    }

    @Test
    void rangeQueriesReadCanonicalDatesWhateverTheMappingFormat() {
        assertEquals("strict_date_optional_time||epoch_millis", type.queryFormat());
    }

    @Test
    void bisectsOnMilliseconds() {
        Instant lower = Instant.parse("2024-01-01T00:00:00Z");
        Instant upper = Instant.parse("2024-01-03T00:00:00Z");
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), type.bisect(lower, upper));

        Instant adjacent = lower.plusMillis(1);
        assertEquals(lower, type.bisect(lower, adjacent));
        assertEquals(lower, type.bisect(lower, lower));
    }
}
