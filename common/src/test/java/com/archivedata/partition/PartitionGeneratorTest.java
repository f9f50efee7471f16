package com.archivedata.partition;

import com.archivedata.bound.DateBoundType;
import com.archivedata.bound.LongBoundType;
import com.archivedata.exception.UnsplittablePartitionException;
import com.archivedata.model.Partition;
import com.archivedata.search.InMemorySearchBackend;
import com.archivedata.search.RangeFilter;
import com.archivedata.search.TestDocuments;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class PartitionGeneratorTest {

    private static final DateBoundType DATES = DateBoundType.INSTANCE;

    @Test
    void quarterMillionDocumentsOverTenDaysSplitIntoPartitionsUnderTheLimit() throws Exception {
        List<Instant> timestamps = TestDocuments.timestampsOverDays(250_000, 10, 42L);
        var backend = InMemorySearchBackend.ofTimestamps("timestamp", timestamps, 100_000);
        Instant lower = timestamps.stream().min(Instant::compareTo).orElseThrow();
        Instant upper = timestamps.stream().max(Instant::compareTo).orElseThrow();

        List<Partition> partitions = new PartitionGenerator(backend).generate("timestamp", DATES, lower, upper);

        assertTrue(partitions.size() >= 3, "expected at least 3 partitions, got " + partitions.size());
        assertCoversWithoutGapsOrOverlaps(partitions, DATES.format(lower), DATES.format(upper));
        partitions.forEach(p -> assertTrue(p.getDocumentCount() <= 100_000, "partition over limit: " + p));
        assertEquals(250_000, partitions.stream().mapToLong(Partition::getDocumentCount).sum());
    }

    @Test
    void countsMatchTheDocumentsActuallyInEachRange() throws Exception {
        List<Instant> timestamps = TestDocuments.timestampsOverDays(5_000, 3, 7L);
        var backend = InMemorySearchBackend.ofTimestamps("timestamp", timestamps, 700);
        Instant lower = timestamps.stream().min(Instant::compareTo).orElseThrow();
        Instant upper = timestamps.stream().max(Instant::compareTo).orElseThrow();

        List<Partition> partitions = new PartitionGenerator(backend).generate("timestamp", DATES, lower, upper);

        Set<Object> seen = new HashSet<>();
        for (Partition p : partitions) {
            boolean last = p.getIndex() == partitions.size() - 1;
            RangeFilter filter = new RangeFilter("timestamp", p.getLowerBound(), p.getUpperBound(), last);
            List<Map<String, Object>> docs = backend.matching(filter);
            assertEquals(p.getDocumentCount(), docs.size());
            docs.forEach(d -> assertTrue(seen.add(d.get("id")), "document in two partitions: " + d));
        }
        assertEquals(5_000, seen.size());
    }

    @Test
    void rangeWithinTheLimitIsASinglePartitionAfterOneCount() throws Exception {
        var backend = InMemorySearchBackend.ofLongs("seq", LongStream.rangeClosed(1, 50).boxed().toList(), 100);

        List<Partition> partitions = new PartitionGenerator(backend).generate("seq", LongBoundType.INSTANCE, 1L, 50L);

        assertEquals(1, partitions.size());
        assertEquals(new Partition(0, "1", "50", 50), partitions.get(0));
        assertEquals(1, backend.getCountCalls());
    }

    @Test
    void inclusiveUpperBoundKeepsTheMaximumValue() throws Exception {
        // 1..8 with limit 1 forces single-value partitions; the last one is [8, 8]
        var backend = InMemorySearchBackend.ofLongs("seq", LongStream.rangeClosed(1, 8).boxed().toList(), 1);

        List<Partition> partitions = new PartitionGenerator(backend).generate("seq", LongBoundType.INSTANCE, 1L, 8L);

        assertEquals(8, partitions.size());
        assertEquals(8, partitions.stream().mapToLong(Partition::getDocumentCount).sum());
        Partition last = partitions.get(partitions.size() - 1);
        assertEquals("8", last.getLowerBound());
        assertEquals("8", last.getUpperBound());
        assertEquals(1, last.getDocumentCount());
        assertCoversWithoutGapsOrOverlaps(partitions, "1", "8");
    }

    @Test
    void emptySubRangesAreKeptSoCoverageHasNoGaps() throws Exception {
        var backend = InMemorySearchBackend.ofLongs("seq", List.of(0L, 0L, 1L, 1000L, 1000L), 2);

        List<Partition> partitions = new PartitionGenerator(backend).generate("seq", LongBoundType.INSTANCE, 0L, 1000L);

        assertCoversWithoutGapsOrOverlaps(partitions, "0", "1000");
        assertEquals(5, partitions.stream().mapToLong(Partition::getDocumentCount).sum());
        assertTrue(partitions.stream().anyMatch(p -> p.getDocumentCount() == 0));
    }

    @Test
    void bisectionTerminatesInLogarithmicallyManySteps() throws Exception {
        // 4096 documents on distinct values; every count query either emits or splits
        var backend = InMemorySearchBackend.ofLongs("seq", LongStream.range(0, 4096).boxed().toList(), 16);

        List<Partition> partitions = new PartitionGenerator(backend).generate("seq", LongBoundType.INSTANCE, 0L, 4095L);

        partitions.forEach(p -> assertTrue(p.getDocumentCount() <= 16));
        // a binary tree with n leaves has 2n - 1 nodes
        assertEquals(2 * partitions.size() - 1, backend.getCountCalls());
        assertTrue(partitions.size() <= 512, "too many partitions: " + partitions.size());
    }

    @Test
    void singleValueOverTheLimitIsUnsplittable() {
        Instant value = Instant.parse("2024-05-05T05:05:05Z");
        var backend = InMemorySearchBackend.ofTimestamps("timestamp", TestDocuments.sameTimestamp(11, value), 10);

        UnsplittablePartitionException e = assertThrows(UnsplittablePartitionException.class,
                () -> new PartitionGenerator(backend).generate("timestamp", DATES, value, value));

        assertEquals(DATES.format(value), e.getLowerBound());
        assertEquals(DATES.format(value), e.getUpperBound());
        assertEquals(11, e.getDocumentCount());
        assertEquals(1, backend.getCountCalls());
    }

    @Test
    void clusterOfEqualValuesInsideAWideRangeIsUnsplittable() {
        Instant crowded = Instant.parse("2024-01-02T00:00:00Z");
        List<Instant> timestamps = new ArrayList<>(TestDocuments.sameTimestamp(20, crowded));
        timestamps.add(Instant.parse("2024-01-01T00:00:00Z"));
        timestamps.add(Instant.parse("2024-01-10T00:00:00Z"));
        var backend = InMemorySearchBackend.ofTimestamps("timestamp", timestamps, 10);

        UnsplittablePartitionException e = assertThrows(UnsplittablePartitionException.class,
                () -> new PartitionGenerator(backend).generate("timestamp", DATES,
                        Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-10T00:00:00Z")));

        assertEquals(20, e.getDocumentCount());
        assertEquals(DATES.format(crowded), e.getLowerBound());
    }

    @Test
    void rejectsInvertedBounds() {
        var backend = InMemorySearchBackend.ofLongs("seq", List.of(1L), 10);

        assertThrows(IllegalArgumentException.class,
                () -> new PartitionGenerator(backend).generate("seq", LongBoundType.INSTANCE, 5L, 1L));
        assertEquals(0, backend.getCountCalls());
    }

    static void assertCoversWithoutGapsOrOverlaps(List<Partition> partitions, String lower, String upper) {
        assertFalse(partitions.isEmpty());
        assertEquals(lower, partitions.get(0).getLowerBound());
        assertEquals(upper, partitions.get(partitions.size() - 1).getUpperBound());
        for (int i = 0; i < partitions.size(); i++) {
            assertEquals(i, partitions.get(i).getIndex());
            if (i > 0) {
                assertEquals(partitions.get(i - 1).getUpperBound(), partitions.get(i).getLowerBound(),
                        "gap or overlap between partitions " + (i - 1) + " and " + i + ": "
                                + partitions.stream().map(Partition::toString).collect(Collectors.joining("\n")));
            }
        }
    }
}
