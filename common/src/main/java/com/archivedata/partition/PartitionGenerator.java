package com.archivedata.partition;

import com.archivedata.bound.BoundType;
import com.archivedata.exception.UnsplittablePartitionException;
import com.archivedata.model.Partition;
import com.archivedata.search.RangeFilter;
import com.archivedata.search.SearchBackend;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits {@code [lower, upper]} into contiguous partitions that each hold at most
 * {@code limit} documents, so every partition can be paged through without going past the
 * backend's page-depth limit.
 *
 * <h3>How it works</h3>
 * <ol>
 *   <li>Count the documents of a range.</li>
 *   <li>If the count is within the limit, the range becomes a partition.</li>
 *   <li>Otherwise bisect the range with {@link BoundType#bisect} into {@code [lower, mid)} and
 *       {@code [mid, upper]} and handle both halves the same way.</li>
 * </ol>
 *
 * <p>Ranges are kept on an explicit stack, left half on top, so partitions come out in
 * ascending order without recursion.  All ranges are half-open except the rightmost one,
 * which includes {@code upper} so the maximum value is not lost.</p>
 *
 * <p>The index may change while counts are taken; the result is a best-effort snapshot and a
 * warning is logged when the partitions no longer add up to the first count of the whole range.</p>
 */
@Slf4j
public class PartitionGenerator {

    private final SearchBackend backend;
    private final long limit;

    public PartitionGenerator(SearchBackend backend) {
        this(backend, backend.getPageDepthLimit());
    }

    public PartitionGenerator(SearchBackend backend, long limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Partition limit must be at least 1, got " + limit);
        }
        this.backend = backend;
        this.limit = limit;
    }

    /**
     * Generates the partitions of {@code [lower, upper]}.
     *
     * @return partitions indexed {@code 0..n-1} in ascending order of their bounds
     * @throws UnsplittablePartitionException if a range above the limit cannot be bisected
     */
    public <T> List<Partition> generate(String fieldName, BoundType<T> type, T lower, T upper)
            throws IOException {
        if (type.compare(lower, upper) > 0) {
            throw new IllegalArgumentException("Lower bound " + type.format(lower)
                    + " is greater than upper bound " + type.format(upper));
        }

        Deque<Range<T>> pending = new ArrayDeque<>();
        pending.push(new Range<>(lower, upper, true));

        List<Partition> partitions = new ArrayList<>();
        long wholeRangeCount = -1;
        int countQueries = 0;

        while (!pending.isEmpty()) {
            Range<T> range = pending.pop();
            String lowerText = type.format(range.lower);
            String upperText = type.format(range.upper);
            RangeFilter filter = (range.upperInclusive
                    ? RangeFilter.closed(fieldName, lowerText, upperText)
                    : RangeFilter.halfOpen(fieldName, lowerText, upperText))
                    .withFormat(type.queryFormat());

            long count = backend.count(filter);
            countQueries++;
            if (wholeRangeCount < 0) {
                wholeRangeCount = count;
                log.info("Partitioning {} documents of {} on {}, limit {} per partition",
                        count, backend.getIndexName(), filter, limit);
            }

            if (count <= limit) {
                Partition partition = new Partition(partitions.size(), lowerText, upperText, count);
                partitions.add(partition);
                log.debug("Partition {}: {} with {} documents", partition.getIndex(), filter, count);
                continue;
            }

            T mid = splitPoint(range, type);
            if (mid == null) {
                throw new UnsplittablePartitionException(lowerText, upperText, count, limit);
            }
            log.debug("Splitting {} ({} documents) at {}", filter, count, type.format(mid));
            pending.push(new Range<>(mid, range.upper, range.upperInclusive));
            pending.push(new Range<>(range.lower, mid, false));
        }

        long total = partitions.stream().mapToLong(Partition::getDocumentCount).sum();
        if (total != wholeRangeCount) {
            log.warn("Partitions hold {} documents but the whole range counted {}; "
                    + "the index changed while partitioning", total, wholeRangeCount);
        }
        log.info("Generated {} partitions holding {} documents with {} count queries",
                partitions.size(), total, countQueries);
        return partitions;
    }

    /**
     * Returns the point splitting the range into two strictly smaller ranges, or {@code null}
     * when there is none.
     */
    private static <T> T splitPoint(Range<T> range, BoundType<T> type) {
        if (type.compare(range.lower, range.upper) >= 0) {
            return null;
        }
        T mid = type.bisect(range.lower, range.upper);
        if (type.compare(range.lower, mid) < 0 && type.compare(mid, range.upper) < 0) {
            return mid;
        }
        // adjacent values: only an inclusive tail can still be split, into [lower, upper) and [upper, upper]
        return range.upperInclusive ? range.upper : null;
    }

    private static final class Range<T> {

        private final T lower;
        private final T upper;
        private final boolean upperInclusive;

        private Range(T lower, T upper, boolean upperInclusive) {
            this.lower = lower;
            this.upper = upper;
            this.upperInclusive = upperInclusive;
        }
    }
}
