package com.archivedata.partition;

import com.archivedata.bound.BoundFinder;
import com.archivedata.bound.BoundType;
import com.archivedata.bound.BoundTypes;
import com.archivedata.model.Partition;
import com.archivedata.model.PartitionFile;
import com.archivedata.search.FieldDescriptor;
import com.archivedata.search.SearchBackend;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;

/**
 * Builds the partition plan of an index: validates the ordering field, resolves the bounds
 * (user-supplied or discovered) and runs the {@link PartitionGenerator}.
 *
 * <p>User-supplied bounds are parsed before any count or search request is made, so a
 * malformed bound fails fast.</p>
 */
@Slf4j
public class PartitionPlanner {

    private final SearchBackend backend;
    private final BoundFinder boundFinder;
    private final PartitionGenerator generator;

    public PartitionPlanner(SearchBackend backend) {
        this(backend, new BoundFinder(backend), new PartitionGenerator(backend));
    }

    public PartitionPlanner(SearchBackend backend, BoundFinder boundFinder, PartitionGenerator generator) {
        this.backend = backend;
        this.boundFinder = boundFinder;
        this.generator = generator;
    }

    /**
     * @param lowerBound canonical lower bound, or {@code null}/blank to use the smallest value in the index
     * @param upperBound canonical upper bound, or {@code null}/blank to use the largest value in the index
     */
    public PartitionFile plan(String fieldName, String lowerBound, String upperBound) throws IOException {
        FieldDescriptor descriptor = backend.describeField(fieldName);
        BoundType<?> type = BoundTypes.forField(fieldName, descriptor);
        return plan(fieldName, descriptor.getType(), type, lowerBound, upperBound);
    }

    private <T> PartitionFile plan(String fieldName, String fieldType, BoundType<T> type,
                                   String lowerText, String upperText)
            throws IOException {
        T lower = isBlank(lowerText) ? null : type.parse(lowerText);
        T upper = isBlank(upperText) ? null : type.parse(upperText);

        if (lower == null) {
            lower = boundFinder.findLowerBound(fieldName, type);
        }
        if (upper == null) {
            upper = boundFinder.findUpperBound(fieldName, type);
        }
        log.info("Partitioning {} on {} between {} and {}", backend.getIndexName(), fieldName,
                type.format(lower), type.format(upper));

        List<Partition> partitions = generator.generate(fieldName, type, lower, upper);
        return PartitionFile.builder()
                .endpoint(backend.getEndpoint())
                .indexName(backend.getIndexName())
                .fieldName(fieldName)
                .fieldType(fieldType)
                .totalDocumentCount(partitions.stream().mapToLong(Partition::getDocumentCount).sum())
                .partitions(partitions)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
