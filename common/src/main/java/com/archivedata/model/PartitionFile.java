package com.archivedata.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The persisted partition plan of an index: where it lives, the field it was partitioned on
 * and the ordered partitions.  Written once by partition-index, read-only afterwards.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PartitionFile {

    private String endpoint;
    private String indexName;
    private String fieldName;

    /** Backend type of {@link #fieldName}, used to read the bounds back. */
    private String fieldType;
    private long totalDocumentCount;
    @Builder.Default
    private List<Partition> partitions = new ArrayList<>();

    /**
     * Whether the given partition is the last one of the plan and therefore includes its
     * upper bound.
     */
    public boolean isLast(Partition partition) {
        return partitions.stream().mapToInt(Partition::getIndex).max().orElse(-1) == partition.getIndex();
    }
}
