package com.archivedata.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A contiguous range of the ordering field holding few enough documents to be paged through
 * without exceeding the page-depth limit.
 *
 * <p>Bounds are kept in their canonical text form.  The range is {@code [lowerBound, upperBound)},
 * except for the last partition of a {@link PartitionFile}, whose upper bound is inclusive.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Partition {

    private int index;
    private String lowerBound;
    private String upperBound;

    /** Documents counted in the range when the partition was generated. */
    private long documentCount;
}
