package com.archivedata.exception;

import lombok.Getter;

/**
 * Thrown when a range holds more documents than the page-depth limit but can no longer be
 * bisected, i.e. too many documents share (nearly) the same value of the ordering field.
 */
@Getter
public class UnsplittablePartitionException extends ArchiveException {

    private static final long serialVersionUID = 1L;

    private final String lowerBound;
    private final String upperBound;
    private final long documentCount;
    private final long limit;

    public UnsplittablePartitionException(String lowerBound, String upperBound,
                                          long documentCount, long limit) {
        super("Range [" + lowerBound + ", " + upperBound + "] holds " + documentCount
                + " documents, more than the limit of " + limit + ", and cannot be split further");
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.documentCount = documentCount;
        this.limit = limit;
    }
}
