package com.archivedata.exception;

/**
 * Thrown when both an inclusion and an exclusion list of partitions are supplied.
 */
public class ConflictingSelectionException extends ArchiveException {

    private static final long serialVersionUID = 1L;

    public ConflictingSelectionException() {
        super("Only pass either includePartitions or excludePartitions, not both");
    }
}
