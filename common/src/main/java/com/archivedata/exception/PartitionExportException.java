package com.archivedata.exception;

import lombok.Getter;

/**
 * A single partition failed to export.  Sibling partitions are not affected.
 */
@Getter
public class PartitionExportException extends ArchiveException {

    private static final long serialVersionUID = 1L;

    private final int partitionIndex;

    public PartitionExportException(int partitionIndex, Throwable cause) {
        super("Export of partition " + partitionIndex + " failed: " + cause.getMessage(), cause);
        this.partitionIndex = partitionIndex;
    }
}
