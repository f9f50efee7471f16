package com.archivedata.export;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

/**
 * Outcome of one successfully exported partition.
 */
@Data
@AllArgsConstructor
public class PartitionExportResult {

    private final int partitionIndex;
    private final Path outputFile;
    private final long documentsWritten;
    private final int pagesRequested;
}
