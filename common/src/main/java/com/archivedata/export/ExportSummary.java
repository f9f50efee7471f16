package com.archivedata.export;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Results of an export run in ascending partition order.
 */
@Data
@AllArgsConstructor
public class ExportSummary {

    private final List<PartitionExportResult> results;

    public long getTotalDocumentsWritten() {
        return results.stream().mapToLong(PartitionExportResult::getDocumentsWritten).sum();
    }
}
