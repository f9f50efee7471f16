package com.archivedata.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the export-partitions step.
 */
@Data
@NoArgsConstructor
public class ExportOptions {

    /** Directory the {@code <index>-<partition>-documents.jsonl} files are written to. */
    private String directory = ".";

    /** Number of partitions exported at the same time. */
    private int concurrentPartitions = 2;

    /** Documents requested per search page. */
    private int pageSize = 1000;

    /** Partition indices to export; empty means all. Mutually exclusive with {@link #excludePartitions}. */
    private List<Integer> includePartitions = new ArrayList<>();

    /** Partition indices to skip. Mutually exclusive with {@link #includePartitions}. */
    private List<Integer> excludePartitions = new ArrayList<>();
}
