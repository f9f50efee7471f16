package com.archivedata.export;

import com.archivedata.bound.BoundType;
import com.archivedata.bound.BoundTypes;
import com.archivedata.config.ExportOptions;
import com.archivedata.exception.ExportFailedException;
import com.archivedata.exception.PartitionExportException;
import com.archivedata.model.Partition;
import com.archivedata.model.PartitionFile;
import com.archivedata.search.RangeFilter;
import com.archivedata.search.SearchBackend;
import com.archivedata.search.SortDirection;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exports the documents of selected partitions to one JSON Lines file per partition.
 *
 * <h3>How it works</h3>
 * <ol>
 *   <li>The selection, the options and every bound of the plan are validated before any
 *       document is requested.</li>
 *   <li>A fixed pool of {@code concurrentPartitions} workers takes partitions off the queue.</li>
 *   <li>A worker pages through its partition sorted ascending by the ordering field, at offsets
 *       {@code 0, P, 2P, ...}, and appends every document as one JSON line, in page order.
 *       It stops at a short page or once the partition's recorded count is reached.</li>
 *   <li>A failed partition does not stop the others.  After every partition has finished, the
 *       failures are raised together as an {@link ExportFailedException}.</li>
 * </ol>
 *
 * <p>Each page asks for at most {@code documentCount - offset} documents, so a query never
 * reaches deeper than the partition's count, which the plan keeps within the page-depth limit.
 * Re-exporting a partition overwrites its file.</p>
 */
@Slf4j
public class PartitionExporter {

    private final SearchBackend backend;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PartitionExporter(SearchBackend backend) {
        this.backend = backend;
    }

    /**
     * Name of the output file of a partition: {@code <index>-<partition>-documents.jsonl}.
     */
    public static String outputFileName(String indexName, int partitionIndex) {
        return indexName + "-" + partitionIndex + "-documents.jsonl";
    }

    /**
     * Exports the partitions selected by {@code options}.
     *
     * @throws com.archivedata.exception.ConflictingSelectionException if both include and exclude lists are set
     * @throws com.archivedata.exception.InvalidBoundFormatException if a bound of the plan is malformed
     * @throws ExportFailedException if one or more partitions failed; the others are still exported
     */
    public ExportSummary export(PartitionFile partitionFile, ExportOptions options)
            throws IOException, InterruptedException {
        if (options.getPageSize() < 1) {
            throw new IllegalArgumentException("Page size must be at least 1, got " + options.getPageSize());
        }
        if (options.getConcurrentPartitions() < 1) {
            throw new IllegalArgumentException("Concurrent partitions must be at least 1, got "
                    + options.getConcurrentPartitions());
        }
        List<Partition> selected = PartitionSelection.resolve(partitionFile,
                options.getIncludePartitions(), options.getExcludePartitions());
        BoundType<?> type = boundType(partitionFile);
        checkBounds(partitionFile, type);
        String queryFormat = type.queryFormat();

        Path directory = Paths.get(options.getDirectory());
        Files.createDirectories(directory);

        log.info("Exporting {} of {} partitions of {} to {} with {} concurrent partitions, page size {}",
                selected.size(), partitionFile.getPartitions().size(), partitionFile.getIndexName(),
                directory, options.getConcurrentPartitions(), options.getPageSize());

        ExecutorService pool = Executors.newFixedThreadPool(options.getConcurrentPartitions(), workerThreadFactory());
        Map<Partition, Future<PartitionExportResult>> futures = new LinkedHashMap<>();
        try {
            for (Partition partition : selected) {
                futures.put(partition, pool.submit(() ->
                        exportPartition(partitionFile, partition, directory, options.getPageSize(), queryFormat)));
            }

            List<PartitionExportResult> results = new ArrayList<>();
            List<PartitionExportException> failures = new ArrayList<>();
            for (Map.Entry<Partition, Future<PartitionExportResult>> entry : futures.entrySet()) {
                try {
                    results.add(entry.getValue().get());
                } catch (ExecutionException e) {
                    failures.add(asPartitionFailure(entry.getKey(), e.getCause()));
                }
            }

            if (!failures.isEmpty()) {
                failures.sort(Comparator.comparingInt(PartitionExportException::getPartitionIndex));
                failures.forEach(f -> log.error("Partition {} failed", f.getPartitionIndex(), f.getCause()));
                throw new ExportFailedException(failures);
            }

            results.sort(Comparator.comparingInt(PartitionExportResult::getPartitionIndex));
            ExportSummary summary = new ExportSummary(results);
            log.info("Exported {} documents from {} partitions", summary.getTotalDocumentsWritten(), results.size());
            return summary;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Pages through a single partition and writes it to its output file.
     */
    PartitionExportResult exportPartition(PartitionFile partitionFile, Partition partition,
                                          Path directory, int pageSize, String queryFormat) {
        String fieldName = partitionFile.getFieldName();
        RangeFilter filter = (partitionFile.isLast(partition)
                ? RangeFilter.closed(fieldName, partition.getLowerBound(), partition.getUpperBound())
                : RangeFilter.halfOpen(fieldName, partition.getLowerBound(), partition.getUpperBound()))
                .withFormat(queryFormat);
        Path output = directory.resolve(outputFileName(partitionFile.getIndexName(), partition.getIndex()));
        long expected = partition.getDocumentCount();

        log.info("Starting partition {}: {} ({} documents) -> {}", partition.getIndex(), filter, expected, output);

        long written = 0;
        int pages = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            long offset = 0;
            while (offset < expected) {
                int top = (int) Math.min(pageSize, expected - offset);
                List<Map<String, Object>> page = backend.query(filter, fieldName, SortDirection.ASC, (int) offset, top);
                pages++;
                for (Map<String, Object> document : page) {
                    writer.write(objectMapper.writeValueAsString(document));
                    writer.write('\n');
                }
                written += page.size();
                log.debug("Partition {}: page at offset {} returned {} documents", partition.getIndex(), offset, page.size());

                if (page.size() < top) {
                    break;
                }
                offset += top;
            }
        } catch (IOException | RuntimeException e) {
            throw new PartitionExportException(partition.getIndex(), e);
        }

        if (written != expected) {
            log.warn("Partition {} wrote {} documents but {} were counted when it was generated",
                    partition.getIndex(), written, expected);
        }
        log.info("Completed partition {}: {} documents in {} pages", partition.getIndex(), written, pages);
        return new PartitionExportResult(partition.getIndex(), output, written, pages);
    }

    private BoundType<?> boundType(PartitionFile partitionFile) throws IOException {
        if (partitionFile.getFieldType() != null) {
            return BoundTypes.forType(partitionFile.getFieldName(), partitionFile.getFieldType());
        }
        // partition files written without the field type
        return BoundTypes.forField(partitionFile.getFieldName(),
                backend.describeField(partitionFile.getFieldName()));
    }

    /**
     * Parses every bound of the plan.
     *
     * @throws com.archivedata.exception.InvalidBoundFormatException for a malformed bound
     * @throws IllegalArgumentException for a partition whose lower bound is above its upper bound
     */
    private static <T> void checkBounds(PartitionFile partitionFile, BoundType<T> type) {
        for (Partition partition : partitionFile.getPartitions()) {
            T lower = type.parse(partition.getLowerBound());
            T upper = type.parse(partition.getUpperBound());
            if (type.compare(lower, upper) > 0) {
                throw new IllegalArgumentException("Partition " + partition.getIndex() + " has lower bound "
                        + partition.getLowerBound() + " above its upper bound " + partition.getUpperBound());
            }
        }
    }

    private static PartitionExportException asPartitionFailure(Partition partition, Throwable cause) {
        if (cause instanceof PartitionExportException) {
            return (PartitionExportException) cause;
        }
        return new PartitionExportException(partition.getIndex(), cause);
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "archive-export-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
