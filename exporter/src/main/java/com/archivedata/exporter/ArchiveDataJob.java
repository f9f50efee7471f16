package com.archivedata.exporter;

import com.archivedata.bound.BoundFinder;
import com.archivedata.bound.Bounds;
import com.archivedata.config.ElasticsearchConfig;
import com.archivedata.config.ExportConfig;
import com.archivedata.elasticsearch.ElasticsearchService;
import com.archivedata.exception.ArchiveException;
import com.archivedata.export.ExportSummary;
import com.archivedata.export.PartitionExporter;
import com.archivedata.model.PartitionFile;
import com.archivedata.partition.PartitionFileStore;
import com.archivedata.partition.PartitionPlanner;
import com.archivedata.search.SearchBackend;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;

/**
 * Entry point of the index archive job.
 *
 * <p>Usage:
 * <pre>
 *   java -jar archive-data-exporter.jar &lt;get-bounds|partition-index|export-partitions&gt; [config-path]
 * </pre>
 *
 * <p>If no config path is supplied, the classpath resource {@code archive-config.yaml} is used.
 * {@code export-partitions} connects to the endpoint and index recorded in the partition file,
 * with the credentials of the configuration.</p>
 */
@Slf4j
public class ArchiveDataJob {

    private static final String DEFAULT_CONFIG = "archive-config.yaml";

    private final Function<ElasticsearchConfig, SearchBackend> backendFactory;
    private final PartitionFileStore partitionFileStore = new PartitionFileStore();
    private final PrintStream out;

    public ArchiveDataJob() {
        this(ElasticsearchService::new, System.out);
    }

    ArchiveDataJob(Function<ElasticsearchConfig, SearchBackend> backendFactory, PrintStream out) {
        this.backendFactory = backendFactory;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new ArchiveDataJob().run(args));
    }

    /**
     * Runs one command.
     *
     * @param args the command name, optionally followed by the path of a YAML config file
     * @return the process exit code
     */
    public int run(String[] args) {
        if (args.length < 1 || args.length > 2) {
            log.error("Usage: <{}> [config-path]", ArchiveCommand.names().replace(", ", "|"));
            return 2;
        }
        try {
            ArchiveCommand command = ArchiveCommand.fromName(args[0]);
            ExportConfig config = loadConfig(args.length > 1 ? args[1] : null);
            execute(command, config);
            return 0;
        } catch (ArchiveException | IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Archive job failed", e);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Archive job interrupted");
            return 1;
        }
    }

    void execute(ArchiveCommand command, ExportConfig config) throws IOException, InterruptedException {
        switch (command) {
            case GET_BOUNDS:
                getBounds(config);
                break;
            case PARTITION_INDEX:
                partitionIndex(config);
                break;
            case EXPORT_PARTITIONS:
                exportPartitions(config);
                break;
            default:
                throw new IllegalStateException("Unhandled command " + command);
        }
    }

    // ── Commands ─────────────────────────────────────────────────────────

    private void getBounds(ExportConfig config) throws IOException {
        requireFieldName(config);
        try (SearchBackend backend = backendFactory.apply(config.getElasticsearch())) {
            Bounds bounds = new BoundFinder(backend).findBounds(config.getFieldName());
            out.println("Lower Bound " + bounds.getLowerBound());
            out.println("Upper Bound " + bounds.getUpperBound());
        }
    }

    private void partitionIndex(ExportConfig config) throws IOException {
        requireFieldName(config);
        Path partitionPath = Paths.get(config.resolvePartitionPath());
        try (SearchBackend backend = backendFactory.apply(config.getElasticsearch())) {
            PartitionFile partitionFile = new PartitionPlanner(backend)
                    .plan(config.getFieldName(), config.getLowerBound(), config.getUpperBound());
            partitionFileStore.write(partitionFile, partitionPath);
        }
        out.println("Wrote partitions to " + partitionPath);
    }

    private void exportPartitions(ExportConfig config) throws IOException, InterruptedException {
        PartitionFile partitionFile = partitionFileStore.read(Paths.get(config.resolvePartitionPath()));
        ElasticsearchConfig target = config.getElasticsearch()
                .withTarget(partitionFile.getEndpoint(), partitionFile.getIndexName());
        try (SearchBackend backend = backendFactory.apply(target)) {
            ExportSummary summary = new PartitionExporter(backend).export(partitionFile, config.getExport());
            out.println("Exported " + summary.getTotalDocumentsWritten() + " documents from "
                    + summary.getResults().size() + " partitions");
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private static ExportConfig loadConfig(String path) throws IOException {
        if (path != null) {
            log.info("Loading configuration from file: {}", path);
            return ExportConfig.load(path);
        }
        log.info("Loading configuration from classpath: {}", DEFAULT_CONFIG);
        return ExportConfig.loadFromClasspath(DEFAULT_CONFIG);
    }

    private static void requireFieldName(ExportConfig config) {
        if (config.getFieldName() == null || config.getFieldName().isBlank()) {
            throw new IllegalArgumentException("fieldName must be configured");
        }
    }
}
