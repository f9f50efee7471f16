package com.archivedata.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Top-level configuration of an archive run.
 *
 * <p>When running inside a Spring Boot application the properties are bound automatically
 * under the {@code archive.*} prefix.  The static {@link #load(String)} and
 * {@link #loadFromClasspath(String)} helpers serve the command-line job and tests.</p>
 */
@Data
@ConfigurationProperties(prefix = "archive")
public class ExportConfig {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ElasticsearchConfig elasticsearch = new ElasticsearchConfig();
    private ExportOptions export = new ExportOptions();

    /** Filterable and sortable field used to bound, partition and order the index. */
    private String fieldName;

    /** Optional lower bound in canonical text form; discovered from the index when absent. */
    private String lowerBound;

    /** Optional upper bound in canonical text form; discovered from the index when absent. */
    private String upperBound;

    /** Partition file location; defaults to {@code <index>-partitions.json}. */
    private String partitionPath;

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML file on disk.
     */
    public static ExportConfig load(String path) throws IOException {
        return YAML_MAPPER.readValue(new File(path), ExportConfig.class);
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static ExportConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = ExportConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, ExportConfig.class);
        }
    }

    // ── Convenience accessors ────────────────────────────────────────────

    public String getIndexName() {
        return elasticsearch.getIndex();
    }

    /**
     * Resolves the partition file path, falling back to {@code <index>-partitions.json}.
     */
    public String resolvePartitionPath() {
        if (partitionPath != null && !partitionPath.isBlank()) {
            return partitionPath;
        }
        return getIndexName() + "-partitions.json";
    }
}
