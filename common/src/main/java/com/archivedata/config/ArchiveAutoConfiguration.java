package com.archivedata.config;

import com.archivedata.bound.BoundFinder;
import com.archivedata.elasticsearch.ElasticsearchService;
import com.archivedata.export.PartitionExporter;
import com.archivedata.partition.PartitionFileStore;
import com.archivedata.partition.PartitionGenerator;
import com.archivedata.partition.PartitionPlanner;
import com.archivedata.search.SearchBackend;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration that wires the export engine for applications embedding it.
 *
 * <p>The {@link SearchBackend} points at {@code archive.elasticsearch.*}; the engine beans
 * all share it.</p>
 */
@Configuration
@EnableConfigurationProperties(ExportConfig.class)
public class ArchiveAutoConfiguration {

    @Bean
    public SearchBackend searchBackend(ExportConfig config) {
        return new ElasticsearchService(config.getElasticsearch());
    }

    @Bean
    public BoundFinder boundFinder(SearchBackend searchBackend) {
        return new BoundFinder(searchBackend);
    }

    @Bean
    public PartitionGenerator partitionGenerator(SearchBackend searchBackend) {
        return new PartitionGenerator(searchBackend);
    }

    @Bean
    public PartitionPlanner partitionPlanner(SearchBackend searchBackend, BoundFinder boundFinder,
                                             PartitionGenerator partitionGenerator) {
        return new PartitionPlanner(searchBackend, boundFinder, partitionGenerator);
    }

    @Bean
    public PartitionFileStore partitionFileStore() {
        return new PartitionFileStore();
    }

    @Bean
    public PartitionExporter partitionExporter(SearchBackend searchBackend) {
        return new PartitionExporter(searchBackend);
    }
}
