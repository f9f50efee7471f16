package com.archivedata.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Elasticsearch cluster connection configuration.
 */
@Data
@NoArgsConstructor
public class ElasticsearchConfig {

    private List<String> hosts = new ArrayList<>();
    private String index;
    private String username;
    private String password;

    /** Base64 encoded API key; takes precedence over username/password when set. */
    private String apiKey;

    private int connectTimeoutMs = 5000;
    private int socketTimeoutMs = 30000;

    /**
     * The index's {@code index.max_result_window}: the deepest {@code from + size} a single
     * search may reach.  Partitions are sized to stay at or below this value.
     */
    private int maxResultWindow = 10_000;

    /**
     * Returns a copy pointed at another endpoint and index, keeping credentials and timeouts.
     * Used when exporting from the cluster recorded in a partition file.
     */
    public ElasticsearchConfig withTarget(String endpoint, String indexName) {
        ElasticsearchConfig copy = new ElasticsearchConfig();
        copy.setHosts(endpoint == null ? new ArrayList<>(hosts) : List.of(endpoint.split(",")));
        copy.setIndex(indexName);
        copy.setUsername(username);
        copy.setPassword(password);
        copy.setApiKey(apiKey);
        copy.setConnectTimeoutMs(connectTimeoutMs);
        copy.setSocketTimeoutMs(socketTimeoutMs);
        copy.setMaxResultWindow(maxResultWindow);
        return copy;
    }

    /** The comma separated host list, as recorded in partition files. */
    public String getEndpoint() {
        return String.join(",", hosts);
    }
}
