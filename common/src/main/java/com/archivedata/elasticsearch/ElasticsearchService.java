package com.archivedata.elasticsearch;

import com.archivedata.config.ElasticsearchConfig;
import com.archivedata.search.FieldDescriptor;
import com.archivedata.search.RangeFilter;
import com.archivedata.search.SearchBackend;
import com.archivedata.search.SortDirection;
import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch.core.CountRequest;
import co.elastic.clients.elasticsearch.core.CountResponse;
import co.elastic.clients.elasticsearch.core.FieldCapsRequest;
import co.elastic.clients.elasticsearch.core.FieldCapsResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.field_caps.FieldCapability;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.Header;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.message.BasicHeader;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link SearchBackend} over one Elasticsearch index.
 *
 * <p>Responsible for:
 * <ul>
 *   <li>Finding the smallest or largest value of the ordering field from a hit's sort values,
 *       which do not depend on the field's mapping format</li>
 *   <li>Counting documents in a range of the ordering field ({@code _count})</li>
 *   <li>Fetching pages of documents with {@code from}/{@code size}, sorted on the ordering field</li>
 *   <li>Describing a field through {@code _field_caps}: searchable fields are filterable,
 *       aggregatable fields are sortable</li>
 * </ul>
 *
 * <p>The underlying client is thread-safe, so one instance is shared by all export workers.</p>
 */
@Slf4j
public class ElasticsearchService implements SearchBackend {

    private final ElasticsearchClient client;
    private final RestClient restClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String index;
    private final String endpoint;
    private final int maxResultWindow;

    public ElasticsearchService(ElasticsearchConfig config) {
        if (config.getHosts() == null || config.getHosts().isEmpty()) {
            throw new IllegalArgumentException("At least one Elasticsearch host must be configured");
        }
        if (config.getIndex() == null || config.getIndex().isBlank()) {
            throw new IllegalArgumentException("Elasticsearch index must be configured");
        }
        this.index = config.getIndex();
        this.endpoint = config.getEndpoint();
        this.maxResultWindow = config.getMaxResultWindow();

        HttpHost[] hosts = config.getHosts().stream()
                .map(String::trim)
                .map(HttpHost::create)
                .toArray(HttpHost[]::new);

        RestClientBuilder builder = RestClient.builder(hosts)
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(config.getConnectTimeoutMs())
                        .setSocketTimeout(config.getSocketTimeoutMs()));

        if (config.getApiKey() != null && !config.getApiKey().isEmpty()) {
            builder.setDefaultHeaders(new Header[]{
                    new BasicHeader("Authorization", "ApiKey " + config.getApiKey())});
        } else if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(AuthScope.ANY,
                    new UsernamePasswordCredentials(config.getUsername(), config.getPassword()));
            builder.setHttpClientConfigCallback(hcb ->
                    hcb.setDefaultCredentialsProvider(credentialsProvider));
        }

        this.restClient = builder.build();
        RestClientTransport transport = new RestClientTransport(restClient, new JacksonJsonpMapper());
        this.client = new ElasticsearchClient(transport);
    }

    @Override
    public long count(RangeFilter filter) throws IOException {
        byte[] queryBytes = objectMapper.writeValueAsBytes(filter.toQuery());

        CountRequest.Builder countBuilder = new CountRequest.Builder().index(index);
        countBuilder.query(q -> q.withJson(new ByteArrayInputStream(queryBytes)));

        CountResponse response = client.count(countBuilder.build());
        long count = response.count();
        log.debug("Count for index={} filter={}: {}", index, filter, count);
        return count;
    }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public List<Map<String, Object>> query(RangeFilter filter, String sortField, SortDirection direction,
                                           int skip, int top) throws IOException {
        if (skip + top > maxResultWindow) {
            throw new IllegalArgumentException("Page [" + skip + ", " + (skip + top)
                    + ") goes past max_result_window " + maxResultWindow);
        }

        // Serialize outside the lambda to avoid a checked exception inside it
        byte[] queryBytes = objectMapper.writeValueAsBytes(filter.toQuery());
        SortOrder order = direction == SortDirection.ASC ? SortOrder.Asc : SortOrder.Desc;

        SearchRequest request = new SearchRequest.Builder()
                .index(index)
                .from(skip)
                .size(top)
                .trackTotalHits(t -> t.enabled(false))
                .sort(s -> s.field(f -> f.field(sortField).order(order)))
                .query(q -> q.withJson(new ByteArrayInputStream(queryBytes)))
                .build();

        SearchResponse<Map> response = client.search(request, Map.class);
        List<Map<String, Object>> documents = new ArrayList<>();
        for (Hit<Map> hit : response.hits().hits()) {
            if (hit.source() != null) {
                documents.add(hit.source());
            }
        }
        log.debug("Fetched {} documents for filter={} from={} size={}", documents.size(), filter, skip, top);
        return documents;
    }

    @Override
    @SuppressWarnings("rawtypes")
    public Object firstSortValue(String sortField, SortDirection direction) throws IOException {
        SortOrder order = direction == SortDirection.ASC ? SortOrder.Asc : SortOrder.Desc;

        SearchRequest request = new SearchRequest.Builder()
                .index(index)
                .size(1)
                .trackTotalHits(t -> t.enabled(false))
                .source(src -> src.fetch(false))
                .sort(s -> s.field(f -> f.field(sortField).order(order)))
                .query(q -> q.exists(e -> e.field(sortField)))
                .build();

        SearchResponse<Map> response = client.search(request, Map.class);
        List<Hit<Map>> hits = response.hits().hits();
        if (hits.isEmpty() || hits.get(0).sort() == null || hits.get(0).sort().isEmpty()) {
            return null;
        }
        Object value = toJavaValue(hits.get(0).sort().get(0));
        log.debug("First sort value of {}.{} {}: {}", index, sortField, direction, value);
        return value;
    }

    @Override
    public FieldDescriptor describeField(String field) throws IOException {
        FieldCapsResponse response = client.fieldCaps(FieldCapsRequest.of(f -> f.index(index).fields(field)));
        Map<String, FieldCapability> capabilities = response.fields().get(field);
        if (capabilities == null || capabilities.isEmpty()) {
            return null;
        }
        if (capabilities.size() > 1) {
            // mapped with different types across the indices behind the name
            String types = capabilities.keySet().stream().sorted().collect(Collectors.joining("|"));
            return new FieldDescriptor(field, types, false, false);
        }
        FieldCapability capability = capabilities.values().iterator().next();
        FieldDescriptor descriptor = new FieldDescriptor(field, capability.type(),
                capability.searchable(), capability.aggregatable());
        log.info("Field {} of {}: {}", field, index, descriptor);
        return descriptor;
    }

    /**
     * Dates sort as epoch milliseconds, so they arrive here as longs.
     */
    static Object toJavaValue(FieldValue value) {
        if (value.isLong()) {
            return value.longValue();
        }
        if (value.isDouble()) {
            return value.doubleValue();
        }
        if (value.isString()) {
            return value.stringValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return null;
    }

    @Override
    public int getPageDepthLimit() {
        return maxResultWindow;
    }

    @Override
    public String getEndpoint() {
        return endpoint;
    }

    @Override
    public String getIndexName() {
        return index;
    }

    @Override
    public void close() throws IOException {
        if (restClient != null) {
            restClient.close();
        }
    }
}
