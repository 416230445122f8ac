package org.mediarr.service.indexer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.mediarr.config.AppProperties;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.Release;
import org.mediarr.model.entity.IndexerEntity;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shared HTTP plumbing for the Torznab and Newznab APIs, which only differ in how the transport
 * protocol of a result is decided.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class AbstractNabIndexerDriver implements IndexerDriver, ProtocolResolver {

    private final HttpClient httpClient;
    private final IndexerRateLimiter rateLimiter;
    private final IndexerResponseParser responseParser;
    private final AppProperties appProperties;

    @Override
    public List<Release> query(IndexerEntity indexer, Map<String, String> params) {
        String body = fetch(indexer, params);
        List<Release> releases = responseParser.parse(body, indexer, this);
        log.debug("Indexer {} returned {} releases for {}", indexer.getName(), releases.size(), params);
        return releases;
    }

    @Override
    public boolean testConnection(IndexerEntity indexer) {
        try {
            String body = fetch(indexer, Map.of("t", "caps"));
            return body != null && !body.contains("<error");
        } catch (Exception e) {
            log.warn("Indexer {} connection test failed: {}", indexer.getName(), e.getMessage());
            return false;
        }
    }

    protected String fetch(IndexerEntity indexer, Map<String, String> params) {
        URI uri = buildUri(indexer, params);
        rateLimiter.acquireSlot(String.valueOf(indexer.getId()));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofSeconds(appProperties.getIndexer().getRequestTimeoutSeconds()))
                .header("Accept", "application/rss+xml, application/xml, application/json")
                .header("User-Agent", "Mediarr/" + StringUtils.defaultIfBlank(appProperties.getVersion(), "dev"))
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw ApiError.INDEXER_ERROR.createException(indexer.getName(), "HTTP " + response.statusCode());
            }
            return response.body();
        } catch (IOException e) {
            throw ApiError.INDEXER_ERROR.createException(indexer.getName(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ApiError.INDEXER_ERROR.createException(indexer.getName(), "interrupted");
        }
    }

    URI buildUri(IndexerEntity indexer, Map<String, String> params) {
        String base = StringUtils.removeEnd(indexer.getUrl().trim(), "/");
        if (!base.endsWith("/api")) {
            base = base + "/api";
        }
        Map<String, String> query = new LinkedHashMap<>(params);
        if (StringUtils.isNotBlank(indexer.getApiKey())) {
            query.put("apikey", indexer.getApiKey());
        }
        String queryString = query.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        return URI.create(base + (base.contains("?") ? "&" : "?") + queryString);
    }
}
