package org.mediarr.service.download.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.mediarr.model.dto.AddDownloadResult;
import org.mediarr.model.dto.ClientDownload;
import org.mediarr.model.entity.DownloadClientEntity;
import org.mediarr.model.enums.ClientDownloadState;
import org.mediarr.model.enums.DownloadClientType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class SabnzbdClientDriver implements DownloadClientDriver {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public DownloadClientType getType() {
        return DownloadClientType.SABNZBD;
    }

    @Override
    public AddDownloadResult add(DownloadClientEntity client, String url, String title, String category, String savePath) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("mode", "addurl");
        params.put("name", url);
        params.put("nzbname", title);
        if (StringUtils.isNotBlank(category)) {
            params.put("cat", category);
        }
        JsonNode response = call(client, params);
        if (!response.path("status").asBoolean(false)) {
            return AddDownloadResult.failure("SABnzbd rejected NZB: " + response.path("error").asText("unknown error"));
        }
        JsonNode ids = response.path("nzo_ids");
        String nzoId = ids.isArray() && !ids.isEmpty() ? ids.get(0).asText() : null;
        log.info("Added NZB '{}' to SABnzbd {} (nzo_id: {})", title, client.getName(), nzoId);
        return AddDownloadResult.builder()
                .success(true)
                .downloadId(nzoId)
                .clientId(client.getId())
                .message("Added to SABnzbd")
                .build();
    }

    /**
     * Queue and history together, since a finished job moves from one to the other.
     */
    @Override
    public List<ClientDownload> list(DownloadClientEntity client, String category) {
        List<ClientDownload> downloads = new ArrayList<>();
        Map<String, String> queueParams = new LinkedHashMap<>();
        queueParams.put("mode", "queue");
        if (StringUtils.isNotBlank(category)) {
            queueParams.put("cat", category);
        }
        for (JsonNode slot : call(client, queueParams).path("queue").path("slots")) {
            String status = slot.path("status").asText("Queued");
            double mb = slot.path("mb").asDouble(0);
            downloads.add(ClientDownload.builder()
                    .handle(slot.path("nzo_id").asText())
                    .name(slot.path("filename").asText())
                    .progress(slot.path("percentage").asDouble(0))
                    .state(mapQueueState(status))
                    .rawState(status)
                    .size((long) (mb * BYTES_PER_MB))
                    .build());
        }

        Map<String, String> historyParams = new LinkedHashMap<>();
        historyParams.put("mode", "history");
        historyParams.put("limit", "100");
        if (StringUtils.isNotBlank(category)) {
            historyParams.put("cat", category);
        }
        for (JsonNode slot : call(client, historyParams).path("history").path("slots")) {
            String status = slot.path("status").asText("");
            ClientDownloadState state = mapHistoryState(status);
            downloads.add(ClientDownload.builder()
                    .handle(slot.path("nzo_id").asText())
                    .name(slot.path("name").asText())
                    .progress(state == ClientDownloadState.COMPLETED ? 100d : 99d)
                    .state(state)
                    .rawState(status)
                    .contentPath(slot.path("storage").asText(null))
                    .size(slot.path("bytes").asLong())
                    .errorMessage(StringUtils.trimToNull(slot.path("fail_message").asText(null)))
                    .build());
        }
        return downloads;
    }

    @Override
    public boolean remove(DownloadClientEntity client, String handle, boolean deleteFiles) {
        String delFiles = deleteFiles ? "1" : "0";
        JsonNode queue = call(client, Map.of("mode", "queue", "name", "delete", "value", handle, "del_files", delFiles));
        JsonNode history = call(client, Map.of("mode", "history", "name", "delete", "value", handle, "del_files", delFiles));
        return queue.path("status").asBoolean(false) || history.path("status").asBoolean(false);
    }

    @Override
    public boolean testConnection(DownloadClientEntity client) {
        try {
            return call(client, Map.of("mode", "version")).has("version");
        } catch (Exception e) {
            log.warn("SABnzbd {} connection test failed: {}", client.getName(), e.getMessage());
            return false;
        }
    }

    static ClientDownloadState mapQueueState(String status) {
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "paused" -> ClientDownloadState.PAUSED;
            case "queued", "grabbing", "fetching", "propagating" -> ClientDownloadState.QUEUED;
            default -> ClientDownloadState.DOWNLOADING;
        };
    }

    static ClientDownloadState mapHistoryState(String status) {
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "completed" -> ClientDownloadState.COMPLETED;
            case "failed" -> ClientDownloadState.FAILED;
            default -> ClientDownloadState.DOWNLOADING;
        };
    }

    private JsonNode call(DownloadClientEntity client, Map<String, String> params) {
        Map<String, String> query = new LinkedHashMap<>(params);
        query.put("apikey", StringUtils.defaultString(client.getApiKey()));
        query.put("output", "json");
        String queryString = query.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(client.baseUrl() + "/api?" + queryString))
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new DownloadClientException("SABnzbd returned HTTP " + response.statusCode());
            }
            JsonNode body = objectMapper.readTree(response.body());
            if (body.has("error") && !body.path("status").asBoolean(true)) {
                throw new DownloadClientException("SABnzbd error: " + body.path("error").asText());
            }
            return body;
        } catch (IOException e) {
            throw new DownloadClientException("SABnzbd unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadClientException("Interrupted while calling SABnzbd", e);
        }
    }
}
