package org.mediarr.service.download.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.mediarr.config.AppProperties;
import org.mediarr.model.dto.AddDownloadResult;
import org.mediarr.model.dto.ClientDownload;
import org.mediarr.model.entity.DownloadClientEntity;
import org.mediarr.model.enums.ClientDownloadState;
import org.mediarr.model.enums.DownloadClientType;
import org.mediarr.service.download.DownloadHandleMatcher;
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
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class QBittorrentClientDriver implements DownloadClientDriver {

    private static final Pattern MAGNET_HASH = Pattern.compile("xt=urn:btih:([a-f0-9]{40})", Pattern.CASE_INSENSITIVE);
    private static final Set<String> FAILED_STATES = Set.of("error", "missingfiles", "unknown");
    private static final Set<String> COMPLETED_STATES = Set.of("uploading", "pausedup", "stoppedup", "stalledup", "queuedup", "forcedup", "checkingup");
    private static final Set<String> PAUSED_STATES = Set.of("pauseddl", "stoppeddl");
    private static final Set<String> QUEUED_STATES = Set.of("queueddl", "metadl", "allocating", "checkingresumedata");
    private static final String TAG = "mediarr";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final Map<Long, String> sessionCookies = new ConcurrentHashMap<>();

    @Override
    public DownloadClientType getType() {
        return DownloadClientType.QBITTORRENT;
    }

    @Override
    public AddDownloadResult add(DownloadClientEntity client, String url, String title, String category, String savePath) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("urls", url);
        form.put("category", category);
        form.put("tags", TAG);
        if (StringUtils.isNotBlank(savePath)) {
            form.put("savepath", savePath);
        }
        HttpResponse<String> response = post(client, "/api/v2/torrents/add", form);
        String body = StringUtils.trimToEmpty(response.body());
        if (response.statusCode() != 200 || body.equalsIgnoreCase("Fails.")) {
            return AddDownloadResult.failure("qBittorrent rejected torrent: " + StringUtils.defaultIfBlank(body, "HTTP " + response.statusCode()));
        }

        String hash = extractMagnetHash(url).orElseGet(() -> discoverHash(client, title, category));
        log.info("Added torrent '{}' to qBittorrent {} (hash: {})", title, client.getName(), hash);
        return AddDownloadResult.builder()
                .success(true)
                .downloadId(hash)
                .clientId(client.getId())
                .message("Added to qBittorrent")
                .build();
    }

    @Override
    public List<ClientDownload> list(DownloadClientEntity client, String category) {
        String path = "/api/v2/torrents/info" + (StringUtils.isNotBlank(category) ? "?category=" + encode(category) : "");
        HttpResponse<String> response = get(client, path);
        if (response.statusCode() != 200) {
            throw new DownloadClientException("qBittorrent torrent list failed with HTTP " + response.statusCode());
        }
        try {
            JsonNode torrents = objectMapper.readTree(response.body());
            List<ClientDownload> downloads = new ArrayList<>();
            for (JsonNode torrent : torrents) {
                String rawState = torrent.path("state").asText("unknown");
                double progress = torrent.path("progress").asDouble(0) * 100d;
                downloads.add(ClientDownload.builder()
                        .handle(torrent.path("hash").asText().toLowerCase(Locale.ROOT))
                        .name(torrent.path("name").asText())
                        .progress(progress)
                        .state(mapState(rawState, progress))
                        .rawState(rawState)
                        .contentPath(torrent.path("content_path").asText(null))
                        .savePath(torrent.path("save_path").asText(null))
                        .size(torrent.path("size").asLong())
                        .addedOn(torrent.path("added_on").asLong())
                        .errorMessage(FAILED_STATES.contains(rawState.toLowerCase(Locale.ROOT)) ? "Torrent error state: " + rawState : null)
                        .build());
            }
            return downloads;
        } catch (IOException e) {
            throw new DownloadClientException("Unreadable qBittorrent torrent list", e);
        }
    }

    @Override
    public boolean remove(DownloadClientEntity client, String handle, boolean deleteFiles) {
        HttpResponse<String> response = post(client, "/api/v2/torrents/delete",
                Map.of("hashes", handle, "deleteFiles", String.valueOf(deleteFiles)));
        return response.statusCode() == 200;
    }

    @Override
    public boolean testConnection(DownloadClientEntity client) {
        try {
            return get(client, "/api/v2/app/version").statusCode() == 200;
        } catch (Exception e) {
            log.warn("qBittorrent {} connection test failed: {}", client.getName(), e.getMessage());
            return false;
        }
    }

    static ClientDownloadState mapState(String rawState, double progress) {
        String state = rawState.toLowerCase(Locale.ROOT);
        if (FAILED_STATES.contains(state)) {
            return ClientDownloadState.FAILED;
        }
        if (COMPLETED_STATES.contains(state) || progress >= 100d) {
            return ClientDownloadState.COMPLETED;
        }
        if (PAUSED_STATES.contains(state)) {
            return ClientDownloadState.PAUSED;
        }
        if (QUEUED_STATES.contains(state)) {
            return ClientDownloadState.QUEUED;
        }
        return ClientDownloadState.DOWNLOADING;
    }

    static Optional<String> extractMagnetHash(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher m = MAGNET_HASH.matcher(url);
        return m.find() ? Optional.of(m.group(1).toLowerCase(Locale.ROOT)) : Optional.empty();
    }

    /**
     * qBittorrent does not return the hash of an added .torrent URL, so the newest torrents in the
     * category are polled a few times and matched by name.
     */
    private String discoverHash(DownloadClientEntity client, String title, String category) {
        int attempts = appProperties.getDownload().getHandleDiscoveryAttempts();
        long delay = appProperties.getDownload().getHandleDiscoveryDelayMs();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
            try {
                Optional<ClientDownload> match = DownloadHandleMatcher.findByTitle(title, list(client, category));
                if (match.isPresent()) {
                    return match.get().getHandle();
                }
            } catch (Exception e) {
                log.debug("Hash discovery attempt {} for '{}' failed: {}", attempt, title, e.getMessage());
            }
        }
        log.info("Hash for '{}' not found yet; download sync will keep looking", title);
        return null;
    }

    private HttpResponse<String> get(DownloadClientEntity client, String path) {
        return withSession(client, cookie -> HttpRequest.newBuilder()
                .uri(URI.create(client.baseUrl() + path))
                .timeout(Duration.ofSeconds(30))
                .header("Cookie", cookie)
                .GET()
                .build());
    }

    private HttpResponse<String> post(DownloadClientEntity client, String path, Map<String, String> form) {
        String body = formEncode(form);
        return withSession(client, cookie -> HttpRequest.newBuilder()
                .uri(URI.create(client.baseUrl() + path))
                .timeout(Duration.ofSeconds(30))
                .header("Cookie", cookie)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
    }

    private interface RequestFactory {
        HttpRequest create(String cookie);
    }

    private HttpResponse<String> withSession(DownloadClientEntity client, RequestFactory factory) {
        String cookie = sessionCookies.computeIfAbsent(client.getId(), id -> login(client));
        HttpResponse<String> response = send(factory.create(cookie));
        if (response.statusCode() == 403) {
            log.debug("qBittorrent session for {} expired, logging in again", client.getName());
            cookie = login(client);
            sessionCookies.put(client.getId(), cookie);
            response = send(factory.create(cookie));
        }
        return response;
    }

    private String login(DownloadClientEntity client) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(client.baseUrl() + "/api/v2/auth/login"))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Referer", client.baseUrl())
                .POST(HttpRequest.BodyPublishers.ofString(formEncode(Map.of(
                        "username", StringUtils.defaultString(client.getUsername()),
                        "password", StringUtils.defaultString(client.getPassword())))))
                .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() != 200 || "Fails.".equalsIgnoreCase(StringUtils.trimToEmpty(response.body()))) {
            throw new DownloadClientException("qBittorrent login failed for " + client.getName());
        }
        return response.headers().allValues("set-cookie").stream()
                .map(value -> value.split(";", 2)[0])
                .filter(value -> value.startsWith("SID="))
                .findFirst()
                .orElse("");
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DownloadClientException("qBittorrent unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadClientException("Interrupted while calling qBittorrent", e);
        }
    }

    private static String formEncode(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> e.getKey() + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(StringUtils.defaultString(value), StandardCharsets.UTF_8);
    }
}
