package org.mediarr.service.indexer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.Release;
import org.mediarr.model.entity.IndexerEntity;
import org.mediarr.model.enums.DownloadProtocol;
import org.mediarr.service.release.ReleaseParser;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Normalizes Torznab/Newznab RSS XML and the JSON variants some indexers return into {@link Release} values.
 * Malformed items are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexerResponseParser {

    private static final List<String> JSON_WRAPPERS = List.of("results", "data", "items");

    private final ObjectMapper objectMapper;

    public List<Release> parse(String body, IndexerEntity indexer, ProtocolResolver protocolResolver) {
        if (StringUtils.isBlank(body)) {
            return List.of();
        }
        String trimmed = body.trim();
        if (trimmed.startsWith("[") || trimmed.startsWith("{") || trimmed.startsWith("\"")) {
            return parseJson(trimmed, indexer, protocolResolver);
        }
        return parseXml(trimmed, indexer, protocolResolver);
    }

    private List<Release> parseJson(String body, IndexerEntity indexer, ProtocolResolver protocolResolver) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
            if (root.isTextual()) {
                String inner = root.asText().trim();
                if (inner.startsWith("<")) {
                    return parseXml(inner, indexer, protocolResolver);
                }
                root = objectMapper.readTree(inner);
            }
        } catch (Exception e) {
            log.warn("Indexer {} returned unparseable JSON: {}", indexer.getName(), e.getMessage());
            return List.of();
        }

        JsonNode items = root;
        if (root.isObject()) {
            if (root.has("error")) {
                throw ApiError.INDEXER_ERROR.createException(indexer.getName(), root.path("error").asText());
            }
            items = JSON_WRAPPERS.stream()
                    .map(root::path)
                    .filter(JsonNode::isArray)
                    .findFirst()
                    .orElse(root.path("channel").path("item"));
        }
        if (!items.isArray()) {
            return List.of();
        }

        List<Release> releases = new ArrayList<>();
        for (JsonNode item : items) {
            try {
                Release release = fromJson(item, indexer, protocolResolver);
                if (release != null) {
                    releases.add(release);
                }
            } catch (Exception e) {
                log.debug("Skipping malformed JSON item from {}: {}", indexer.getName(), e.getMessage());
            }
        }
        return releases;
    }

    private Release fromJson(JsonNode item, IndexerEntity indexer, ProtocolResolver protocolResolver) {
        String title = text(item, "title", "name");
        if (StringUtils.isBlank(title)) {
            return null;
        }
        String downloadUrl = text(item, "downloadUrl", "download_url", "link", "magnetUrl", "magnet_url");
        Integer seeders = integer(item, "seeders");
        Integer peers = integer(item, "peers");
        Integer leechers = integer(item, "leechers");
        if (leechers == null && peers != null) {
            leechers = Math.max(0, peers - (seeders != null ? seeders : 0));
        }
        Double volumeFactor = item.hasNonNull("downloadVolumeFactor") ? item.get("downloadVolumeFactor").asDouble() : null;

        Set<Integer> codes = new LinkedHashSet<>();
        JsonNode categoryNode = item.has("categories") ? item.get("categories") : item.path("category");
        collectCategoryCodes(categoryNode, codes);

        DownloadProtocol protocol = protocolResolver.resolve(downloadUrl, seeders, volumeFactor);
        String explicitProtocol = text(item, "protocol");
        if ("usenet".equalsIgnoreCase(explicitProtocol)) {
            protocol = DownloadProtocol.USENET;
        } else if ("torrent".equalsIgnoreCase(explicitProtocol)) {
            protocol = DownloadProtocol.TORRENT;
        }

        return Release.builder()
                .guid(guid(text(item, "guid", "id"), downloadUrl, indexer))
                .title(title.trim())
                .size(item.hasNonNull("size") ? item.get("size").asLong() : null)
                .seeders(seeders)
                .leechers(leechers)
                .grabs(integer(item, "grabs"))
                .downloadUrl(downloadUrl)
                .infoUrl(text(item, "infoUrl", "info_url", "comments", "details"))
                .indexerId(indexer.getId())
                .indexer(indexer.getName())
                .indexerKind(indexer.getKind())
                .protocol(protocol)
                .quality(ReleaseParser.detectQuality(title).getLabel())
                .publishDate(parseDate(text(item, "publishDate", "pubDate", "publish_date")))
                .categoryCodes(new ArrayList<>(codes))
                .categories(codes.stream().map(IndexerCategories::label).toList())
                .downloadVolumeFactor(volumeFactor)
                .build();
    }

    private List<Release> parseXml(String body, IndexerEntity indexer, ProtocolResolver protocolResolver) {
        Document document = Jsoup.parse(body, "", Parser.xmlParser());
        Element error = document.selectFirst("error");
        if (error != null && document.selectFirst("item") == null) {
            throw ApiError.INDEXER_ERROR.createException(indexer.getName(),
                    StringUtils.defaultIfBlank(error.attr("description"), "code " + error.attr("code")));
        }

        List<Release> releases = new ArrayList<>();
        for (Element item : document.select("item")) {
            try {
                Release release = fromXml(item, indexer, protocolResolver);
                if (release != null) {
                    releases.add(release);
                }
            } catch (Exception e) {
                log.debug("Skipping malformed RSS item from {}: {}", indexer.getName(), e.getMessage());
            }
        }
        return releases;
    }

    private Release fromXml(Element item, IndexerEntity indexer, ProtocolResolver protocolResolver) {
        String title = childText(item, "title");
        if (StringUtils.isBlank(title)) {
            return null;
        }

        Map<String, String> attrs = new HashMap<>();
        Set<Integer> codes = new LinkedHashSet<>();
        for (Element child : item.children()) {
            String tag = child.tagName().toLowerCase();
            if (tag.endsWith(":attr") || tag.equals("attr")) {
                String name = child.attr("name").toLowerCase();
                String value = child.attr("value");
                if (name.equals("category")) {
                    addCode(value, codes);
                } else {
                    attrs.putIfAbsent(name, value);
                }
            } else if (tag.equals("category")) {
                addCode(child.text(), codes);
            }
        }

        Element enclosure = item.selectFirst("enclosure");
        String downloadUrl = StringUtils.defaultIfBlank(childText(item, "link"), enclosure != null ? enclosure.attr("url") : null);
        if (enclosure != null && StringUtils.isNotBlank(enclosure.attr("url"))) {
            downloadUrl = enclosure.attr("url");
        }
        if (attrs.containsKey("magneturl") && StringUtils.isBlank(downloadUrl)) {
            downloadUrl = attrs.get("magneturl");
        }

        Long size = toLong(attrs.get("size"));
        if (size == null) {
            size = toLong(childText(item, "size"));
        }
        if (size == null && enclosure != null) {
            size = toLong(enclosure.attr("length"));
        }

        Integer seeders = toInt(attrs.get("seeders"));
        Integer peers = toInt(attrs.get("peers"));
        Integer leechers = toInt(attrs.get("leechers"));
        if (peers != null) {
            leechers = Math.max(0, peers - (seeders != null ? seeders : 0));
        }
        Double volumeFactor = toDouble(attrs.get("downloadvolumefactor"));

        return Release.builder()
                .guid(guid(childText(item, "guid"), downloadUrl, indexer))
                .title(title.trim())
                .size(size)
                .seeders(seeders)
                .leechers(leechers)
                .grabs(toInt(attrs.get("grabs")))
                .downloadUrl(downloadUrl)
                .infoUrl(childText(item, "comments"))
                .indexerId(indexer.getId())
                .indexer(indexer.getName())
                .indexerKind(indexer.getKind())
                .protocol(protocolResolver.resolve(downloadUrl, seeders, volumeFactor))
                .quality(ReleaseParser.detectQuality(title).getLabel())
                .publishDate(parseDate(childText(item, "pubDate")))
                .categoryCodes(new ArrayList<>(codes))
                .categories(codes.stream().map(IndexerCategories::label).toList())
                .downloadVolumeFactor(volumeFactor)
                .build();
    }

    private static String guid(String guid, String downloadUrl, IndexerEntity indexer) {
        if (StringUtils.isNotBlank(guid)) {
            return guid.trim();
        }
        if (StringUtils.isNotBlank(downloadUrl)) {
            return downloadUrl;
        }
        return indexer.getName() + "-" + System.currentTimeMillis() + "-" + ThreadLocalRandom.current().nextInt(1_000_000);
    }

    private static String childText(Element item, String tag) {
        for (Element child : item.children()) {
            if (child.tagName().equalsIgnoreCase(tag)) {
                return child.text();
            }
        }
        return null;
    }

    private static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && value.isValueNode() && StringUtils.isNotBlank(value.asText())) {
                return value.asText();
            }
        }
        return null;
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isNumber() ? value.asInt() : toInt(value.asText());
    }

    private static void collectCategoryCodes(JsonNode node, Set<Integer> codes) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            node.forEach(child -> collectCategoryCodes(child, codes));
        } else if (node.isObject()) {
            collectCategoryCodes(node.get("id"), codes);
        } else if (node.isNumber()) {
            codes.add(node.asInt());
        } else {
            for (String part : node.asText().split(",")) {
                addCode(part, codes);
            }
        }
    }

    private static void addCode(String value, Set<Integer> codes) {
        Integer code = toInt(value);
        if (code != null) {
            codes.add(code);
        }
    }

    private static Integer toInt(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long toLong(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double toDouble(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Instant parseDate(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return ZonedDateTime.parse(value.trim()).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
