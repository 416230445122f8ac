package org.mediarr.service.indexer;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.mediarr.config.AppProperties;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.ParsedEpisode;
import org.mediarr.model.dto.Release;
import org.mediarr.model.entity.IndexerEntity;
import org.mediarr.model.enums.IndexerCapability;
import org.mediarr.model.enums.IndexerKind;
import org.mediarr.model.enums.SearchType;
import org.mediarr.repository.IndexerRepository;
import org.mediarr.service.release.ReleaseParser;
import org.mediarr.service.release.TitleMatcher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

@Slf4j
@Service
public class IndexerService {

    private static final Set<String> QUERY_ARTICLES = Set.of("the", "a", "an");

    private final IndexerRepository indexerRepository;
    private final SearchQueue searchQueue;
    private final TitleMatcher titleMatcher;
    private final AppProperties appProperties;
    private final Map<IndexerKind, IndexerDriver> drivers = new EnumMap<>(IndexerKind.class);

    public IndexerService(IndexerRepository indexerRepository, SearchQueue searchQueue, TitleMatcher titleMatcher,
                          AppProperties appProperties, List<IndexerDriver> indexerDrivers) {
        this.indexerRepository = indexerRepository;
        this.searchQueue = searchQueue;
        this.titleMatcher = titleMatcher;
        this.appProperties = appProperties;
        indexerDrivers.forEach(driver -> drivers.put(driver.getKind(), driver));
    }

    public List<IndexerEntity> getIndexers(IndexerCapability capability) {
        return switch (capability) {
            case RSS -> indexerRepository.findByEnabledTrueAndEnableRssTrueOrderByPriorityAscIdAsc();
            case AUTOMATIC_SEARCH -> indexerRepository.findByEnabledTrueAndEnableAutomaticSearchTrueOrderByPriorityAscIdAsc();
            case INTERACTIVE_SEARCH -> indexerRepository.findByEnabledTrueAndEnableInteractiveSearchTrueOrderByPriorityAscIdAsc();
        };
    }

    public List<Release> searchMovies(String title, Integer year, SearchType searchType) {
        String description = year != null ? title + " (" + year + ")" : title;
        List<Release> raw = searchQueue.execute(description,
                () -> fanOut(searchType, description, indexer -> searchMovieOnIndexer(indexer, title)));

        Predicate<Release> isMovie = release -> release.getCategoryCodes() == null || release.getCategoryCodes().isEmpty()
                || release.getCategoryCodes().stream().anyMatch(IndexerCategories::isMovie);
        List<Release> results = raw.stream()
                .filter(isMovie)
                .filter(release -> year != null || !ReleaseParser.hasTvMarker(release.getTitle()))
                .filter(release -> titleMatcher.matches(release.getTitle(), title, year, appProperties.getMatching().getIndexerFilter()))
                .sorted(bySeedersDescending())
                .toList();
        log.info("[SEARCH] Movie search '{}' returned {} releases ({} before filtering)", description, results.size(), raw.size());
        return results;
    }

    public List<Release> searchTv(String title, Integer season, Integer episode, SearchType searchType) {
        String description = title + (season != null ? String.format(" S%02d", season) : "") + (episode != null ? String.format("E%02d", episode) : "");
        List<Release> raw = searchQueue.execute(description,
                () -> fanOut(searchType, description, indexer -> searchTvOnIndexer(indexer, title, season, episode)));

        Predicate<Release> isTv = release -> release.getCategoryCodes() == null || release.getCategoryCodes().isEmpty()
                || release.getCategoryCodes().stream().anyMatch(IndexerCategories::isTv);
        List<Release> results = raw.stream()
                .filter(isTv)
                .filter(release -> matchesEpisode(release.getTitle(), season, episode))
                .filter(release -> titleMatcher.matches(release.getTitle(), title, null, appProperties.getMatching().getIndexerFilter()))
                .sorted(bySeedersDescending())
                .toList();
        log.info("[SEARCH] TV search '{}' returned {} releases ({} before filtering)", description, results.size(), raw.size());
        return results;
    }

    /**
     * Latest feed items of one indexer. Failures are logged and yield an empty list.
     */
    public List<Release> fetchRss(IndexerEntity indexer) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("t", "search");
        params.put("cat", IndexerCategories.toParam(IndexerCategories.RSS_CATEGORIES));
        params.put("limit", String.valueOf(appProperties.getIndexer().getRssLimit()));
        try {
            return driverFor(indexer).query(indexer, params);
        } catch (Exception e) {
            log.warn("[RSS] Failed to fetch feed from {}: {}", indexer.getName(), e.getMessage());
            return List.of();
        }
    }

    public boolean testIndexer(Long indexerId) {
        IndexerEntity indexer = indexerRepository.findById(indexerId)
                .orElseThrow(() -> ApiError.INDEXER_NOT_FOUND.createException(indexerId));
        return driverFor(indexer).testConnection(indexer);
    }

    private interface IndexerSearch {
        List<Release> search(IndexerEntity indexer);
    }

    private List<Release> fanOut(SearchType searchType, String description, IndexerSearch search) {
        List<IndexerEntity> indexers = getIndexers(searchType.getCapability());
        if (indexers.isEmpty()) {
            log.warn("[SEARCH] No enabled indexers for {} search", searchType);
            return List.of();
        }
        Map<String, Release> results = new LinkedHashMap<>();
        for (IndexerEntity indexer : indexers) {
            try {
                for (Release release : search.search(indexer)) {
                    results.putIfAbsent(indexer.getId() + "|" + release.getGuid(), release);
                }
            } catch (Exception e) {
                log.warn("[SEARCH] Indexer {} failed for '{}': {}", indexer.getName(), description, e.getMessage());
            }
        }
        return new ArrayList<>(results.values());
    }

    private List<Release> searchMovieOnIndexer(IndexerEntity indexer, String title) {
        IndexerDriver driver = driverFor(indexer);
        String movieCategories = IndexerCategories.toParam(IndexerCategories.MOVIE_CATEGORIES);
        for (String query : queryVariations(title)) {
            List<Release> results = driver.query(indexer, Map.of("t", "movie", "q", query, "cat", movieCategories));
            if (results.isEmpty()) {
                results = driver.query(indexer, Map.of("t", "search", "q", query, "cat", movieCategories));
            }
            if (!results.isEmpty()) {
                log.debug("[SEARCH] {} matched query variation '{}'", indexer.getName(), query);
                return results;
            }
        }
        return List.of();
    }

    private List<Release> searchTvOnIndexer(IndexerEntity indexer, String title, Integer season, Integer episode) {
        IndexerDriver driver = driverFor(indexer);
        String tvCategories = IndexerCategories.toParam(IndexerCategories.TV_CATEGORIES);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("t", "tvsearch");
        params.put("q", cleanQuery(title));
        params.put("cat", tvCategories);
        if (season != null) {
            params.put("season", String.valueOf(season));
        }
        if (episode != null) {
            params.put("ep", String.valueOf(episode));
        }
        List<Release> results = driver.query(indexer, params);
        if (!results.isEmpty()) {
            return results;
        }

        StringBuilder query = new StringBuilder(cleanQuery(title));
        if (season != null) {
            query.append(String.format(" S%02d", season));
            if (episode != null) {
                query.append(String.format("E%02d", episode));
            }
        }
        return driver.query(indexer, Map.of("t", "search", "q", query.toString(), "cat", tvCategories));
    }

    static List<String> queryVariations(String title) {
        String cleaned = cleanQuery(title);
        String withoutArticles = String.join(" ", List.of(cleaned.split("\\s+")).stream()
                .filter(word -> !QUERY_ARTICLES.contains(word.toLowerCase()))
                .toList());
        Set<String> variations = new LinkedHashSet<>();
        variations.add(cleaned);
        variations.add(cleaned.replace(' ', '.'));
        if (StringUtils.isNotBlank(withoutArticles)) {
            variations.add(withoutArticles);
            variations.add(withoutArticles.replace(' ', '.'));
        }
        return new ArrayList<>(variations);
    }

    private static String cleanQuery(String title) {
        return title.replaceAll("[:!?,\"]", "").replaceAll("\\s+", " ").trim();
    }

    private static boolean matchesEpisode(String releaseTitle, Integer season, Integer episode) {
        if (season == null) {
            return true;
        }
        Optional<ParsedEpisode> parsed = ReleaseParser.parseEpisode(releaseTitle);
        if (parsed.isPresent()) {
            return parsed.get().season() == season && (episode == null || parsed.get().episode() == episode);
        }
        return ReleaseParser.parseSeasonPack(releaseTitle).map(pack -> pack.equals(season)).orElse(false);
    }

    private static Comparator<Release> bySeedersDescending() {
        return Comparator.comparing((Release r) -> r.getSeeders() != null ? r.getSeeders() : 0).reversed();
    }

    private IndexerDriver driverFor(IndexerEntity indexer) {
        IndexerDriver driver = drivers.get(indexer.getKind());
        if (driver == null) {
            throw ApiError.GENERIC_BAD_REQUEST.createException("Unsupported indexer kind: " + indexer.getKind());
        }
        return driver;
    }
}
