package org.mediarr.service.search;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.config.AppProperties;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.dto.GrabResult;
import org.mediarr.model.dto.ParsedEpisode;
import org.mediarr.model.dto.Release;
import org.mediarr.model.dto.ReleaseDecision;
import org.mediarr.model.dto.ScoredRelease;
import org.mediarr.model.dto.WantedItem;
import org.mediarr.model.dto.WantedSeries;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.model.enums.SearchType;
import org.mediarr.service.download.BlacklistService;
import org.mediarr.service.download.DownloadService;
import org.mediarr.service.download.GrabService;
import org.mediarr.service.indexer.IndexerService;
import org.mediarr.service.library.LibraryService;
import org.mediarr.service.quality.QualityProfileOracle;
import org.mediarr.service.release.ReleaseParser;
import org.mediarr.service.release.TitleMatcher;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Searches indexers for a wanted item, ranks the acceptable releases and grabs the best one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutoSearchService {

    private static final Comparator<ScoredRelease> RANKING = Comparator.comparingInt(ScoredRelease::totalScore)
            .thenComparingInt(s -> Objects.requireNonNullElse(s.release().getSeeders(), 0));

    private final IndexerService indexerService;
    private final LibraryService libraryService;
    private final DownloadService downloadService;
    private final GrabService grabService;
    private final BlacklistService blacklistService;
    private final ReleaseDecisionService decisionService;
    private final ReleaseScorer releaseScorer;
    private final QualityProfileOracle qualityProfileOracle;
    private final TitleMatcher titleMatcher;
    private final AppProperties appProperties;

    /**
     * @param forceUpgrade search even when the current file already meets the cutoff
     */
    public Optional<GrabResult> searchAndGrabMovie(Long movieId, boolean forceUpgrade) {
        WantedItem movie = libraryService.findMovie(movieId)
                .orElseThrow(() -> ApiError.MOVIE_NOT_FOUND.createException(movieId));
        if (libraryService.isExcluded(movie.getExternalId(), MediaKind.MOVIE)) {
            log.info("[SEARCH] Skipping excluded movie '{}'", movie.getTitle());
            return Optional.empty();
        }
        if (movie.isHasFile() && !forceUpgrade && qualityProfileOracle.meetsCutoff(movie.getQualityProfileId(), movie.getCurrentQuality())) {
            log.debug("[SEARCH] '{}' already meets its cutoff", movie.getTitle());
            return Optional.empty();
        }
        if (downloadService.hasActive(movie.getTarget())) {
            log.debug("[SEARCH] '{}' already has an active download", movie.getTitle());
            return Optional.empty();
        }

        List<Release> releases = indexerService.searchMovies(movie.getTitle(), movie.getYear(), SearchType.AUTOMATIC).stream()
                .filter(r -> titleMatcher.matches(r.getTitle(), movie.getTitle(), movie.getYear(), appProperties.getMatching().getAutoSearch()))
                .toList();
        return grabBest(movie, releases);
    }

    public Optional<GrabResult> searchAndGrabEpisode(Long seriesId, int season, int episode) {
        WantedItem item = libraryService.findEpisode(seriesId, season, episode)
                .orElseThrow(() -> ApiError.EPISODE_NOT_FOUND.createException(season, episode, seriesId));
        if (libraryService.isExcluded(item.getExternalId(), MediaKind.EPISODE)) {
            log.info("[SEARCH] Skipping excluded series '{}'", item.getTitle());
            return Optional.empty();
        }
        if (downloadService.hasActive(item.getTarget())) {
            log.debug("[SEARCH] {} already has an active download", item.getTarget().describe());
            return Optional.empty();
        }

        List<Release> releases = indexerService.searchTv(item.getTitle(), season, episode, SearchType.AUTOMATIC).stream()
                .filter(r -> ReleaseParser.parseEpisode(r.getTitle()).map(p -> p.equals(new ParsedEpisode(season, episode))).orElse(false))
                .filter(r -> titleMatcher.matches(r.getTitle(), item.getTitle(), null, appProperties.getMatching().getAutoSearch()))
                .toList();
        return grabBest(item, releases);
    }

    /**
     * Looks for a season pack first and falls back to searching each missing episode.
     */
    public Optional<GrabResult> searchAndGrabSeason(Long seriesId, int season) {
        WantedSeries series = libraryService.findSeries(seriesId)
                .orElseThrow(() -> ApiError.GENERIC_BAD_REQUEST.createException("Series not found with ID: " + seriesId));
        DownloadTarget target = DownloadTarget.seasonPack(seriesId, season);
        if (downloadService.hasActive(target)) {
            return Optional.empty();
        }
        List<WantedItem> episodes = libraryService.findEpisodesInSeason(seriesId, season);

        List<Release> packs = indexerService.searchTv(series.getTitle(), season, null, SearchType.AUTOMATIC).stream()
                .filter(r -> ReleaseParser.parseSeasonPack(r.getTitle()).map(s -> s == season).orElse(false))
                .filter(r -> titleMatcher.matches(r.getTitle(), series.getTitle(), null, appProperties.getMatching().getAutoSearch()))
                .toList();
        Optional<ScoredRelease> best = rank(packs, MediaKind.SEASON, series.getQualityProfileId(),
                r -> decisionService.evaluateSeasonPack(r, series.getQualityProfileId(), target, episodes));
        if (best.isPresent()) {
            return Optional.of(grabService.grab(best.get().release(), target, null));
        }

        Optional<GrabResult> last = Optional.empty();
        for (WantedItem episode : episodes) {
            if (episode.isMonitored() && !episode.isHasFile()) {
                Optional<GrabResult> result = searchAndGrabEpisode(seriesId, season, episode.getTarget().episode());
                if (result.isPresent()) {
                    last = result;
                }
            }
        }
        return last;
    }

    /**
     * New search for a target whose download failed. The failed release is already blacklisted.
     */
    public Optional<GrabResult> retry(DownloadTarget target) {
        return switch (target.kind()) {
            case MOVIE -> searchAndGrabMovie(target.movieId(), true);
            case EPISODE -> searchAndGrabEpisode(target.seriesId(), target.season(), target.episode());
            case SEASON -> searchAndGrabSeason(target.seriesId(), target.season());
        };
    }

    public int searchAllMissing() {
        int grabbed = 0;
        for (WantedItem movie : libraryService.findMissingMovies()) {
            grabbed += isolate(movie, () -> searchAndGrabMovie(movie.getTarget().movieId(), false));
        }
        for (WantedItem episode : libraryService.findMissingEpisodes()) {
            DownloadTarget t = episode.getTarget();
            grabbed += isolate(episode, () -> searchAndGrabEpisode(t.seriesId(), t.season(), t.episode()));
        }
        log.info("[SEARCH] Missing search finished, {} release(s) grabbed", grabbed);
        return grabbed;
    }

    public int searchCutoffUnmet() {
        int grabbed = 0;
        for (WantedItem movie : libraryService.findMoviesWithFiles()) {
            if (isBelowCutoff(movie)) {
                grabbed += isolate(movie, () -> searchAndGrabMovie(movie.getTarget().movieId(), false));
            }
        }
        for (WantedItem episode : libraryService.findEpisodesWithFiles()) {
            if (isBelowCutoff(episode)) {
                DownloadTarget t = episode.getTarget();
                grabbed += isolate(episode, () -> searchAndGrabEpisode(t.seriesId(), t.season(), t.episode()));
            }
        }
        log.info("[SEARCH] Cutoff unmet search finished, {} upgrade(s) grabbed", grabbed);
        return grabbed;
    }

    private boolean isBelowCutoff(WantedItem item) {
        return item.isMonitored()
                && qualityProfileOracle.isUpgradeAllowed(item.getQualityProfileId())
                && !qualityProfileOracle.meetsCutoff(item.getQualityProfileId(), item.getCurrentQuality());
    }

    private int isolate(WantedItem item, Supplier<Optional<GrabResult>> search) {
        try {
            return search.get().filter(GrabResult::isGrabbed).isPresent() ? 1 : 0;
        } catch (Exception e) {
            log.error("[SEARCH] Search for {} failed: {}", item.getTarget().describe(), e.getMessage(), e);
            return 0;
        }
    }

    private Optional<GrabResult> grabBest(WantedItem item, List<Release> releases) {
        Set<String> blacklisted = blacklistService.blacklistedTitles(item.getTarget());
        Optional<ScoredRelease> best = rank(releases, item.getTarget().kind(), item.getQualityProfileId(),
                r -> decisionService.evaluate(r, item, blacklisted));
        if (best.isEmpty()) {
            log.info("[SEARCH] No acceptable release for {} among {} result(s)", item.getTarget().describe(), releases.size());
            return Optional.empty();
        }
        log.info("[SEARCH] Best release for {}: '{}' (score {})", item.getTarget().describe(), best.get().release().getTitle(), best.get().totalScore());
        return Optional.of(grabService.grab(best.get().release(), item.getTarget(), null));
    }

    Optional<ScoredRelease> rank(List<Release> releases, MediaKind kind, Long profileId, Function<Release, ReleaseDecision> decide) {
        return releases.stream()
                .map(release -> {
                    ReleaseDecision decision = decide.apply(release);
                    if (!decision.accepted()) {
                        log.debug("[SEARCH] Rejected '{}': {}", release.getTitle(), decision.rejectionReason());
                        return null;
                    }
                    return new ScoredRelease(release, releaseScorer.baseScore(release, profileId, kind), decision.formatScore());
                })
                .filter(Objects::nonNull)
                .max(RANKING);
    }
}
