package org.mediarr.service.rss;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.config.AppProperties;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.dto.GrabResult;
import org.mediarr.model.dto.ParsedEpisode;
import org.mediarr.model.dto.Release;
import org.mediarr.model.dto.ReleaseDecision;
import org.mediarr.model.dto.RssSyncResult;
import org.mediarr.model.dto.WantedItem;
import org.mediarr.model.dto.WantedSeries;
import org.mediarr.model.entity.IndexerEntity;
import org.mediarr.model.enums.IndexerCapability;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.service.download.GrabService;
import org.mediarr.service.indexer.IndexerCategories;
import org.mediarr.service.indexer.IndexerService;
import org.mediarr.service.library.LibraryService;
import org.mediarr.service.release.ReleaseParser;
import org.mediarr.service.release.TitleMatchOptions;
import org.mediarr.service.release.TitleMatcher;
import org.mediarr.service.search.ReleaseDecisionService;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pulls every RSS-enabled indexer, caches new feed items and grabs the ones that match a monitored
 * movie, episode or season. Feeds only pass through the indexer rate limiter, not the search queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RssSyncService {

    private final IndexerService indexerService;
    private final RssCacheService rssCacheService;
    private final LibraryService libraryService;
    private final ReleaseDecisionService decisionService;
    private final GrabService grabService;
    private final TitleMatcher titleMatcher;
    private final AppProperties appProperties;
    private final ReentrantLock syncLock = new ReentrantLock();

    private record Wanted(List<WantedItem> movies, List<WantedSeries> series) {
    }

    public RssSyncResult syncAll() {
        if (!syncLock.tryLock()) {
            log.info("[RSS] Sync already in progress, skipping this run");
            return RssSyncResult.skipped();
        }
        try {
            return doSync();
        } finally {
            syncLock.unlock();
        }
    }

    private RssSyncResult doSync() {
        List<IndexerEntity> indexers = indexerService.getIndexers(IndexerCapability.RSS);
        if (indexers.isEmpty()) {
            log.debug("[RSS] No RSS-enabled indexers");
            return RssSyncResult.skipped();
        }
        Wanted wanted = new Wanted(libraryService.findMonitoredMovies(), libraryService.findMonitoredSeries());

        int found = 0;
        int fresh = 0;
        int grabbed = 0;
        for (IndexerEntity indexer : indexers) {
            List<Release> releases = indexerService.fetchRss(indexer);
            found += releases.size();
            for (Release release : releases) {
                try {
                    if (!rssCacheService.cacheIfNew(indexer.getId(), release)) {
                        continue;
                    }
                    fresh++;
                    if (process(release, wanted)) {
                        rssCacheService.markGrabbed(indexer.getId(), release.getGuid());
                        grabbed++;
                    } else {
                        rssCacheService.markProcessed(indexer.getId(), release.getGuid());
                    }
                } catch (Exception e) {
                    log.warn("[RSS] Skipping item '{}' from {}: {}", release.getTitle(), indexer.getName(), e.getMessage());
                }
            }
        }

        rssCacheService.purgeOlderThan(appProperties.getRss().getCacheRetentionDays());
        log.info("[RSS] Checked {} indexer(s): {} items, {} new, {} grabbed", indexers.size(), found, fresh, grabbed);
        return new RssSyncResult(indexers.size(), found, fresh, grabbed);
    }

    /**
     * Episode titles go to the series list, season packs next, anything else to the movies; each path
     * requires a matching indexer category. Every title-matching candidate is tried until one is grabbed.
     */
    private boolean process(Release release, Wanted wanted) {
        String title = release.getTitle();
        Optional<ParsedEpisode> episode = ReleaseParser.parseEpisode(title);
        if (episode.isPresent()) {
            return isTvCategory(release) && tryEpisode(release, episode.get(), wanted.series());
        }
        Optional<Integer> seasonPack = ReleaseParser.parseSeasonPack(title);
        if (seasonPack.isPresent()) {
            return isTvCategory(release) && trySeasonPack(release, seasonPack.get(), wanted.series());
        }
        return isMovieCategory(release) && tryMovie(release, wanted.movies());
    }

    private boolean tryMovie(Release release, List<WantedItem> movies) {
        for (WantedItem movie : movies) {
            if (!titleMatcher.matches(release.getTitle(), movie.getTitle(), movie.getYear(), options())) {
                continue;
            }
            if (libraryService.isExcluded(movie.getExternalId(), MediaKind.MOVIE)) {
                continue;
            }
            ReleaseDecision decision = decisionService.evaluate(release, movie);
            if (!decision.accepted()) {
                log.debug("[RSS] '{}' matches '{}' but was rejected: {}", release.getTitle(), movie.getTitle(), decision.rejectionReason());
                continue;
            }
            if (grab(release, movie.getTarget())) {
                return true;
            }
        }
        return false;
    }

    private boolean tryEpisode(Release release, ParsedEpisode parsed, List<WantedSeries> seriesList) {
        for (WantedSeries series : seriesList) {
            if (!titleMatcher.matches(release.getTitle(), series.getTitle(), null, options())) {
                continue;
            }
            if (libraryService.isExcluded(series.getExternalId(), MediaKind.EPISODE)) {
                continue;
            }
            Optional<WantedItem> episode = libraryService.findEpisode(series.getId(), parsed.season(), parsed.episode());
            if (episode.isEmpty() || !episode.get().isMonitored()) {
                continue;
            }
            ReleaseDecision decision = decisionService.evaluate(release, episode.get());
            if (!decision.accepted()) {
                log.debug("[RSS] '{}' rejected for {}: {}", release.getTitle(), episode.get().getTarget().describe(), decision.rejectionReason());
                continue;
            }
            if (grab(release, episode.get().getTarget())) {
                return true;
            }
        }
        return false;
    }

    private boolean trySeasonPack(Release release, int season, List<WantedSeries> seriesList) {
        for (WantedSeries series : seriesList) {
            if (!titleMatcher.matches(release.getTitle(), series.getTitle(), null, options())) {
                continue;
            }
            if (libraryService.isExcluded(series.getExternalId(), MediaKind.EPISODE)) {
                continue;
            }
            DownloadTarget target = DownloadTarget.seasonPack(series.getId(), season);
            List<WantedItem> episodes = libraryService.findEpisodesInSeason(series.getId(), season);
            ReleaseDecision decision = decisionService.evaluateSeasonPack(release, series.getQualityProfileId(), target, episodes);
            if (!decision.accepted()) {
                log.debug("[RSS] Season pack '{}' rejected: {}", release.getTitle(), decision.rejectionReason());
                continue;
            }
            if (grab(release, target)) {
                return true;
            }
        }
        return false;
    }

    private boolean grab(Release release, DownloadTarget target) {
        GrabResult result = grabService.grab(release, target, null);
        if (result.isGrabbed()) {
            log.info("[RSS] Grabbed '{}' for {}", release.getTitle(), target.describe());
            return true;
        }
        log.debug("[RSS] Did not grab '{}': {}", release.getTitle(), result.outcome());
        return false;
    }

    private TitleMatchOptions options() {
        return appProperties.getMatching().getRss();
    }

    private static boolean isMovieCategory(Release release) {
        return release.getCategoryCodes() == null || release.getCategoryCodes().isEmpty()
                || release.getCategoryCodes().stream().anyMatch(IndexerCategories::isMovie);
    }

    private static boolean isTvCategory(Release release) {
        return release.getCategoryCodes() == null || release.getCategoryCodes().isEmpty()
                || release.getCategoryCodes().stream().anyMatch(IndexerCategories::isTv);
    }
}
