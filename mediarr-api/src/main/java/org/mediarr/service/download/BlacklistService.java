package org.mediarr.service.download;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.entity.ReleaseBlacklistEntity;
import org.mediarr.repository.ReleaseBlacklistRepository;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Releases that must never be grabbed again for a target. Entries are compared by case-insensitive
 * exact title and never expire.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlacklistService {

    private final ReleaseBlacklistRepository blacklistRepository;

    public boolean isBlacklisted(DownloadTarget target, String releaseTitle) {
        if (releaseTitle == null) {
            return false;
        }
        if (target.isMovie()) {
            return blacklistRepository.existsForMovie(target.movieId(), releaseTitle);
        }
        return blacklistRepository.existsForEpisode(target.seriesId(), target.season(), target.episode(), releaseTitle);
    }

    /**
     * Lowercased blacklisted titles relevant to a target, for filtering a whole result list at once.
     */
    public Set<String> blacklistedTitles(DownloadTarget target) {
        List<String> titles = target.isMovie()
                ? blacklistRepository.findTitlesForMovie(target.movieId())
                : blacklistRepository.findTitlesForEpisode(target.seriesId(), target.season(), target.episode());
        return new HashSet<>(titles);
    }

    public ReleaseBlacklistEntity add(DownloadTarget target, String releaseTitle, String indexer, String reason) {
        ReleaseBlacklistEntity entry = blacklistRepository.save(ReleaseBlacklistEntity.builder()
                .movieId(target.movieId())
                .seriesId(target.seriesId())
                .seasonNumber(target.season())
                .episodeNumber(target.episode())
                .releaseTitle(releaseTitle)
                .indexer(indexer)
                .reason(reason)
                .build());
        log.info("Blacklisted '{}' for {}: {}", releaseTitle, target.describe(), reason);
        return entry;
    }

    public List<ReleaseBlacklistEntity> getAll() {
        return blacklistRepository.findAllByOrderByCreatedAtDesc();
    }

    public void remove(Long id) {
        if (!blacklistRepository.existsById(id)) {
            throw ApiError.BLACKLIST_ENTRY_NOT_FOUND.createException(id);
        }
        blacklistRepository.deleteById(id);
    }

    public int clearForMovie(Long movieId) {
        return blacklistRepository.deleteByMovieId(movieId);
    }

    public int clearForSeries(Long seriesId) {
        return blacklistRepository.deleteBySeriesId(seriesId);
    }
}
