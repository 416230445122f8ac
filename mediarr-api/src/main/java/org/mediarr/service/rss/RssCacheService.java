package org.mediarr.service.rss;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.model.dto.Release;
import org.mediarr.model.dto.RssCacheStats;
import org.mediarr.model.entity.RssReleaseEntity;
import org.mediarr.repository.RssReleaseRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Remembers feed items by indexer and guid so each one is matched only once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RssCacheService {

    private final RssReleaseRepository rssReleaseRepository;
    private final Clock clock;

    /**
     * Inserts the item unless it is already cached.
     *
     * @return true only when this call created the row
     */
    public boolean cacheIfNew(Long indexerId, Release release) {
        if (rssReleaseRepository.existsByIndexerIdAndGuid(indexerId, release.getGuid())) {
            return false;
        }
        try {
            rssReleaseRepository.saveAndFlush(RssReleaseEntity.builder()
                    .indexerId(indexerId)
                    .guid(release.getGuid())
                    .title(release.getTitle())
                    .downloadUrl(release.getDownloadUrl())
                    .size(release.getSize())
                    .seeders(release.getSeeders())
                    .publishDate(release.getPublishDate() != null ? LocalDateTime.ofInstant(release.getPublishDate(), ZoneId.systemDefault()) : null)
                    .categories(release.getCategories() != null ? String.join(",", release.getCategories()) : null)
                    .quality(release.getQuality())
                    .build());
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("[RSS] Item {} of indexer {} was cached concurrently", release.getGuid(), indexerId);
            return false;
        }
    }

    public void markGrabbed(Long indexerId, String guid) {
        rssReleaseRepository.findByIndexerIdAndGuid(indexerId, guid).ifPresent(entry -> {
            entry.setGrabbed(true);
            entry.setProcessed(true);
            rssReleaseRepository.save(entry);
        });
    }

    public void markProcessed(Long indexerId, String guid) {
        rssReleaseRepository.findByIndexerIdAndGuid(indexerId, guid).ifPresent(entry -> {
            entry.setProcessed(true);
            rssReleaseRepository.save(entry);
        });
    }

    @Transactional
    public int purgeOlderThan(int days) {
        int removed = rssReleaseRepository.deleteCreatedBefore(LocalDateTime.now(clock).minusDays(days));
        if (removed > 0) {
            log.info("[RSS] Purged {} cached items older than {} days", removed, days);
        }
        return removed;
    }

    public List<RssReleaseEntity> recent(int limit) {
        return rssReleaseRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    public RssCacheStats stats() {
        return new RssCacheStats(rssReleaseRepository.count(), rssReleaseRepository.countByProcessedTrue(), rssReleaseRepository.countByGrabbedTrue());
    }
}
