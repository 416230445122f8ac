package org.mediarr.service.download;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.ActivityEventType;
import org.mediarr.model.enums.DownloadStatus;
import org.mediarr.model.enums.GrabOutcome;
import org.mediarr.repository.DownloadRepository;
import org.mediarr.service.activity.ActivityLogService;
import org.mediarr.service.download.client.DownloadClientService;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadService {

    private static final Set<DownloadStatus> URL_BLOCKING = EnumSet.complementOf(EnumSet.of(DownloadStatus.FAILED));

    private final DownloadRepository downloadRepository;
    private final DownloadClientService downloadClientService;
    private final ActivityLogService activityLogService;
    private final ReentrantLock createLock = new ReentrantLock();

    public record Creation(GrabOutcome outcome, DownloadEntity download) {
    }

    /**
     * Persists a new queued download unless the target already has an active one or the same URL is
     * already known. Check and insert run under one lock so concurrent RSS and manual grabs cannot
     * both pass the check.
     */
    public Creation createIfIdle(DownloadTarget target, DownloadEntity candidate) {
        createLock.lock();
        try {
            Optional<DownloadEntity> active = findActive(target);
            if (active.isPresent()) {
                log.debug("Active download {} already exists for {}", active.get().getId(), target.describe());
                return new Creation(GrabOutcome.ACTIVE_DOWNLOAD_EXISTS, active.get());
            }
            if (candidate.getDownloadUrl() != null && downloadRepository.existsByDownloadUrlAndStatusIn(candidate.getDownloadUrl(), URL_BLOCKING)) {
                log.debug("Download URL already known for '{}'", candidate.getTitle());
                return new Creation(GrabOutcome.ALREADY_DOWNLOADING, null);
            }
            candidate.setMediaKind(target.kind());
            candidate.setMovieId(target.movieId());
            candidate.setSeriesId(target.seriesId());
            candidate.setSeasonNumber(target.season());
            candidate.setEpisodeNumber(target.episode());
            candidate.setStatus(DownloadStatus.QUEUED);
            return new Creation(GrabOutcome.GRABBED, downloadRepository.save(candidate));
        } finally {
            createLock.unlock();
        }
    }

    /**
     * An episode is also covered by an active pack of its season, and a season pack by any active
     * download in that season.
     */
    public Optional<DownloadEntity> findActive(DownloadTarget target) {
        return switch (target.kind()) {
            case MOVIE -> downloadRepository.findFirstByMovieIdAndStatusIn(target.movieId(), DownloadStatus.ACTIVE);
            case EPISODE -> downloadRepository.findActiveForEpisode(target.seriesId(), target.season(), target.episode(), DownloadStatus.ACTIVE)
                    .stream().findFirst();
            case SEASON -> downloadRepository.findBySeriesIdAndSeasonNumberAndStatusIn(target.seriesId(), target.season(), DownloadStatus.ACTIVE)
                    .stream().findFirst();
        };
    }

    public boolean hasActive(DownloadTarget target) {
        return findActive(target).isPresent();
    }

    public DownloadEntity getDownload(Long id) {
        return downloadRepository.findById(id).orElseThrow(() -> ApiError.DOWNLOAD_NOT_FOUND.createException(id));
    }

    public List<DownloadEntity> getDownloads() {
        return downloadRepository.findAllByOrderByCreatedAtDesc();
    }

    public List<DownloadEntity> getActiveDownloads() {
        return downloadRepository.findByStatusInOrderByCreatedAtAsc(DownloadStatus.ACTIVE);
    }

    public DownloadEntity save(DownloadEntity download) {
        return downloadRepository.save(download);
    }

    public boolean exists(Long id) {
        return downloadRepository.existsById(id);
    }

    public DownloadEntity markFailed(DownloadEntity download, String message) {
        download.setStatus(DownloadStatus.FAILED);
        download.setErrorMessage(message);
        return downloadRepository.save(download);
    }

    /**
     * Removes the download from its client and deletes the row. A sync tick that later misses the
     * item in the client finds no row and skips it.
     */
    public void cancel(Long downloadId, boolean deleteFiles) {
        DownloadEntity download = getDownload(downloadId);
        if (download.getDownloadClientId() != null && download.getDownloadHandle() != null) {
            try {
                boolean removed = downloadClientService.remove(download.getDownloadClientId(), download.getDownloadHandle(), deleteFiles);
                if (!removed) {
                    log.warn("[Cancel] Client did not confirm removal of '{}'", download.getTitle());
                }
            } catch (Exception e) {
                log.warn("[Cancel] Failed to remove '{}' from client: {}", download.getTitle(), e.getMessage());
            }
        }
        activityLogService.log(ActivityEventType.DOWNLOAD_CANCELLED, download, "Download cancelled: " + download.getTitle());
        downloadRepository.delete(download);
        log.info("[Cancel] Deleted download {} '{}'", download.getId(), download.getTitle());
    }
}
