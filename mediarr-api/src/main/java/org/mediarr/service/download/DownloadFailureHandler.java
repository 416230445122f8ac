package org.mediarr.service.download;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.config.AppProperties;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.dto.GrabResult;
import org.mediarr.model.dto.Notification;
import org.mediarr.model.entity.DownloadClientEntity;
import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.ActivityEventType;
import org.mediarr.model.enums.NotificationEvent;
import org.mediarr.service.activity.ActivityLogService;
import org.mediarr.service.download.client.DownloadClientService;
import org.mediarr.service.notification.NotificationService;
import org.mediarr.service.search.AutoSearchService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Moves a download to FAILED, blacklists its release for the target and optionally starts a new
 * search. The blacklist entry is written before the retry so the retry cannot pick the same release.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadFailureHandler {

    private final DownloadService downloadService;
    private final BlacklistService blacklistService;
    private final DownloadClientService downloadClientService;
    private final ActivityLogService activityLogService;
    private final NotificationService notificationService;
    private final AutoSearchService autoSearchService;
    private final AppProperties appProperties;
    private final @Qualifier("taskExecutor") AsyncTaskExecutor taskExecutor;

    public void handleFailure(DownloadEntity download, String reason) {
        DownloadTarget target = DownloadTarget.of(download);
        downloadService.markFailed(download, reason);
        log.warn("[DownloadSync] Download {} '{}' failed: {}", download.getId(), download.getTitle(), reason);

        blacklistService.add(target, download.getTitle(), download.getIndexer(), reason);
        activityLogService.log(ActivityEventType.DOWNLOAD_FAILED, download, "Download failed: " + reason);
        notificationService.notify(Notification.builder()
                .event(NotificationEvent.ON_DOWNLOAD_FAILURE)
                .title("Download failed")
                .message(download.getTitle() + ": " + reason)
                .mediaType(download.getMediaKind())
                .mediaTitle(download.getTitle())
                .build());

        removeFromClient(download);

        if (appProperties.getDownload().isRedownloadFailed()) {
            scheduleRedownload(download, target);
        }
    }

    /**
     * Runs the retry search on the task executor. Its outcome, including any exception, ends up in
     * the log and the activity log.
     */
    CompletableFuture<Optional<GrabResult>> scheduleRedownload(DownloadEntity download, DownloadTarget target) {
        log.info("[Redownload] Searching for a replacement for {}", target.describe());
        activityLogService.log(ActivityEventType.REDOWNLOAD_STARTED, download, "Searching for a replacement release");
        return CompletableFuture.supplyAsync(() -> autoSearchService.retry(target), taskExecutor)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("[Redownload] Retry search for {} failed: {}", target.describe(), error.getMessage(), error);
                        activityLogService.log(ActivityEventType.REDOWNLOAD_FAILED, download,
                                "Redownload search failed", Map.of("error", String.valueOf(error.getMessage())));
                    } else if (result.isPresent() && result.get().isGrabbed()) {
                        log.info("[Redownload] Grabbed replacement '{}' for {}", result.get().download().getTitle(), target.describe());
                    } else {
                        log.info("[Redownload] No replacement release found for {}", target.describe());
                    }
                });
    }

    private void removeFromClient(DownloadEntity download) {
        if (download.getDownloadClientId() == null || download.getDownloadHandle() == null) {
            return;
        }
        Optional<DownloadClientEntity> client = downloadClientService.findClient(download.getDownloadClientId());
        if (client.isEmpty() || !client.get().isRemoveFailed()) {
            return;
        }
        try {
            downloadClientService.remove(download.getDownloadClientId(), download.getDownloadHandle(), true);
        } catch (Exception e) {
            log.warn("[DownloadSync] Failed to remove failed download '{}' from client: {}", download.getTitle(), e.getMessage());
        }
    }
}
