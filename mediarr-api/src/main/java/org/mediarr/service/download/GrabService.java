package org.mediarr.service.download;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.AddDownloadRequest;
import org.mediarr.model.dto.AddDownloadResult;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.dto.GrabResult;
import org.mediarr.model.dto.Notification;
import org.mediarr.model.dto.Release;
import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.ActivityEventType;
import org.mediarr.model.enums.DownloadStatus;
import org.mediarr.model.enums.GrabOutcome;
import org.mediarr.model.enums.NotificationEvent;
import org.mediarr.service.release.ReleaseParser;
import org.mediarr.service.activity.ActivityLogService;
import org.mediarr.service.download.client.DownloadClientService;
import org.mediarr.service.notification.NotificationService;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Turns a chosen release into a persisted download and hands it to a download client.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GrabService {

    private final DownloadService downloadService;
    private final BlacklistService blacklistService;
    private final DownloadClientService downloadClientService;
    private final ActivityLogService activityLogService;
    private final NotificationService notificationService;

    /**
     * Background grab used by RSS sync and automatic search. Duplicates and blacklisted releases are
     * reported through the outcome rather than thrown.
     */
    public GrabResult grab(Release release, DownloadTarget target, Long clientId) {
        if (blacklistService.isBlacklisted(target, release.getTitle())) {
            log.debug("Skipping blacklisted release '{}' for {}", release.getTitle(), target.describe());
            return new GrabResult(GrabOutcome.BLACKLISTED, null, "Release is blacklisted");
        }

        DownloadService.Creation creation = downloadService.createIfIdle(target, toDownload(release));
        if (creation.outcome() != GrabOutcome.GRABBED) {
            return new GrabResult(creation.outcome(), creation.download(), describe(creation.outcome(), target));
        }
        DownloadEntity download = creation.download();

        AddDownloadResult added = downloadClientService.addDownload(AddDownloadRequest.builder()
                .url(release.getDownloadUrl())
                .title(release.getTitle())
                .mediaKind(target.kind())
                .clientId(clientId)
                .protocol(release.getProtocol())
                .build());
        if (!added.isSuccess()) {
            String message = added.getMessage() != null ? added.getMessage() : "Download client rejected the release";
            downloadService.markFailed(download, message);
            log.warn("Download client rejected '{}': {}", release.getTitle(), message);
            return new GrabResult(GrabOutcome.CLIENT_REJECTED, download, message);
        }

        download.setDownloadHandle(added.getDownloadId());
        download.setDownloadClientId(added.getClientId());
        download.setStatus(DownloadStatus.DOWNLOADING);
        download = downloadService.save(download);

        log.info("Grabbed '{}' ({}) from {} for {}", release.getTitle(), release.getQuality(), release.getIndexer(), target.describe());
        activityLogService.log(ActivityEventType.GRABBED, download, "Grabbed " + release.getTitle(),
                Map.of("protocol", String.valueOf(release.getProtocol())));
        notificationService.notify(Notification.builder()
                .event(NotificationEvent.ON_GRAB)
                .title("Release grabbed")
                .message(release.getTitle())
                .mediaType(target.kind())
                .mediaTitle(ReleaseParser.extractTitlePrefix(release.getTitle()))
                .build());
        return new GrabResult(GrabOutcome.GRABBED, download, "Download started");
    }

    /**
     * Grab requested by a user. Anything other than a successful grab becomes an error response.
     */
    public DownloadEntity grabInteractive(Release release, DownloadTarget target, Long clientId) {
        GrabResult result = grab(release, target, clientId);
        return switch (result.outcome()) {
            case GRABBED -> result.download();
            case ACTIVE_DOWNLOAD_EXISTS -> throw ApiError.ACTIVE_DOWNLOAD_EXISTS.createException(target.describe());
            case ALREADY_DOWNLOADING -> throw ApiError.RELEASE_ALREADY_DOWNLOADING.createException(release.getTitle());
            case BLACKLISTED -> throw ApiError.RELEASE_BLACKLISTED.createException(release.getTitle());
            case CLIENT_REJECTED -> throw ApiError.DOWNLOAD_CLIENT_ERROR.createException(result.message());
        };
    }

    private DownloadEntity toDownload(Release release) {
        return DownloadEntity.builder()
                .title(release.getTitle())
                .downloadUrl(release.getDownloadUrl())
                .size(release.getSize())
                .seeders(release.getSeeders())
                .indexer(release.getIndexer())
                .quality(release.getQuality())
                .protocol(release.getProtocol())
                .build();
    }

    private String describe(GrabOutcome outcome, DownloadTarget target) {
        return switch (outcome) {
            case ACTIVE_DOWNLOAD_EXISTS -> "An active download already exists for " + target.describe();
            case ALREADY_DOWNLOADING -> "This release is already downloading";
            default -> outcome.name();
        };
    }
}
