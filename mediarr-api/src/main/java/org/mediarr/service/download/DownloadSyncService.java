package org.mediarr.service.download;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.config.AppProperties;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.ClientDownload;
import org.mediarr.model.dto.ImportResult;
import org.mediarr.model.dto.ImportedFile;
import org.mediarr.model.dto.Notification;
import org.mediarr.model.dto.SyncResult;
import org.mediarr.model.entity.DownloadClientEntity;
import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.ActivityEventType;
import org.mediarr.model.enums.ClientDownloadState;
import org.mediarr.model.enums.DownloadStatus;
import org.mediarr.model.enums.NotificationEvent;
import org.mediarr.repository.DownloadRepository;
import org.mediarr.service.activity.ActivityLogService;
import org.mediarr.service.download.client.DownloadClientService;
import org.mediarr.service.importer.ImportService;
import org.mediarr.service.notification.NotificationService;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Polls download clients and advances each tracked download through its lifecycle. Every download
 * is synced in isolation, so one bad row never stops the rest of the tick.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadSyncService {

    static final Set<DownloadStatus> SYNCED_STATUSES = EnumSet.of(DownloadStatus.QUEUED, DownloadStatus.DOWNLOADING,
            DownloadStatus.COMPLETED, DownloadStatus.IMPORTING);

    private final Set<Long> importsInFlight = ConcurrentHashMap.newKeySet();

    private final DownloadRepository downloadRepository;
    private final DownloadService downloadService;
    private final DownloadClientService downloadClientService;
    private final DownloadFailureHandler failureHandler;
    private final ImportService importService;
    private final ActivityLogService activityLogService;
    private final NotificationService notificationService;
    private final AppProperties appProperties;
    private final Clock clock;

    private enum Step { UNCHANGED, PROGRESSED, COMPLETED, FAILED }

    public SyncResult syncAll() {
        List<DownloadEntity> downloads = downloadRepository.findByStatusInOrderByCreatedAtAsc(SYNCED_STATUSES);
        if (downloads.isEmpty()) {
            return new SyncResult(0, 0, 0);
        }
        Map<Long, List<ClientDownload>> listings = listClients(downloads);

        int synced = 0;
        int completed = 0;
        int failed = 0;
        for (DownloadEntity download : downloads) {
            try {
                Step step = sync(download, listings);
                synced++;
                if (step == Step.COMPLETED) {
                    completed++;
                } else if (step == Step.FAILED) {
                    failed++;
                }
            } catch (Exception e) {
                log.error("[DownloadSync] Failed to sync download {} '{}': {}", download.getId(), download.getTitle(), e.getMessage(), e);
            }
        }
        if (completed > 0 || failed > 0) {
            log.info("[DownloadSync] Synced {} downloads: {} completed, {} failed", synced, completed, failed);
        }
        return new SyncResult(synced, completed, failed);
    }

    /**
     * Imports a download that finished while auto-import was off.
     */
    public ImportResult importCompleted(Long downloadId) {
        DownloadEntity download = downloadService.getDownload(downloadId);
        if (download.getStatus() != DownloadStatus.COMPLETED) {
            throw ApiError.GENERIC_BAD_REQUEST.createException("Download " + downloadId + " is " + download.getStatus() + ", not COMPLETED");
        }
        ClientDownload item = null;
        if (download.getDownloadClientId() != null && download.getDownloadHandle() != null) {
            item = downloadClientService.listActive(download.getDownloadClientId(), null).stream()
                    .filter(i -> download.getDownloadHandle().equalsIgnoreCase(i.getHandle()))
                    .findFirst()
                    .orElse(null);
        }
        ImportResult result = importDownload(download, item);
        if (result == null) {
            throw ApiError.IMPORT_FAILED.createException(download.getErrorMessage());
        }
        return result;
    }

    /**
     * One listing per client per tick. A client that cannot be listed is left out and its downloads
     * stay untouched until the next tick.
     */
    private Map<Long, List<ClientDownload>> listClients(List<DownloadEntity> downloads) {
        Map<Long, List<ClientDownload>> listings = new HashMap<>();
        downloads.stream()
                .map(DownloadEntity::getDownloadClientId)
                .filter(Objects::nonNull)
                .distinct()
                .forEach(clientId -> {
                    Optional<DownloadClientEntity> client = downloadClientService.findClient(clientId);
                    if (client.isEmpty() || !client.get().isEnabled()) {
                        log.debug("[DownloadSync] Client {} missing or disabled, skipping its downloads", clientId);
                        return;
                    }
                    try {
                        listings.put(clientId, downloadClientService.listActive(client.get()));
                    } catch (Exception e) {
                        log.warn("[DownloadSync] Could not list client {}: {}", client.get().getName(), e.getMessage());
                    }
                });
        return listings;
    }

    private Step sync(DownloadEntity download, Map<Long, List<ClientDownload>> listings) {
        if (download.getStatus() == DownloadStatus.IMPORTING) {
            return resumeImport(download, listings);
        }
        if (download.getDownloadClientId() == null) {
            return failIfDiscoveryExpired(download, "Download was never accepted by a client");
        }
        List<ClientDownload> items = listings.get(download.getDownloadClientId());
        if (items == null) {
            return Step.UNCHANGED;
        }

        Optional<ClientDownload> match = findItem(download, items);
        if (match.isEmpty()) {
            if (download.getDownloadHandle() == null) {
                return failIfDiscoveryExpired(download, "Download never appeared in the client");
            }
            if (!stillTracked(download)) {
                return Step.UNCHANGED;
            }
            if (download.getStatus() == DownloadStatus.COMPLETED) {
                return importOrWait(download, null);
            }
            failureHandler.handleFailure(download, "Download no longer present in client");
            return Step.FAILED;
        }

        if (!stillTracked(download)) {
            return Step.UNCHANGED;
        }
        ClientDownload item = match.get();
        if (download.getDownloadHandle() == null) {
            download.setDownloadHandle(item.getHandle());
            log.info("[DownloadSync] Discovered client handle {} for '{}'", item.getHandle(), download.getTitle());
        }

        if (item.getState() == ClientDownloadState.FAILED) {
            String reason = item.getErrorMessage() != null ? item.getErrorMessage() : "Download client reported an error (" + item.getRawState() + ")";
            failureHandler.handleFailure(download, reason);
            return Step.FAILED;
        }

        if (item.getState() == ClientDownloadState.COMPLETED) {
            if (download.getStatus() != DownloadStatus.COMPLETED) {
                markCompleted(download, item);
                Step step = importOrWait(download, item);
                return step == Step.FAILED ? Step.FAILED : Step.COMPLETED;
            }
            return importOrWait(download, item);
        }

        download.setProgress(item.getProgress());
        if (download.getStatus() == DownloadStatus.QUEUED && item.getState() == ClientDownloadState.DOWNLOADING) {
            download.setStatus(DownloadStatus.DOWNLOADING);
        }
        downloadService.save(download);
        return Step.PROGRESSED;
    }

    /**
     * An IMPORTING row that no import is working on was left behind by a restart mid-import; the
     * import is run again from the client's current view of the download.
     */
    private Step resumeImport(DownloadEntity download, Map<Long, List<ClientDownload>> listings) {
        if (importsInFlight.contains(download.getId()) || !stillTracked(download)) {
            return Step.UNCHANGED;
        }
        ClientDownload item = null;
        List<ClientDownload> items = listings.get(download.getDownloadClientId());
        if (items != null && download.getDownloadHandle() != null) {
            item = findItem(download, items).orElse(null);
        }
        log.warn("[DownloadSync] Resuming interrupted import of '{}'", download.getTitle());
        return importDownload(download, item) != null ? Step.COMPLETED : Step.FAILED;
    }

    /**
     * The sweep works on rows loaded at its start; a row cancelled since then must not be saved back.
     */
    private boolean stillTracked(DownloadEntity download) {
        if (downloadService.exists(download.getId())) {
            return true;
        }
        log.debug("[DownloadSync] Download {} was cancelled during sync", download.getId());
        return false;
    }

    private Optional<ClientDownload> findItem(DownloadEntity download, List<ClientDownload> items) {
        if (download.getDownloadHandle() != null) {
            return items.stream()
                    .filter(i -> download.getDownloadHandle().equalsIgnoreCase(i.getHandle()))
                    .findFirst();
        }
        return DownloadHandleMatcher.findByTitle(download.getTitle(), items);
    }

    private Step failIfDiscoveryExpired(DownloadEntity download, String reason) {
        LocalDateTime deadline = download.getCreatedAt().plusMinutes(appProperties.getDownload().getHandleDiscoveryTimeoutMinutes());
        if (LocalDateTime.now(clock).isAfter(deadline)) {
            failureHandler.handleFailure(download, reason);
            return Step.FAILED;
        }
        return Step.UNCHANGED;
    }

    private void markCompleted(DownloadEntity download, ClientDownload item) {
        download.setStatus(DownloadStatus.COMPLETED);
        download.setProgress(100d);
        download.setCompletedAt(LocalDateTime.now(clock));
        if (item.getSavePath() != null) {
            download.setSavePath(item.getSavePath());
        }
        downloadService.save(download);
        log.info("[DownloadSync] Download completed: '{}'", download.getTitle());
        activityLogService.log(ActivityEventType.DOWNLOAD_COMPLETED, download, "Download completed: " + download.getTitle());
        notificationService.notify(Notification.builder()
                .event(NotificationEvent.ON_DOWNLOAD)
                .title("Download completed")
                .message(download.getTitle())
                .mediaType(download.getMediaKind())
                .mediaTitle(download.getTitle())
                .build());
    }

    private Step importOrWait(DownloadEntity download, ClientDownload item) {
        if (!appProperties.getDownload().isAutoImport() || importsInFlight.contains(download.getId())) {
            return Step.UNCHANGED;
        }
        return importDownload(download, item) != null ? Step.COMPLETED : Step.FAILED;
    }

    /**
     * Returns null when the import failed, in which case the download has already been failed and
     * blacklisted, or when another import of the same download is running.
     */
    private ImportResult importDownload(DownloadEntity download, ClientDownload item) {
        if (download.getId() != null && !importsInFlight.add(download.getId())) {
            return null;
        }
        ImportResult result;
        try {
            download.setStatus(DownloadStatus.IMPORTING);
            downloadService.save(download);
            result = importService.importDownload(download, item);
        } catch (Exception e) {
            log.error("[Import] Import of '{}' failed: {}", download.getTitle(), e.getMessage());
            failureHandler.handleFailure(download, "Import error: " + e.getMessage());
            return null;
        } finally {
            if (download.getId() != null) {
                importsInFlight.remove(download.getId());
            }
        }

        download.setStatus(DownloadStatus.IMPORTED);
        downloadService.save(download);
        log.info("[Import] Imported {} file(s) for '{}'", result.files().size(), download.getTitle());
        activityLogService.log(ActivityEventType.IMPORTED, download, "Imported " + download.getTitle(),
                Map.of("files", result.files().stream().map(ImportedFile::getPath).toList()));
        notificationService.notify(Notification.builder()
                .event(NotificationEvent.ON_IMPORT)
                .title("Imported")
                .message(download.getTitle())
                .mediaType(download.getMediaKind())
                .mediaTitle(download.getTitle())
                .build());
        removeCompleted(download);
        return result;
    }

    private void removeCompleted(DownloadEntity download) {
        if (download.getDownloadClientId() == null || download.getDownloadHandle() == null) {
            return;
        }
        boolean remove = downloadClientService.findClient(download.getDownloadClientId())
                .map(DownloadClientEntity::isRemoveCompleted)
                .orElse(false);
        if (!remove) {
            return;
        }
        try {
            downloadClientService.remove(download.getDownloadClientId(), download.getDownloadHandle(), false);
        } catch (Exception e) {
            log.warn("[Import] Failed to remove '{}' from client after import: {}", download.getTitle(), e.getMessage());
        }
    }
}
