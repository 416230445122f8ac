package org.mediarr.service.download;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mediarr.config.AppProperties;
import org.mediarr.exception.APIException;
import org.mediarr.model.dto.ClientDownload;
import org.mediarr.model.dto.ImportResult;
import org.mediarr.model.dto.ImportedFile;
import org.mediarr.model.dto.SyncResult;
import org.mediarr.model.entity.DownloadClientEntity;
import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.ActivityEventType;
import org.mediarr.model.enums.ClientDownloadState;
import org.mediarr.model.enums.DownloadClientType;
import org.mediarr.model.enums.DownloadStatus;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.repository.DownloadRepository;
import org.mediarr.service.activity.ActivityLogService;
import org.mediarr.service.download.client.DownloadClientService;
import org.mediarr.service.importer.ImportService;
import org.mediarr.service.notification.NotificationService;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DownloadSyncServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    @Mock
    private DownloadRepository downloadRepository;

    @Mock
    private DownloadService downloadService;

    @Mock
    private DownloadClientService downloadClientService;

    @Mock
    private DownloadFailureHandler failureHandler;

    @Mock
    private ImportService importService;

    @Mock
    private ActivityLogService activityLogService;

    @Mock
    private NotificationService notificationService;

    private AppProperties appProperties;
    private DownloadSyncService syncService;
    private DownloadClientEntity client;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        syncService = new DownloadSyncService(downloadRepository, downloadService, downloadClientService, failureHandler,
                importService, activityLogService, notificationService, appProperties, Clock.fixed(NOW, ZoneOffset.UTC));
        client = DownloadClientEntity.builder().id(1L).name("qBit").type(DownloadClientType.QBITTORRENT).build();
        lenient().when(downloadClientService.findClient(1L)).thenReturn(Optional.of(client));
        lenient().when(downloadService.exists(5L)).thenReturn(true);
    }

    private static DownloadEntity download(DownloadStatus status, String handle) {
        return DownloadEntity.builder()
                .id(5L)
                .mediaKind(MediaKind.MOVIE)
                .movieId(42L)
                .title("Arrival.2016.1080p.BluRay.x264-GRP")
                .status(status)
                .downloadHandle(handle)
                .downloadClientId(1L)
                .createdAt(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).minusMinutes(5))
                .build();
    }

    private static ClientDownload item(String handle, ClientDownloadState state, double progress) {
        return ClientDownload.builder()
                .handle(handle)
                .name("Arrival.2016.1080p.BluRay.x264-GRP")
                .state(state)
                .rawState(state.name().toLowerCase())
                .progress(progress)
                .savePath("/downloads/movies")
                .build();
    }

    private void tracked(DownloadEntity download, ClientDownload... items) {
        when(downloadRepository.findByStatusInOrderByCreatedAtAsc(DownloadSyncService.SYNCED_STATUSES)).thenReturn(List.of(download));
        when(downloadClientService.listActive(client)).thenReturn(List.of(items));
    }

    @Test
    void syncAll_updatesProgressAndPromotesQueued() {
        DownloadEntity download = download(DownloadStatus.QUEUED, "abc");
        tracked(download, item("ABC", ClientDownloadState.DOWNLOADING, 37.5));

        SyncResult result = syncService.syncAll();

        assertThat(result).isEqualTo(new SyncResult(1, 0, 0));
        assertThat(download.getStatus()).isEqualTo(DownloadStatus.DOWNLOADING);
        assertThat(download.getProgress()).isEqualTo(37.5);
        verify(downloadService).save(download);
    }

    @Test
    void syncAll_completedDownloadIsImported() {
        DownloadEntity download = download(DownloadStatus.DOWNLOADING, "abc");
        ClientDownload finished = item("abc", ClientDownloadState.COMPLETED, 100);
        tracked(download, finished);
        when(importService.importDownload(download, finished)).thenReturn(new ImportResult(List.of(
                ImportedFile.builder().path("/media/movies/Arrival (2016)/Arrival.mkv").build())));

        SyncResult result = syncService.syncAll();

        assertThat(result.completed()).isEqualTo(1);
        assertThat(download.getStatus()).isEqualTo(DownloadStatus.IMPORTED);
        assertThat(download.getSavePath()).isEqualTo("/downloads/movies");
        assertThat(download.getCompletedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        verify(activityLogService).log(eq(ActivityEventType.DOWNLOAD_COMPLETED), eq(download), anyString());
        verify(activityLogService).log(eq(ActivityEventType.IMPORTED), eq(download), anyString(), anyMap());
        verify(downloadClientService, never()).remove(any(), any(), anyBoolean());
    }

    @Test
    void syncAll_completedWithoutAutoImportWaits() {
        appProperties.getDownload().setAutoImport(false);
        DownloadEntity download = download(DownloadStatus.DOWNLOADING, "abc");
        tracked(download, item("abc", ClientDownloadState.COMPLETED, 100));

        syncService.syncAll();

        assertThat(download.getStatus()).isEqualTo(DownloadStatus.COMPLETED);
        verify(importService, never()).importDownload(any(), any());
    }

    @Test
    void syncAll_importErrorFailsDownload() {
        DownloadEntity download = download(DownloadStatus.DOWNLOADING, "abc");
        ClientDownload finished = item("abc", ClientDownloadState.COMPLETED, 100);
        tracked(download, finished);
        when(importService.importDownload(download, finished)).thenThrow(new IllegalStateException("no video files"));

        SyncResult result = syncService.syncAll();

        assertThat(result.failed()).isEqualTo(1);
        verify(failureHandler).handleFailure(download, "Import error: no video files");
    }

    @Test
    void syncAll_clientErrorFailsDownload() {
        DownloadEntity download = download(DownloadStatus.DOWNLOADING, "abc");
        tracked(download, item("abc", ClientDownloadState.FAILED, 12));

        syncService.syncAll();

        verify(failureHandler).handleFailure(eq(download), startsWith("Download client reported an error"));
    }

    @Test
    void syncAll_missingFromClientFailsDownload() {
        DownloadEntity download = download(DownloadStatus.DOWNLOADING, "abc");
        tracked(download, item("other", ClientDownloadState.DOWNLOADING, 10));
        when(downloadService.exists(5L)).thenReturn(true);

        syncService.syncAll();

        verify(failureHandler).handleFailure(download, "Download no longer present in client");
    }

    @Test
    void syncAll_cancelledDuringSyncIsNotAFailure() {
        DownloadEntity download = download(DownloadStatus.DOWNLOADING, "abc");
        tracked(download);
        when(downloadService.exists(5L)).thenReturn(false);

        SyncResult result = syncService.syncAll();

        assertThat(result.failed()).isZero();
        verify(failureHandler, never()).handleFailure(any(), anyString());
    }

    @Test
    void syncAll_progressIsNotSavedForDownloadCancelledMidSweep() {
        DownloadEntity download = download(DownloadStatus.DOWNLOADING, "abc");
        tracked(download, item("abc", ClientDownloadState.DOWNLOADING, 80));
        when(downloadService.exists(5L)).thenReturn(false);

        SyncResult result = syncService.syncAll();

        assertThat(result).isEqualTo(new SyncResult(1, 0, 0));
        verify(downloadService, never()).save(any());
    }

    @Test
    void syncAll_completionIsNotRecordedForDownloadCancelledMidSweep() {
        DownloadEntity download = download(DownloadStatus.DOWNLOADING, "abc");
        tracked(download, item("abc", ClientDownloadState.COMPLETED, 100));
        when(downloadService.exists(5L)).thenReturn(false);

        syncService.syncAll();

        verify(downloadService, never()).save(any());
        verify(importService, never()).importDownload(any(), any());
        verify(activityLogService, never()).log(any(), any(), anyString());
    }

    @Test
    void syncAll_interruptedImportIsRunAgain() {
        DownloadEntity download = download(DownloadStatus.IMPORTING, "abc");
        ClientDownload finished = item("abc", ClientDownloadState.COMPLETED, 100);
        tracked(download, finished);
        when(importService.importDownload(download, finished)).thenReturn(new ImportResult(List.of(
                ImportedFile.builder().path("/media/movies/Arrival (2016)/Arrival.mkv").build())));

        SyncResult result = syncService.syncAll();

        assertThat(result).isEqualTo(new SyncResult(1, 1, 0));
        assertThat(download.getStatus()).isEqualTo(DownloadStatus.IMPORTED);
        verify(activityLogService).log(eq(ActivityEventType.IMPORTED), eq(download), anyString(), anyMap());
    }

    @Test
    void syncAll_interruptedImportWithUnreachableClientStillRetries() {
        DownloadEntity download = download(DownloadStatus.IMPORTING, "abc");
        download.setSavePath("/downloads/gone");
        when(downloadRepository.findByStatusInOrderByCreatedAtAsc(DownloadSyncService.SYNCED_STATUSES)).thenReturn(List.of(download));
        when(downloadClientService.listActive(client)).thenThrow(new IllegalStateException("connection refused"));
        when(importService.importDownload(download, null)).thenThrow(new IllegalStateException("output not found"));

        SyncResult result = syncService.syncAll();

        assertThat(result).isEqualTo(new SyncResult(1, 0, 1));
        verify(failureHandler).handleFailure(download, "Import error: output not found");
    }

    @Test
    void syncAll_discoversHandleByTitle() {
        DownloadEntity download = download(DownloadStatus.QUEUED, null);
        tracked(download, item("f00d", ClientDownloadState.DOWNLOADING, 1));

        syncService.syncAll();

        assertThat(download.getDownloadHandle()).isEqualTo("f00d");
        assertThat(download.getStatus()).isEqualTo(DownloadStatus.DOWNLOADING);
    }

    @Test
    void syncAll_undiscoveredHandleFailsOnlyAfterTimeout() {
        DownloadEntity fresh = download(DownloadStatus.QUEUED, null);
        tracked(fresh);

        syncService.syncAll();
        verify(failureHandler, never()).handleFailure(any(), anyString());

        fresh.setCreatedAt(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).minusMinutes(31));
        syncService.syncAll();
        verify(failureHandler).handleFailure(fresh, "Download never appeared in the client");
    }

    @Test
    void syncAll_unreachableClientLeavesDownloadsAlone() {
        DownloadEntity download = download(DownloadStatus.DOWNLOADING, "abc");
        when(downloadRepository.findByStatusInOrderByCreatedAtAsc(DownloadSyncService.SYNCED_STATUSES)).thenReturn(List.of(download));
        when(downloadClientService.listActive(client)).thenThrow(new IllegalStateException("connection refused"));

        SyncResult result = syncService.syncAll();

        assertThat(result).isEqualTo(new SyncResult(1, 0, 0));
        verify(failureHandler, never()).handleFailure(any(), anyString());
        verify(downloadService, never()).save(any());
    }

    @Test
    void importCompleted_requiresCompletedStatus() {
        when(downloadService.getDownload(5L)).thenReturn(download(DownloadStatus.DOWNLOADING, "abc"));

        assertThatThrownBy(() -> syncService.importCompleted(5L)).isInstanceOf(APIException.class);
    }

    @Test
    void importCompleted_failedImportRaises() {
        DownloadEntity download = download(DownloadStatus.COMPLETED, "abc");
        when(downloadService.getDownload(5L)).thenReturn(download);
        when(downloadClientService.listActive(1L, null)).thenReturn(List.of());
        when(importService.importDownload(download, null)).thenThrow(new IllegalStateException("disk full"));

        assertThatThrownBy(() -> syncService.importCompleted(5L)).isInstanceOf(APIException.class);
        verify(failureHandler).handleFailure(download, "Import error: disk full");
    }
}
