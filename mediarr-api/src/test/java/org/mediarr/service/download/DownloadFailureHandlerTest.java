package org.mediarr.service.download;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mediarr.config.AppProperties;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.dto.GrabResult;
import org.mediarr.model.dto.Notification;
import org.mediarr.model.entity.DownloadClientEntity;
import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.ActivityEventType;
import org.mediarr.model.enums.DownloadStatus;
import org.mediarr.model.enums.GrabOutcome;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.model.enums.NotificationEvent;
import org.mediarr.service.activity.ActivityLogService;
import org.mediarr.service.download.client.DownloadClientService;
import org.mediarr.service.notification.NotificationService;
import org.mediarr.service.search.AutoSearchService;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DownloadFailureHandlerTest {

    @Mock
    private DownloadService downloadService;

    @Mock
    private BlacklistService blacklistService;

    @Mock
    private DownloadClientService downloadClientService;

    @Mock
    private ActivityLogService activityLogService;

    @Mock
    private NotificationService notificationService;

    @Mock
    private AutoSearchService autoSearchService;

    private AppProperties appProperties;
    private DownloadFailureHandler handler;
    private DownloadEntity download;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        handler = new DownloadFailureHandler(downloadService, blacklistService, downloadClientService, activityLogService,
                notificationService, autoSearchService, appProperties, new TaskExecutorAdapter(Runnable::run));
        download = DownloadEntity.builder()
                .id(9L)
                .mediaKind(MediaKind.EPISODE)
                .seriesId(3L)
                .seasonNumber(1)
                .episodeNumber(4)
                .title("Show.S01E04.1080p.WEB-DL-BAD")
                .indexer("Tracker")
                .status(DownloadStatus.DOWNLOADING)
                .build();
    }

    @Test
    void handleFailure_blacklistsBeforeRetrying() {
        DownloadTarget target = DownloadTarget.episode(3L, 1, 4);
        when(autoSearchService.retry(target)).thenReturn(Optional.empty());

        handler.handleFailure(download, "stalled");

        InOrder order = inOrder(downloadService, blacklistService, autoSearchService);
        order.verify(downloadService).markFailed(download, "stalled");
        order.verify(blacklistService).add(target, "Show.S01E04.1080p.WEB-DL-BAD", "Tracker", "stalled");
        order.verify(autoSearchService).retry(target);

        verify(activityLogService).log(eq(ActivityEventType.DOWNLOAD_FAILED), eq(download), anyString());
        verify(activityLogService).log(eq(ActivityEventType.REDOWNLOAD_STARTED), eq(download), anyString());
        ArgumentCaptor<Notification> notification = ArgumentCaptor.forClass(Notification.class);
        verify(notificationService).notify(notification.capture());
        assertThat(notification.getValue().getEvent()).isEqualTo(NotificationEvent.ON_DOWNLOAD_FAILURE);
    }

    @Test
    void handleFailure_noRetryWhenDisabled() {
        appProperties.getDownload().setRedownloadFailed(false);

        handler.handleFailure(download, "stalled");

        verify(blacklistService).add(any(), anyString(), anyString(), anyString());
        verify(autoSearchService, never()).retry(any());
    }

    @Test
    void handleFailure_removesFromClientWhenConfigured() {
        appProperties.getDownload().setRedownloadFailed(false);
        download.setDownloadClientId(2L);
        download.setDownloadHandle("hash");
        when(downloadClientService.findClient(2L)).thenReturn(Optional.of(DownloadClientEntity.builder().id(2L).removeFailed(true).build()));

        handler.handleFailure(download, "error");

        verify(downloadClientService).remove(2L, "hash", true);
    }

    @Test
    void handleFailure_keepsClientItemByDefault() {
        appProperties.getDownload().setRedownloadFailed(false);
        download.setDownloadClientId(2L);
        download.setDownloadHandle("hash");
        when(downloadClientService.findClient(2L)).thenReturn(Optional.of(DownloadClientEntity.builder().id(2L).build()));

        handler.handleFailure(download, "error");

        verify(downloadClientService, never()).remove(any(), any(), anyBoolean());
    }

    @Test
    void scheduleRedownload_reportsGrab() {
        DownloadTarget target = DownloadTarget.of(download);
        GrabResult grabbed = new GrabResult(GrabOutcome.GRABBED, DownloadEntity.builder().title("Show.S01E04.1080p.WEB-DL-GOOD").build(), "ok");
        when(autoSearchService.retry(target)).thenReturn(Optional.of(grabbed));

        CompletableFuture<Optional<GrabResult>> future = handler.scheduleRedownload(download, target);

        assertThat(future.join()).contains(grabbed);
        verify(activityLogService, never()).log(eq(ActivityEventType.REDOWNLOAD_FAILED), any(), anyString(), anyMap());
    }

    @Test
    void scheduleRedownload_errorIsRecordedNotLost() {
        DownloadTarget target = DownloadTarget.of(download);
        when(autoSearchService.retry(target)).thenThrow(new IllegalStateException("indexers down"));

        CompletableFuture<Optional<GrabResult>> future = handler.scheduleRedownload(download, target);

        assertThatThrownBy(future::join).isInstanceOf(CompletionException.class).hasRootCauseMessage("indexers down");
        verify(activityLogService).log(eq(ActivityEventType.REDOWNLOAD_FAILED), eq(download), anyString(), anyMap());
    }
}
