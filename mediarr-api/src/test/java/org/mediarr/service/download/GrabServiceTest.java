package org.mediarr.service.download;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mediarr.exception.APIException;
import org.mediarr.model.dto.AddDownloadRequest;
import org.mediarr.model.dto.AddDownloadResult;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.dto.GrabResult;
import org.mediarr.model.dto.Notification;
import org.mediarr.model.dto.Release;
import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.ActivityEventType;
import org.mediarr.model.enums.DownloadProtocol;
import org.mediarr.model.enums.DownloadStatus;
import org.mediarr.model.enums.GrabOutcome;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.model.enums.NotificationEvent;
import org.mediarr.service.activity.ActivityLogService;
import org.mediarr.service.download.client.DownloadClientService;
import org.mediarr.service.notification.NotificationService;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GrabServiceTest {

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

    @InjectMocks
    private GrabService grabService;

    private final DownloadTarget target = DownloadTarget.movie(42L);
    private final Release release = Release.builder()
            .guid("g1")
            .title("Arrival.2016.1080p.BluRay.x264-GRP")
            .downloadUrl("magnet:?xt=urn:btih:0123456789abcdef0123456789abcdef01234567")
            .protocol(DownloadProtocol.TORRENT)
            .quality("Bluray-1080p")
            .indexer("Tracker")
            .build();

    @Test
    void grab_submitsToClientAndMarksDownloading() {
        DownloadEntity queued = DownloadEntity.builder().id(1L).title(release.getTitle()).status(DownloadStatus.QUEUED).build();
        when(blacklistService.isBlacklisted(target, release.getTitle())).thenReturn(false);
        when(downloadService.createIfIdle(eq(target), any())).thenReturn(new DownloadService.Creation(GrabOutcome.GRABBED, queued));
        when(downloadClientService.addDownload(any())).thenReturn(AddDownloadResult.builder().success(true).downloadId("abc").clientId(3L).build());
        when(downloadService.save(queued)).thenReturn(queued);

        GrabResult result = grabService.grab(release, target, null);

        assertThat(result.isGrabbed()).isTrue();
        assertThat(queued.getStatus()).isEqualTo(DownloadStatus.DOWNLOADING);
        assertThat(queued.getDownloadHandle()).isEqualTo("abc");
        assertThat(queued.getDownloadClientId()).isEqualTo(3L);

        ArgumentCaptor<AddDownloadRequest> request = ArgumentCaptor.forClass(AddDownloadRequest.class);
        verify(downloadClientService).addDownload(request.capture());
        assertThat(request.getValue().getMediaKind()).isEqualTo(MediaKind.MOVIE);
        assertThat(request.getValue().getProtocol()).isEqualTo(DownloadProtocol.TORRENT);

        verify(activityLogService).log(eq(ActivityEventType.GRABBED), eq(queued), anyString(), anyMap());
        ArgumentCaptor<Notification> notification = ArgumentCaptor.forClass(Notification.class);
        verify(notificationService).notify(notification.capture());
        assertThat(notification.getValue().getEvent()).isEqualTo(NotificationEvent.ON_GRAB);
        assertThat(notification.getValue().getMediaTitle()).isEqualTo("Arrival");
    }

    @Test
    void grab_blacklistedReleaseIsNeverCreated() {
        when(blacklistService.isBlacklisted(target, release.getTitle())).thenReturn(true);

        GrabResult result = grabService.grab(release, target, null);

        assertThat(result.outcome()).isEqualTo(GrabOutcome.BLACKLISTED);
        verifyNoInteractions(downloadService, downloadClientService);
    }

    @Test
    void grab_activeDownloadBlocksSecondGrab() {
        DownloadEntity existing = DownloadEntity.builder().id(7L).status(DownloadStatus.DOWNLOADING).build();
        when(downloadService.createIfIdle(eq(target), any())).thenReturn(new DownloadService.Creation(GrabOutcome.ACTIVE_DOWNLOAD_EXISTS, existing));

        GrabResult result = grabService.grab(release, target, null);

        assertThat(result.outcome()).isEqualTo(GrabOutcome.ACTIVE_DOWNLOAD_EXISTS);
        assertThat(result.download()).isSameAs(existing);
        verify(downloadClientService, never()).addDownload(any());
    }

    @Test
    void grab_clientRejectionFailsTheRow() {
        DownloadEntity queued = DownloadEntity.builder().id(1L).title(release.getTitle()).status(DownloadStatus.QUEUED).build();
        when(downloadService.createIfIdle(eq(target), any())).thenReturn(new DownloadService.Creation(GrabOutcome.GRABBED, queued));
        when(downloadClientService.addDownload(any())).thenReturn(AddDownloadResult.failure("Torrent file is invalid"));

        GrabResult result = grabService.grab(release, target, null);

        assertThat(result.outcome()).isEqualTo(GrabOutcome.CLIENT_REJECTED);
        verify(downloadService).markFailed(queued, "Torrent file is invalid");
        verifyNoInteractions(notificationService);
    }

    @Test
    void grabInteractive_duplicateBecomesConflict() {
        when(downloadService.createIfIdle(eq(target), any())).thenReturn(new DownloadService.Creation(GrabOutcome.ALREADY_DOWNLOADING, null));

        assertThatThrownBy(() -> grabService.grabInteractive(release, target, null))
                .isInstanceOf(APIException.class)
                .satisfies(e -> assertThat(((APIException) e).getStatus().value()).isEqualTo(409));
    }

    @Test
    void grabInteractive_clientRejectionBecomesBadGateway() {
        DownloadEntity queued = DownloadEntity.builder().id(1L).title(release.getTitle()).build();
        when(downloadService.createIfIdle(eq(target), any())).thenReturn(new DownloadService.Creation(GrabOutcome.GRABBED, queued));
        when(downloadClientService.addDownload(any())).thenReturn(AddDownloadResult.failure("unreachable"));

        assertThatThrownBy(() -> grabService.grabInteractive(release, target, 3L))
                .isInstanceOf(APIException.class)
                .hasMessageContaining("unreachable");
    }
}
