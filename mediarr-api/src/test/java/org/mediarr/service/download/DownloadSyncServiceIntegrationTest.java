package org.mediarr.service.download;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mediarr.MediarrApplication;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.dto.SyncResult;
import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.DownloadStatus;
import org.mediarr.model.enums.GrabOutcome;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.repository.DownloadRepository;
import org.mediarr.repository.ReleaseBlacklistRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {MediarrApplication.class}, properties = "app.download.redownload-failed=false")
class DownloadSyncServiceIntegrationTest {

    @Autowired
    private DownloadSyncService downloadSyncService;

    @Autowired
    private DownloadService downloadService;

    @Autowired
    private DownloadRepository downloadRepository;

    @Autowired
    private ReleaseBlacklistRepository blacklistRepository;

    @AfterEach
    void tearDown() {
        downloadRepository.deleteAll();
        blacklistRepository.deleteAll();
    }

    @Test
    void syncAll_downloadLeftImportingIsSettledAndNoLongerBlocksGrabs() {
        downloadRepository.save(DownloadEntity.builder()
                .mediaKind(MediaKind.MOVIE)
                .movieId(42L)
                .title("Blade.Runner.1982.1080p.BluRay.x264-GRP")
                .downloadUrl("https://tracker/blade-runner.torrent")
                .status(DownloadStatus.IMPORTING)
                .createdAt(LocalDateTime.now().minusHours(1))
                .build());

        SyncResult result = downloadSyncService.syncAll();

        assertThat(result.synced()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(downloadRepository.findAll()).singleElement()
                .satisfies(download -> assertThat(download.getStatus()).isEqualTo(DownloadStatus.FAILED));

        DownloadService.Creation next = downloadService.createIfIdle(DownloadTarget.movie(42L),
                DownloadEntity.builder().title("Blade.Runner.1982.2160p.UHD.BluRay-OTHER").downloadUrl("https://tracker/br-uhd.torrent").build());
        assertThat(next.outcome()).isEqualTo(GrabOutcome.GRABBED);
    }
}
