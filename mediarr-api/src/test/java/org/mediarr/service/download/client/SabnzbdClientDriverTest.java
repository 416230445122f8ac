package org.mediarr.service.download.client;

import org.junit.jupiter.api.Test;
import org.mediarr.model.enums.ClientDownloadState;

import static org.assertj.core.api.Assertions.assertThat;

class SabnzbdClientDriverTest {

    @Test
    void mapQueueAndHistoryStates() {
        assertThat(SabnzbdClientDriver.mapQueueState("Paused")).isEqualTo(ClientDownloadState.PAUSED);
        assertThat(SabnzbdClientDriver.mapQueueState("Grabbing")).isEqualTo(ClientDownloadState.QUEUED);
        assertThat(SabnzbdClientDriver.mapQueueState("Downloading")).isEqualTo(ClientDownloadState.DOWNLOADING);
        assertThat(SabnzbdClientDriver.mapHistoryState("Completed")).isEqualTo(ClientDownloadState.COMPLETED);
        assertThat(SabnzbdClientDriver.mapHistoryState("Failed")).isEqualTo(ClientDownloadState.FAILED);
        assertThat(SabnzbdClientDriver.mapHistoryState("Extracting")).isEqualTo(ClientDownloadState.DOWNLOADING);
    }
}
