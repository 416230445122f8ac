package org.mediarr.task.tasks;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mediarr.model.dto.RssCacheStats;
import org.mediarr.model.dto.RssSyncResult;
import org.mediarr.model.dto.request.TaskCreateRequest;
import org.mediarr.model.dto.response.TaskCreateResponse;
import org.mediarr.model.enums.TaskType;
import org.mediarr.service.rss.RssCacheService;
import org.mediarr.service.rss.RssSyncService;
import org.mediarr.task.TaskStatus;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RssSyncTaskTest {

    @Mock
    private RssSyncService rssSyncService;

    @Mock
    private RssCacheService rssCacheService;

    @InjectMocks
    private RssSyncTask rssSyncTask;

    @Test
    void execute_shouldSummarizeSync() {
        when(rssSyncService.syncAll()).thenReturn(new RssSyncResult(2, 150, 12, 1));

        TaskCreateResponse response = rssSyncTask.execute(new TaskCreateRequest());

        assertEquals(TaskType.RSS_SYNC, response.getTaskType());
        assertEquals(TaskStatus.COMPLETED, response.getStatus());
        assertEquals("2 indexer(s), 150 items, 12 new, 1 grabbed", response.getMessage());
    }

    @Test
    void execute_shouldReturnFailed_whenSyncThrows() {
        when(rssSyncService.syncAll()).thenThrow(new RuntimeException("boom"));

        assertEquals(TaskStatus.FAILED, rssSyncTask.execute(new TaskCreateRequest()).getStatus());
    }

    @Test
    void getMetadata_shouldReportCacheStats() {
        when(rssCacheService.stats()).thenReturn(new RssCacheStats(40, 38, 3));

        assertEquals("Cached items: 40, grabbed: 3", rssSyncTask.getMetadata());
    }
}
