package org.mediarr.task.tasks;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.model.dto.SyncResult;
import org.mediarr.model.dto.request.TaskCreateRequest;
import org.mediarr.model.dto.response.TaskCreateResponse;
import org.mediarr.model.enums.TaskType;
import org.mediarr.service.download.DownloadService;
import org.mediarr.service.download.DownloadSyncService;
import org.mediarr.task.TaskStatus;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class DownloadSyncTask implements Task {

    private final DownloadSyncService downloadSyncService;
    private final DownloadService downloadService;

    @Override
    public TaskCreateResponse execute(TaskCreateRequest request) {
        TaskCreateResponse.TaskCreateResponseBuilder builder = TaskCreateResponse.builder()
                .taskId(UUID.randomUUID().toString())
                .taskType(getTaskType());

        boolean verbose = !request.isTriggeredByCron();
        long startTime = System.currentTimeMillis();
        if (verbose) {
            log.info("{}: Task started", getTaskType());
        }

        try {
            SyncResult result = downloadSyncService.syncAll();
            builder.status(TaskStatus.COMPLETED)
                    .message(String.format("Synced %d downloads: %d completed, %d failed", result.synced(), result.completed(), result.failed()));
        } catch (Exception e) {
            log.error("{}: Error syncing downloads", getTaskType(), e);
            builder.status(TaskStatus.FAILED).message(e.getMessage());
        }

        if (verbose) {
            log.info("{}: Task completed. Duration: {} ms", getTaskType(), System.currentTimeMillis() - startTime);
        }
        return builder.build();
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.DOWNLOAD_SYNC;
    }

    @Override
    public String getMetadata() {
        int active = downloadService.getActiveDownloads().size();
        return "Active download" + (active != 1 ? "s" : "") + ": " + active;
    }
}
