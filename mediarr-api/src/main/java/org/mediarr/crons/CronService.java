package org.mediarr.crons;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.model.dto.request.TaskCreateRequest;
import org.mediarr.model.enums.TaskType;
import org.mediarr.service.task.TaskService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic background loops. A failing tick is logged and the next one runs as scheduled.
 */
@Service
@AllArgsConstructor
@Slf4j
public class CronService {

    private final TaskService taskService;

    @Scheduled(fixedDelayString = "${app.scheduling.download-sync-interval-ms:5000}", initialDelayString = "${app.scheduling.download-sync-interval-ms:5000}")
    public void syncDownloads() {
        runScheduled(TaskType.DOWNLOAD_SYNC);
    }

    @Scheduled(fixedDelayString = "${app.scheduling.rss-sync-interval-ms:900000}", initialDelay = 60000)
    public void syncRss() {
        runScheduled(TaskType.RSS_SYNC);
    }

    @Scheduled(fixedDelayString = "${app.scheduling.missing-search-interval-ms:3600000}", initialDelay = 300000)
    public void searchMissing() {
        runScheduled(TaskType.MISSING_SEARCH);
    }

    @Scheduled(fixedDelayString = "${app.scheduling.cutoff-search-interval-ms:21600000}", initialDelay = 600000)
    public void searchCutoffUnmet() {
        runScheduled(TaskType.CUTOFF_UNMET_SEARCH);
    }

    void runScheduled(TaskType taskType) {
        try {
            taskService.run(TaskCreateRequest.builder()
                    .taskType(taskType)
                    .triggeredByCron(true)
                    .build());
        } catch (Exception e) {
            log.error("Scheduled {} failed: {}", taskType, e.getMessage(), e);
        }
    }
}
