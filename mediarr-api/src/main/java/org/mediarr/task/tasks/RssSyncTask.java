package org.mediarr.task.tasks;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.model.dto.RssCacheStats;
import org.mediarr.model.dto.RssSyncResult;
import org.mediarr.model.dto.request.TaskCreateRequest;
import org.mediarr.model.dto.response.TaskCreateResponse;
import org.mediarr.model.enums.TaskType;
import org.mediarr.service.rss.RssCacheService;
import org.mediarr.service.rss.RssSyncService;
import org.mediarr.task.TaskStatus;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class RssSyncTask implements Task {

    private final RssSyncService rssSyncService;
    private final RssCacheService rssCacheService;

    @Override
    public TaskCreateResponse execute(TaskCreateRequest request) {
        TaskCreateResponse.TaskCreateResponseBuilder builder = TaskCreateResponse.builder()
                .taskId(UUID.randomUUID().toString())
                .taskType(getTaskType());

        long startTime = System.currentTimeMillis();
        log.info("{}: Task started", getTaskType());

        try {
            RssSyncResult result = rssSyncService.syncAll();
            builder.status(TaskStatus.COMPLETED)
                    .message(String.format("%d indexer(s), %d items, %d new, %d grabbed",
                            result.indexersChecked(), result.releasesFound(), result.newReleases(), result.grabbed()));
        } catch (Exception e) {
            log.error("{}: Error during RSS sync", getTaskType(), e);
            builder.status(TaskStatus.FAILED).message(e.getMessage());
        }

        log.info("{}: Task completed. Duration: {} ms", getTaskType(), System.currentTimeMillis() - startTime);
        return builder.build();
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.RSS_SYNC;
    }

    @Override
    public String getMetadata() {
        RssCacheStats stats = rssCacheService.stats();
        return "Cached items: " + stats.total() + ", grabbed: " + stats.grabbed();
    }
}
