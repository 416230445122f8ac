package org.mediarr.task.tasks;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.model.dto.request.TaskCreateRequest;
import org.mediarr.model.dto.response.TaskCreateResponse;
import org.mediarr.model.enums.TaskType;
import org.mediarr.service.search.AutoSearchService;
import org.mediarr.task.TaskStatus;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class CutoffUnmetSearchTask implements Task {

    private final AutoSearchService autoSearchService;

    @Override
    public TaskCreateResponse execute(TaskCreateRequest request) {
        TaskCreateResponse.TaskCreateResponseBuilder builder = TaskCreateResponse.builder()
                .taskId(UUID.randomUUID().toString())
                .taskType(getTaskType());

        long startTime = System.currentTimeMillis();
        log.info("{}: Task started", getTaskType());

        try {
            int grabbed = autoSearchService.searchCutoffUnmet();
            builder.status(TaskStatus.COMPLETED).message("Grabbed " + grabbed + " upgrade" + (grabbed != 1 ? "s" : ""));
        } catch (Exception e) {
            log.error("{}: Error searching for upgrades", getTaskType(), e);
            builder.status(TaskStatus.FAILED).message(e.getMessage());
        }

        log.info("{}: Task completed. Duration: {} ms", getTaskType(), System.currentTimeMillis() - startTime);
        return builder.build();
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.CUTOFF_UNMET_SEARCH;
    }
}
