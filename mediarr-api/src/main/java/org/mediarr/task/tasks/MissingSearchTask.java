package org.mediarr.task.tasks;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.model.dto.request.TaskCreateRequest;
import org.mediarr.model.dto.response.TaskCreateResponse;
import org.mediarr.model.enums.TaskType;
import org.mediarr.service.library.LibraryService;
import org.mediarr.service.search.AutoSearchService;
import org.mediarr.task.TaskStatus;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class MissingSearchTask implements Task {

    private final AutoSearchService autoSearchService;
    private final LibraryService libraryService;

    @Override
    public TaskCreateResponse execute(TaskCreateRequest request) {
        TaskCreateResponse.TaskCreateResponseBuilder builder = TaskCreateResponse.builder()
                .taskId(UUID.randomUUID().toString())
                .taskType(getTaskType());

        long startTime = System.currentTimeMillis();
        log.info("{}: Task started", getTaskType());

        try {
            int grabbed = autoSearchService.searchAllMissing();
            builder.status(TaskStatus.COMPLETED).message("Grabbed " + grabbed + " release" + (grabbed != 1 ? "s" : ""));
        } catch (Exception e) {
            log.error("{}: Error searching for missing items", getTaskType(), e);
            builder.status(TaskStatus.FAILED).message(e.getMessage());
        }

        log.info("{}: Task completed. Duration: {} ms", getTaskType(), System.currentTimeMillis() - startTime);
        return builder.build();
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.MISSING_SEARCH;
    }

    @Override
    public String getMetadata() {
        int missing = libraryService.findMissingMovies().size() + libraryService.findMissingEpisodes().size();
        return "Missing items: " + missing;
    }
}
