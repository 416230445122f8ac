package org.mediarr.task.tasks;

import org.mediarr.model.dto.request.TaskCreateRequest;
import org.mediarr.model.dto.response.TaskCreateResponse;
import org.mediarr.model.enums.TaskType;

public interface Task {

    TaskCreateResponse execute(TaskCreateRequest request);

    TaskType getTaskType();

    default String getMetadata() {
        return null;
    }
}
