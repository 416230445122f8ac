package org.mediarr.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mediarr.model.enums.TaskType;
import org.mediarr.task.TaskStatus;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskCreateResponse {
    private String taskId;
    private TaskType taskType;
    private TaskStatus status;
    private String message;
}
