package org.mediarr.model.dto;

import lombok.Builder;
import lombok.Value;
import org.mediarr.model.enums.TaskType;

@Value
@Builder
public class TaskInfo {
    TaskType taskType;
    String name;
    String description;
    boolean running;
    String metadata;
}
