package org.mediarr.service.task;

import lombok.extern.slf4j.Slf4j;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.TaskInfo;
import org.mediarr.model.dto.request.TaskCreateRequest;
import org.mediarr.model.dto.response.TaskCreateResponse;
import org.mediarr.model.enums.TaskType;
import org.mediarr.task.TaskStatus;
import org.mediarr.task.tasks.Task;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs tasks by type, either inline for the scheduler or in the background for on-demand requests.
 * A task type never runs twice at the same time.
 */
@Slf4j
@Service
public class TaskService {

    private final Map<TaskType, Task> tasks = new EnumMap<>(TaskType.class);
    private final Set<TaskType> running = ConcurrentHashMap.newKeySet();
    private final AsyncTaskExecutor taskExecutor;

    public TaskService(List<Task> taskList, @Qualifier("taskExecutor") AsyncTaskExecutor taskExecutor) {
        this.taskExecutor = taskExecutor;
        taskList.forEach(task -> tasks.put(task.getTaskType(), task));
    }

    public List<TaskInfo> getAvailableTasks() {
        return Arrays.stream(TaskType.values())
                .filter(tasks::containsKey)
                .map(type -> TaskInfo.builder()
                        .taskType(type)
                        .name(type.getName())
                        .description(type.getDescription())
                        .running(running.contains(type))
                        .metadata(metadataOf(tasks.get(type)))
                        .build())
                .toList();
    }

    /**
     * Runs the task on the calling thread.
     */
    public TaskCreateResponse run(TaskCreateRequest request) {
        Task task = getTask(request.getTaskType());
        if (!running.add(task.getTaskType())) {
            log.debug("{}: Already running, skipping", task.getTaskType());
            return skipped(task.getTaskType());
        }
        try {
            return task.execute(request);
        } finally {
            running.remove(task.getTaskType());
        }
    }

    /**
     * Starts the task on the task executor and returns immediately.
     */
    public TaskCreateResponse runAsync(TaskCreateRequest request) {
        Task task = getTask(request.getTaskType());
        if (running.contains(task.getTaskType())) {
            return skipped(task.getTaskType());
        }
        String taskId = request.getTaskId() != null ? request.getTaskId() : UUID.randomUUID().toString();
        taskExecutor.execute(() -> {
            TaskCreateResponse response = run(request);
            log.info("{}: Finished with status {}{}", task.getTaskType(), response.getStatus(),
                    response.getMessage() != null ? " (" + response.getMessage() + ")" : "");
        });
        return TaskCreateResponse.builder()
                .taskId(taskId)
                .taskType(task.getTaskType())
                .status(TaskStatus.ACCEPTED)
                .build();
    }

    public boolean isRunning(TaskType taskType) {
        return running.contains(taskType);
    }

    private Task getTask(TaskType taskType) {
        Task task = taskType != null ? tasks.get(taskType) : null;
        if (task == null) {
            throw ApiError.TASK_NOT_FOUND.createException(taskType);
        }
        return task;
    }

    private TaskCreateResponse skipped(TaskType taskType) {
        return TaskCreateResponse.builder()
                .taskType(taskType)
                .status(TaskStatus.SKIPPED)
                .message("Task is already running")
                .build();
    }

    private String metadataOf(Task task) {
        try {
            return task.getMetadata();
        } catch (Exception e) {
            log.debug("{}: Failed to read metadata: {}", task.getTaskType(), e.getMessage());
            return null;
        }
    }
}
