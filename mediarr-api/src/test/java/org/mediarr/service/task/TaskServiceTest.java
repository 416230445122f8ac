package org.mediarr.service.task;

import org.junit.jupiter.api.Test;
import org.mediarr.exception.APIException;
import org.mediarr.model.dto.TaskInfo;
import org.mediarr.model.dto.request.TaskCreateRequest;
import org.mediarr.model.dto.response.TaskCreateResponse;
import org.mediarr.model.enums.TaskType;
import org.mediarr.task.TaskStatus;
import org.mediarr.task.tasks.Task;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskServiceTest {

    private static TaskCreateRequest request(TaskType type) {
        return TaskCreateRequest.builder().taskType(type).build();
    }

    private static Task task(TaskType type, Runnable body) {
        return new Task() {
            @Override
            public TaskCreateResponse execute(TaskCreateRequest request) {
                body.run();
                return TaskCreateResponse.builder().taskType(type).status(TaskStatus.COMPLETED).build();
            }

            @Override
            public TaskType getTaskType() {
                return type;
            }

            @Override
            public String getMetadata() {
                throw new IllegalStateException("metadata unavailable");
            }
        };
    }

    @Test
    void run_executesRegisteredTask() {
        AtomicInteger calls = new AtomicInteger();
        TaskService taskService = new TaskService(List.of(task(TaskType.RSS_SYNC, calls::incrementAndGet)),
                new TaskExecutorAdapter(Runnable::run));

        TaskCreateResponse response = taskService.run(request(TaskType.RSS_SYNC));

        assertThat(response.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(calls).hasValue(1);
        assertThat(taskService.isRunning(TaskType.RSS_SYNC)).isFalse();
    }

    @Test
    void run_unknownTaskTypeThrows() {
        TaskService taskService = new TaskService(List.of(), new TaskExecutorAdapter(Runnable::run));

        assertThatThrownBy(() -> taskService.run(request(TaskType.MISSING_SEARCH)))
                .isInstanceOf(APIException.class)
                .hasMessageContaining("MISSING_SEARCH");
    }

    @Test
    void run_overlappingRunIsSkipped() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        Task slow = task(TaskType.DOWNLOAD_SYNC, () -> {
            started.countDown();
            try {
                finish.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        TaskExecutor executor = new SimpleAsyncTaskExecutor();
        TaskService taskService = new TaskService(List.of(slow), new TaskExecutorAdapter(executor));

        TaskCreateResponse accepted = taskService.runAsync(request(TaskType.DOWNLOAD_SYNC));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        TaskCreateResponse overlapping = taskService.run(request(TaskType.DOWNLOAD_SYNC));
        finish.countDown();

        assertThat(accepted.getStatus()).isEqualTo(TaskStatus.ACCEPTED);
        assertThat(accepted.getTaskId()).isNotBlank();
        assertThat(overlapping.getStatus()).isEqualTo(TaskStatus.SKIPPED);
    }

    @Test
    void getAvailableTasks_toleratesMetadataFailure() {
        TaskService taskService = new TaskService(List.of(task(TaskType.CUTOFF_UNMET_SEARCH, () -> {
        })), new TaskExecutorAdapter(Runnable::run));

        List<TaskInfo> tasks = taskService.getAvailableTasks();

        assertThat(tasks).singleElement().satisfies(info -> {
            assertThat(info.getName()).isEqualTo("Cutoff Unmet Search");
            assertThat(info.getMetadata()).isNull();
            assertThat(info.isRunning()).isFalse();
        });
    }
}
