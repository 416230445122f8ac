package org.mediarr.crons;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mediarr.model.dto.request.TaskCreateRequest;
import org.mediarr.model.enums.TaskType;
import org.mediarr.service.task.TaskService;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CronServiceTest {

    @Mock
    private TaskService taskService;

    @InjectMocks
    private CronService cronService;

    @Test
    void syncRss_runsTaskMarkedAsCron() {
        cronService.syncRss();

        ArgumentCaptor<TaskCreateRequest> captor = ArgumentCaptor.forClass(TaskCreateRequest.class);
        verify(taskService).run(captor.capture());
        assertThat(captor.getValue().getTaskType()).isEqualTo(TaskType.RSS_SYNC);
        assertThat(captor.getValue().isTriggeredByCron()).isTrue();
    }

    @Test
    void failingTickDoesNotPropagate() {
        when(taskService.run(any())).thenThrow(new IllegalStateException("database unavailable"));

        assertThatCode(() -> cronService.syncDownloads()).doesNotThrowAnyException();
    }
}
