package org.mediarr.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.mediarr.model.dto.TaskInfo;
import org.mediarr.model.dto.request.TaskCreateRequest;
import org.mediarr.model.dto.response.TaskCreateResponse;
import org.mediarr.model.enums.TaskType;
import org.mediarr.service.task.TaskService;
import org.mediarr.task.TaskStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@AllArgsConstructor
@RestController
@RequestMapping("/api/v1/tasks")
@Tag(name = "Tasks", description = "Background tasks and on-demand runs")
public class TaskController {

    private final TaskService service;

    @Operation(summary = "List tasks")
    @GetMapping
    public ResponseEntity<List<TaskInfo>> getAvailableTasks() {
        return ResponseEntity.ok(service.getAvailableTasks());
    }

    @Operation(summary = "Run a task", description = "Start a task in the background. Returns 202 when accepted.")
    @PostMapping("/{taskType}/run")
    public ResponseEntity<TaskCreateResponse> runTask(@PathVariable TaskType taskType) {
        TaskCreateResponse response = service.runAsync(TaskCreateRequest.builder().taskType(taskType).build());
        if (response.getStatus() == TaskStatus.ACCEPTED) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
