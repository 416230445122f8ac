package org.mediarr.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.mediarr.mapper.ActivityLogMapper;
import org.mediarr.model.dto.ActivityLog;
import org.mediarr.service.activity.ActivityLogService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@AllArgsConstructor
@RestController
@RequestMapping("/api/v1/activity")
@Tag(name = "Activity", description = "Grab, download and import history")
public class ActivityController {

    private final ActivityLogService activityLogService;
    private final ActivityLogMapper activityLogMapper;

    @Operation(summary = "Get activity", description = "Paginated activity log, newest first.")
    @GetMapping
    public ResponseEntity<Page<ActivityLog>> getActivity(
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "25") int size) {
        return ResponseEntity.ok(activityLogService.getActivity(PageRequest.of(page, size)).map(activityLogMapper::toDto));
    }
}
