package org.mediarr.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mediarr.model.enums.ActivityEventType;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityLog {
    private Long id;
    private ActivityEventType eventType;
    private Long movieId;
    private Long seriesId;
    private Long downloadId;
    private String message;
    private String details;
    private LocalDateTime createdAt;
}
