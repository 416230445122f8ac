package org.mediarr.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedRelease {
    private Long id;
    private Long indexerId;
    private String guid;
    private String title;
    private Long size;
    private Integer seeders;
    private String quality;
    private List<String> categories;
    private LocalDateTime publishDate;
    private boolean grabbed;
    private boolean processed;
    private LocalDateTime createdAt;
}
