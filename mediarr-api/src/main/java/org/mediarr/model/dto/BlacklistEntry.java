package org.mediarr.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlacklistEntry {
    private Long id;
    private Long movieId;
    private Long seriesId;
    private Integer seasonNumber;
    private Integer episodeNumber;
    private String releaseTitle;
    private String indexer;
    private String reason;
    private LocalDateTime createdAt;
}
