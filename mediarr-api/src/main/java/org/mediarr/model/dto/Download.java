package org.mediarr.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mediarr.model.enums.DownloadProtocol;
import org.mediarr.model.enums.DownloadStatus;
import org.mediarr.model.enums.MediaKind;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Download {
    private Long id;
    private MediaKind mediaKind;
    private Long movieId;
    private Long seriesId;
    private Integer seasonNumber;
    private Integer episodeNumber;
    private String title;
    private String downloadHandle;
    private DownloadStatus status;
    private double progress;
    private String savePath;
    private Long size;
    private Integer seeders;
    private String indexer;
    private String quality;
    private DownloadProtocol protocol;
    private Long downloadClientId;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;
}
