package org.mediarr.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.mediarr.model.enums.DownloadProtocol;
import org.mediarr.model.enums.DownloadStatus;
import org.mediarr.model.enums.MediaKind;

import java.time.LocalDateTime;

@Entity
@Table(name = "download")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "media_kind", nullable = false, length = 20)
    private MediaKind mediaKind;

    @Column(name = "movie_id")
    private Long movieId;

    @Column(name = "series_id")
    private Long seriesId;

    @Column(name = "season_number")
    private Integer seasonNumber;

    @Column(name = "episode_number")
    private Integer episodeNumber;

    @Column(name = "title", nullable = false, length = 1000)
    private String title;

    @Column(name = "download_url", length = 4000)
    private String downloadUrl;

    @Column(name = "download_handle")
    private String downloadHandle;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DownloadStatus status;

    @Column(name = "progress", nullable = false)
    private double progress;

    @Column(name = "save_path", length = 2000)
    private String savePath;

    @Column(name = "size")
    private Long size;

    @Column(name = "seeders")
    private Integer seeders;

    @Column(name = "indexer")
    private String indexer;

    @Column(name = "quality", length = 50)
    private String quality;

    @Enumerated(EnumType.STRING)
    @Column(name = "protocol", length = 20)
    private DownloadProtocol protocol;

    @Column(name = "download_client_id")
    private Long downloadClientId;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
