package org.mediarr.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "movie")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MovieEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tmdb_id")
    private Long tmdbId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "release_year")
    private Integer year;

    @Column(name = "monitored", nullable = false)
    @Builder.Default
    private boolean monitored = true;

    @Column(name = "quality_profile_id")
    private Long qualityProfileId;

    @Column(name = "folder_path", length = 2000)
    private String folderPath;

    @Column(name = "has_file", nullable = false)
    private boolean hasFile;

    @Column(name = "file_path", length = 2000)
    private String filePath;

    @Column(name = "file_quality", length = 50)
    private String fileQuality;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "file_release_group", length = 100)
    private String fileReleaseGroup;

    @Column(name = "file_proper", nullable = false)
    private boolean fileProper;

    @Column(name = "file_repack", nullable = false)
    private boolean fileRepack;

    @Column(name = "added_at", nullable = false)
    private LocalDateTime addedAt;

    @PrePersist
    protected void onCreate() {
        if (addedAt == null) {
            addedAt = LocalDateTime.now();
        }
    }
}
