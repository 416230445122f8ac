package org.mediarr.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "episode",
        uniqueConstraints = @UniqueConstraint(name = "uk_episode_number", columnNames = {"series_id", "season_number", "episode_number"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EpisodeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "series_id", nullable = false)
    private Long seriesId;

    @Column(name = "season_number", nullable = false)
    private int seasonNumber;

    @Column(name = "episode_number", nullable = false)
    private int episodeNumber;

    @Column(name = "title")
    private String title;

    @Column(name = "air_date")
    private LocalDate airDate;

    @Column(name = "monitored", nullable = false)
    @Builder.Default
    private boolean monitored = true;

    @Column(name = "has_file", nullable = false)
    private boolean hasFile;

    @Column(name = "file_path", length = 2000)
    private String filePath;

    @Column(name = "file_quality", length = 50)
    private String fileQuality;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "file_proper", nullable = false)
    private boolean fileProper;

    @Column(name = "file_repack", nullable = false)
    private boolean fileRepack;
}
