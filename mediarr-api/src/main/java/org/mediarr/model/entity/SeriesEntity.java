package org.mediarr.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "series")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeriesEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tvdb_id")
    private Long tvdbId;

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

    @Column(name = "added_at", nullable = false)
    private LocalDateTime addedAt;

    @PrePersist
    protected void onCreate() {
        if (addedAt == null) {
            addedAt = LocalDateTime.now();
        }
    }
}
