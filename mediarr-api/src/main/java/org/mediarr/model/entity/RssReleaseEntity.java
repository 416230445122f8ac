package org.mediarr.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "rss_release_cache",
        uniqueConstraints = @UniqueConstraint(name = "uk_rss_release_indexer_guid", columnNames = {"indexer_id", "guid"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RssReleaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "indexer_id", nullable = false)
    private Long indexerId;

    @Column(name = "guid", nullable = false, length = 500)
    private String guid;

    @Column(name = "title", nullable = false, length = 1000)
    private String title;

    @Column(name = "download_url", length = 4000)
    private String downloadUrl;

    @Column(name = "size")
    private Long size;

    @Column(name = "seeders")
    private Integer seeders;

    @Column(name = "publish_date")
    private LocalDateTime publishDate;

    @Column(name = "categories", length = 500)
    private String categories;

    @Column(name = "quality", length = 50)
    private String quality;

    @Column(name = "grabbed", nullable = false)
    private boolean grabbed;

    @Column(name = "processed", nullable = false)
    private boolean processed;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
