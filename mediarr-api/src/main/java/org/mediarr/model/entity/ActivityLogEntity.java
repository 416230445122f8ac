package org.mediarr.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.mediarr.model.enums.ActivityEventType;

import java.time.LocalDateTime;

@Entity
@Table(name = "activity_log")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 50)
    private ActivityEventType eventType;

    @Column(name = "movie_id")
    private Long movieId;

    @Column(name = "series_id")
    private Long seriesId;

    @Column(name = "download_id")
    private Long downloadId;

    @Column(name = "message", nullable = false, length = 1024)
    private String message;

    @Column(name = "details", columnDefinition = "TEXT")
    private String details;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
