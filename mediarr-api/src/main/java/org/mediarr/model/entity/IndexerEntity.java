package org.mediarr.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.mediarr.model.enums.IndexerKind;

import java.time.LocalDateTime;

@Entity
@Table(name = "indexer")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "url", nullable = false, length = 1000)
    private String url;

    @Column(name = "api_key")
    private String apiKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private IndexerKind kind;

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Column(name = "enable_rss", nullable = false)
    @Builder.Default
    private boolean enableRss = true;

    @Column(name = "enable_automatic_search", nullable = false)
    @Builder.Default
    private boolean enableAutomaticSearch = true;

    @Column(name = "enable_interactive_search", nullable = false)
    @Builder.Default
    private boolean enableInteractiveSearch = true;

    @Column(name = "priority", nullable = false)
    @Builder.Default
    private int priority = 50;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
