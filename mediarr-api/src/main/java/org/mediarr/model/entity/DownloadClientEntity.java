package org.mediarr.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.mediarr.model.enums.DownloadClientType;

@Entity
@Table(name = "download_client")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadClientEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private DownloadClientType type;

    @Column(name = "host", nullable = false)
    private String host;

    @Column(name = "port", nullable = false)
    private int port;

    @Column(name = "use_ssl", nullable = false)
    private boolean useSsl;

    @Column(name = "url_base")
    private String urlBase;

    @Column(name = "username")
    private String username;

    @Column(name = "password")
    private String password;

    @Column(name = "api_key")
    private String apiKey;

    @Column(name = "category")
    private String category;

    @Column(name = "category_movies")
    private String categoryMovies;

    @Column(name = "category_tv")
    private String categoryTv;

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Column(name = "priority", nullable = false)
    @Builder.Default
    private int priority = 1;

    @Column(name = "remove_completed", nullable = false)
    private boolean removeCompleted;

    @Column(name = "remove_failed", nullable = false)
    private boolean removeFailed;

    public String baseUrl() {
        String base = (useSsl ? "https://" : "http://") + host + ":" + port;
        if (urlBase != null && !urlBase.isBlank()) {
            String trimmed = urlBase.trim();
            base += (trimmed.startsWith("/") ? "" : "/") + (trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed);
        }
        return base;
    }
}
