package org.mediarr.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.mediarr.convertor.StringListConverter;
import org.mediarr.model.enums.FormatMediaType;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "quality_profile")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityProfileEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "media_type", nullable = false, length = 20)
    @Builder.Default
    private FormatMediaType mediaType = FormatMediaType.BOTH;

    /**
     * Quality labels ({@code WEBDL-1080p}) or group names ({@code WEB-1080p}) accepted by this profile.
     */
    @Convert(converter = StringListConverter.class)
    @Column(name = "allowed_qualities", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> allowedQualities = new ArrayList<>();

    @Column(name = "cutoff", nullable = false, length = 50)
    private String cutoff;

    @Column(name = "upgrade_allowed", nullable = false)
    @Builder.Default
    private boolean upgradeAllowed = true;

    @Column(name = "min_format_score", nullable = false)
    private int minFormatScore;
}
