package org.mediarr.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "quality_profile_format_score",
        uniqueConstraints = @UniqueConstraint(name = "uk_profile_format", columnNames = {"quality_profile_id", "custom_format_id"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityProfileFormatScoreEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "quality_profile_id", nullable = false)
    private Long qualityProfileId;

    @Column(name = "custom_format_id", nullable = false)
    private Long customFormatId;

    @Column(name = "score", nullable = false)
    private int score;
}
