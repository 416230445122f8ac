package org.mediarr.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.mediarr.model.enums.MediaKind;

@Entity
@Table(name = "exclusion",
        uniqueConstraints = @UniqueConstraint(name = "uk_exclusion_external", columnNames = {"external_id", "media_kind"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExclusionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_id", nullable = false)
    private Long externalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "media_kind", nullable = false, length = 20)
    private MediaKind mediaKind;

    @Column(name = "title")
    private String title;
}
