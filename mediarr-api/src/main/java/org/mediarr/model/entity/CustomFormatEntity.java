package org.mediarr.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.mediarr.convertor.FormatSpecificationListConverter;
import org.mediarr.model.dto.FormatSpecification;
import org.mediarr.model.enums.FormatMediaType;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "custom_format")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomFormatEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "media_type", nullable = false, length = 20)
    @Builder.Default
    private FormatMediaType mediaType = FormatMediaType.BOTH;

    @Convert(converter = FormatSpecificationListConverter.class)
    @Column(name = "specifications", columnDefinition = "TEXT")
    @Builder.Default
    private List<FormatSpecification> specifications = new ArrayList<>();

    @Column(name = "external_id", length = 100)
    private String externalId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
