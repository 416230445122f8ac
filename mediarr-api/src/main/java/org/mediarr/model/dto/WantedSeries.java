package org.mediarr.model.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WantedSeries {
    Long id;
    Long externalId;
    String title;
    Integer year;
    Long qualityProfileId;
}
