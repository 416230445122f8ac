package org.mediarr.model.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of a library item that may need content, read once per search or RSS cycle.
 */
@Value
@Builder(toBuilder = true)
public class WantedItem {
    DownloadTarget target;
    Long externalId;
    String title;
    Integer year;
    boolean monitored;
    Long qualityProfileId;
    boolean hasFile;
    String currentQuality;
    boolean currentProper;
    boolean currentRepack;
}
