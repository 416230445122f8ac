package org.mediarr.model.dto;

import lombok.Builder;
import lombok.Value;
import org.mediarr.model.enums.ClientDownloadState;

/**
 * An item as reported by a download client, with the client's own state mapped to {@link ClientDownloadState}.
 */
@Value
@Builder
public class ClientDownload {
    String handle;
    String name;
    double progress;
    ClientDownloadState state;
    String rawState;
    String contentPath;
    String savePath;
    Long size;
    String errorMessage;
    Long addedOn;
}
