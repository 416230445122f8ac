package org.mediarr.model.dto;

import lombok.Builder;
import lombok.Value;
import org.mediarr.model.enums.DownloadProtocol;
import org.mediarr.model.enums.MediaKind;

@Value
@Builder
public class AddDownloadRequest {
    String url;
    String title;
    MediaKind mediaKind;
    String savePath;
    Long clientId;
    DownloadProtocol protocol;
}
