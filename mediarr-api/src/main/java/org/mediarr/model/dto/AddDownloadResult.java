package org.mediarr.model.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AddDownloadResult {
    boolean success;
    String downloadId;
    Long clientId;
    String message;

    public static AddDownloadResult failure(String message) {
        return AddDownloadResult.builder().success(false).message(message).build();
    }
}
