package org.mediarr.model.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ImportedFile {
    String sourcePath;
    String path;
    long size;
    String quality;
    String videoCodec;
    String audioCodec;
    String releaseGroup;
    boolean proper;
    boolean repack;
    Integer season;
    Integer episode;
}
