package org.mediarr.model.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.mediarr.model.enums.DownloadProtocol;
import org.mediarr.model.enums.IndexerKind;

import java.time.Instant;
import java.util.List;

/**
 * A single candidate result returned by an indexer, normalized from Torznab/Newznab XML or JSON.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Release {
    String guid;
    String title;
    Long size;
    Integer seeders;
    Integer leechers;
    Integer grabs;
    String downloadUrl;
    String infoUrl;
    Long indexerId;
    String indexer;
    IndexerKind indexerKind;
    DownloadProtocol protocol;
    String quality;
    Instant publishDate;
    List<Integer> categoryCodes;
    List<String> categories;
    Double downloadVolumeFactor;

    public boolean isFreeleech() {
        return downloadVolumeFactor != null && downloadVolumeFactor == 0d;
    }
}
