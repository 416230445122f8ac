package org.mediarr.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.dto.Release;
import org.mediarr.model.enums.DownloadProtocol;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.service.release.ReleaseParser;

/**
 * A release picked from interactive search results, plus the library item it is meant for.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrabRequest {
    @NotBlank
    private String title;
    @NotBlank
    private String downloadUrl;
    private String guid;
    private Long size;
    private Integer seeders;
    private String indexer;
    private DownloadProtocol protocol;
    @NotNull
    private MediaKind mediaKind;
    private Long movieId;
    private Long seriesId;
    private Integer season;
    private Integer episode;
    private Long clientId;

    public DownloadTarget toTarget() {
        return switch (mediaKind) {
            case MOVIE -> {
                if (movieId == null) {
                    throw ApiError.GENERIC_BAD_REQUEST.createException("movieId is required for a movie grab");
                }
                yield DownloadTarget.movie(movieId);
            }
            case EPISODE -> {
                if (seriesId == null || season == null || episode == null) {
                    throw ApiError.GENERIC_BAD_REQUEST.createException("seriesId, season and episode are required for an episode grab");
                }
                yield DownloadTarget.episode(seriesId, season, episode);
            }
            case SEASON -> {
                if (seriesId == null || season == null) {
                    throw ApiError.GENERIC_BAD_REQUEST.createException("seriesId and season are required for a season grab");
                }
                yield DownloadTarget.seasonPack(seriesId, season);
            }
        };
    }

    public Release toRelease() {
        return Release.builder()
                .guid(guid != null ? guid : downloadUrl)
                .title(title)
                .downloadUrl(downloadUrl)
                .size(size)
                .seeders(seeders)
                .indexer(indexer)
                .protocol(protocol)
                .quality(ReleaseParser.detectQuality(title).getLabel())
                .build();
    }
}
