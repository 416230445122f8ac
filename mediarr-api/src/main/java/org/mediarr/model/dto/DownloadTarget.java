package org.mediarr.model.dto;

import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.MediaKind;

/**
 * The library item a download is acquired for. A season pack has a season but no episode.
 */
public record DownloadTarget(MediaKind kind, Long movieId, Long seriesId, Integer season, Integer episode) {

    public static DownloadTarget movie(long movieId) {
        return new DownloadTarget(MediaKind.MOVIE, movieId, null, null, null);
    }

    public static DownloadTarget episode(long seriesId, int season, int episode) {
        return new DownloadTarget(MediaKind.EPISODE, null, seriesId, season, episode);
    }

    public static DownloadTarget seasonPack(long seriesId, int season) {
        return new DownloadTarget(MediaKind.SEASON, null, seriesId, season, null);
    }

    public static DownloadTarget of(DownloadEntity download) {
        return new DownloadTarget(download.getMediaKind(), download.getMovieId(), download.getSeriesId(),
                download.getSeasonNumber(), download.getEpisodeNumber());
    }

    public boolean isMovie() {
        return kind == MediaKind.MOVIE;
    }

    public String describe() {
        if (isMovie()) {
            return "movie " + movieId;
        }
        if (episode == null) {
            return String.format("series %d season %d", seriesId, season);
        }
        return String.format("series %d S%02dE%02d", seriesId, season, episode);
    }
}
