package org.mediarr.service.library;

import org.mediarr.model.dto.ImportedFile;
import org.mediarr.model.dto.WantedItem;
import org.mediarr.model.dto.WantedSeries;
import org.mediarr.model.enums.MediaKind;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Read and file-state access to library items. The acquisition engine never edits library metadata.
 */
public interface LibraryService {

    List<WantedItem> findMonitoredMovies();

    List<WantedItem> findMissingMovies();

    List<WantedItem> findMoviesWithFiles();

    List<WantedSeries> findMonitoredSeries();

    List<WantedItem> findMissingEpisodes();

    List<WantedItem> findEpisodesWithFiles();

    Optional<WantedItem> findMovie(Long movieId);

    Optional<WantedSeries> findSeries(Long seriesId);

    Optional<WantedItem> findEpisode(Long seriesId, int season, int episode);

    List<WantedItem> findEpisodesInSeason(Long seriesId, int season);

    boolean isExcluded(Long externalId, MediaKind mediaKind);

    Path movieFolder(Long movieId);

    Path seasonFolder(Long seriesId, int season);

    void markMovieFile(Long movieId, ImportedFile file);

    void markEpisodeFile(Long seriesId, int season, int episode, ImportedFile file);
}
