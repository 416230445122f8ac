package org.mediarr.service.library;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.mediarr.config.AppProperties;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.dto.ImportedFile;
import org.mediarr.model.dto.WantedItem;
import org.mediarr.model.dto.WantedSeries;
import org.mediarr.model.entity.EpisodeEntity;
import org.mediarr.model.entity.MovieEntity;
import org.mediarr.model.entity.SeriesEntity;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.repository.EpisodeRepository;
import org.mediarr.repository.ExclusionRepository;
import org.mediarr.repository.MovieRepository;
import org.mediarr.repository.SeriesRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaLibraryService implements LibraryService {

    private final MovieRepository movieRepository;
    private final SeriesRepository seriesRepository;
    private final EpisodeRepository episodeRepository;
    private final ExclusionRepository exclusionRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    @Override
    public List<WantedItem> findMonitoredMovies() {
        return movieRepository.findByMonitoredTrueOrderByTitleAsc().stream().map(JpaLibraryService::toWanted).toList();
    }

    @Override
    public List<WantedItem> findMissingMovies() {
        return movieRepository.findByMonitoredTrueAndHasFileFalse().stream().map(JpaLibraryService::toWanted).toList();
    }

    @Override
    public List<WantedItem> findMoviesWithFiles() {
        return movieRepository.findByMonitoredTrueAndHasFileTrue().stream().map(JpaLibraryService::toWanted).toList();
    }

    @Override
    public List<WantedSeries> findMonitoredSeries() {
        return seriesRepository.findByMonitoredTrueOrderByTitleAsc().stream().map(JpaLibraryService::toWanted).toList();
    }

    @Override
    public List<WantedItem> findMissingEpisodes() {
        return withSeries(episodeRepository.findMissingAired(LocalDate.now(clock)));
    }

    @Override
    public List<WantedItem> findEpisodesWithFiles() {
        return withSeries(episodeRepository.findMonitoredWithFile());
    }

    @Override
    public Optional<WantedItem> findMovie(Long movieId) {
        return movieRepository.findById(movieId).map(JpaLibraryService::toWanted);
    }

    @Override
    public Optional<WantedSeries> findSeries(Long seriesId) {
        return seriesRepository.findById(seriesId).map(JpaLibraryService::toWanted);
    }

    @Override
    public Optional<WantedItem> findEpisode(Long seriesId, int season, int episode) {
        Optional<SeriesEntity> series = seriesRepository.findById(seriesId);
        if (series.isEmpty()) {
            return Optional.empty();
        }
        return episodeRepository.findBySeriesIdAndSeasonNumberAndEpisodeNumber(seriesId, season, episode)
                .map(e -> toWanted(e, series.get()));
    }

    @Override
    public List<WantedItem> findEpisodesInSeason(Long seriesId, int season) {
        Optional<SeriesEntity> series = seriesRepository.findById(seriesId);
        if (series.isEmpty()) {
            return List.of();
        }
        return episodeRepository.findBySeriesIdAndSeasonNumberOrderByEpisodeNumberAsc(seriesId, season).stream()
                .map(e -> toWanted(e, series.get()))
                .toList();
    }

    @Override
    public boolean isExcluded(Long externalId, MediaKind mediaKind) {
        return externalId != null && exclusionRepository.existsByExternalIdAndMediaKind(externalId, mediaKind);
    }

    @Override
    public Path movieFolder(Long movieId) {
        MovieEntity movie = movieRepository.findById(movieId)
                .orElseThrow(() -> ApiError.MOVIE_NOT_FOUND.createException(movieId));
        if (StringUtils.isNotBlank(movie.getFolderPath())) {
            return Path.of(movie.getFolderPath());
        }
        return Path.of(appProperties.getImporter().getMoviesRoot(), folderName(movie.getTitle(), movie.getYear()));
    }

    @Override
    public Path seasonFolder(Long seriesId, int season) {
        SeriesEntity series = seriesRepository.findById(seriesId)
                .orElseThrow(() -> ApiError.GENERIC_BAD_REQUEST.createException("Series not found with ID: " + seriesId));
        Path root = StringUtils.isNotBlank(series.getFolderPath())
                ? Path.of(series.getFolderPath())
                : Path.of(appProperties.getImporter().getSeriesRoot(), folderName(series.getTitle(), series.getYear()));
        return root.resolve(String.format("Season %02d", season));
    }

    @Override
    @Transactional
    public void markMovieFile(Long movieId, ImportedFile file) {
        MovieEntity movie = movieRepository.findById(movieId)
                .orElseThrow(() -> ApiError.MOVIE_NOT_FOUND.createException(movieId));
        movie.setHasFile(true);
        movie.setFilePath(file.getPath());
        movie.setFileQuality(file.getQuality());
        movie.setFileSize(file.getSize());
        movie.setFileReleaseGroup(file.getReleaseGroup());
        movie.setFileProper(file.isProper());
        movie.setFileRepack(file.isRepack());
        movieRepository.save(movie);
        log.info("[Import] Movie '{}' now has file {} ({})", movie.getTitle(), file.getPath(), file.getQuality());
    }

    @Override
    @Transactional
    public void markEpisodeFile(Long seriesId, int season, int episode, ImportedFile file) {
        EpisodeEntity entity = episodeRepository.findBySeriesIdAndSeasonNumberAndEpisodeNumber(seriesId, season, episode)
                .orElseThrow(() -> ApiError.EPISODE_NOT_FOUND.createException(season, episode, seriesId));
        entity.setHasFile(true);
        entity.setFilePath(file.getPath());
        entity.setFileQuality(file.getQuality());
        entity.setFileSize(file.getSize());
        entity.setFileProper(file.isProper());
        entity.setFileRepack(file.isRepack());
        episodeRepository.save(entity);
        log.info("[Import] Series {} S{}E{} now has file {}", seriesId, season, episode, file.getPath());
    }

    private List<WantedItem> withSeries(List<EpisodeEntity> episodes) {
        Map<Long, SeriesEntity> series = seriesRepository.findAllById(episodes.stream().map(EpisodeEntity::getSeriesId).distinct().toList())
                .stream()
                .collect(Collectors.toMap(SeriesEntity::getId, Function.identity()));
        return episodes.stream()
                .filter(e -> series.containsKey(e.getSeriesId()))
                .map(e -> toWanted(e, series.get(e.getSeriesId())))
                .toList();
    }

    private static String folderName(String title, Integer year) {
        String safe = title.replaceAll("[\\\\/:*?\"<>|]", "").trim();
        return year != null ? safe + " (" + year + ")" : safe;
    }

    private static WantedItem toWanted(MovieEntity movie) {
        return WantedItem.builder()
                .target(DownloadTarget.movie(movie.getId()))
                .externalId(movie.getTmdbId())
                .title(movie.getTitle())
                .year(movie.getYear())
                .monitored(movie.isMonitored())
                .qualityProfileId(movie.getQualityProfileId())
                .hasFile(movie.isHasFile())
                .currentQuality(movie.getFileQuality())
                .currentProper(movie.isFileProper())
                .currentRepack(movie.isFileRepack())
                .build();
    }

    private static WantedSeries toWanted(SeriesEntity series) {
        return WantedSeries.builder()
                .id(series.getId())
                .externalId(series.getTvdbId())
                .title(series.getTitle())
                .year(series.getYear())
                .qualityProfileId(series.getQualityProfileId())
                .build();
    }

    private static WantedItem toWanted(EpisodeEntity episode, SeriesEntity series) {
        return WantedItem.builder()
                .target(DownloadTarget.episode(series.getId(), episode.getSeasonNumber(), episode.getEpisodeNumber()))
                .externalId(series.getTvdbId())
                .title(series.getTitle())
                .monitored(series.isMonitored() && episode.isMonitored())
                .qualityProfileId(series.getQualityProfileId())
                .hasFile(episode.isHasFile())
                .currentQuality(episode.getFileQuality())
                .currentProper(episode.isFileProper())
                .currentRepack(episode.isFileRepack())
                .build();
    }
}
