package org.mediarr.service.library;

import org.junit.jupiter.api.Test;
import org.mediarr.MediarrApplication;
import org.mediarr.config.AppProperties;
import org.mediarr.exception.APIException;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.dto.ImportedFile;
import org.mediarr.model.dto.WantedItem;
import org.mediarr.model.entity.EpisodeEntity;
import org.mediarr.model.entity.ExclusionEntity;
import org.mediarr.model.entity.MovieEntity;
import org.mediarr.model.entity.SeriesEntity;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.repository.EpisodeRepository;
import org.mediarr.repository.ExclusionRepository;
import org.mediarr.repository.MovieRepository;
import org.mediarr.repository.SeriesRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = {MediarrApplication.class})
@Transactional
class JpaLibraryServiceIntegrationTest {

    @Autowired
    private LibraryService libraryService;

    @Autowired
    private MovieRepository movieRepository;

    @Autowired
    private SeriesRepository seriesRepository;

    @Autowired
    private EpisodeRepository episodeRepository;

    @Autowired
    private ExclusionRepository exclusionRepository;

    @Autowired
    private AppProperties appProperties;

    @Test
    void markMovieFile_turnsMissingMovieIntoUpgradeCandidate() {
        MovieEntity movie = movieRepository.save(MovieEntity.builder().title("Arrival").year(2016).tmdbId(329865L).qualityProfileId(1L).build());
        assertThat(libraryService.findMissingMovies()).extracting(WantedItem::getTarget).contains(DownloadTarget.movie(movie.getId()));

        libraryService.markMovieFile(movie.getId(), ImportedFile.builder()
                .path("/media/movies/Arrival (2016)/arrival.mkv")
                .quality("WEBDL-1080p")
                .size(1024L)
                .proper(true)
                .build());

        WantedItem item = libraryService.findMovie(movie.getId()).orElseThrow();
        assertThat(item.isHasFile()).isTrue();
        assertThat(item.getCurrentQuality()).isEqualTo("WEBDL-1080p");
        assertThat(item.isCurrentProper()).isTrue();
        assertThat(libraryService.findMoviesWithFiles()).extracting(WantedItem::getTarget).contains(DownloadTarget.movie(movie.getId()));
    }

    @Test
    void movieFolder_derivedFromTitleAndYearUnlessSet() {
        MovieEntity plain = movieRepository.save(MovieEntity.builder().title("Mission: Impossible").year(1996).build());
        MovieEntity custom = movieRepository.save(MovieEntity.builder().title("Alien").folderPath("/mnt/films/Alien").build());

        assertThat(libraryService.movieFolder(plain.getId()))
                .isEqualTo(Path.of(appProperties.getImporter().getMoviesRoot(), "Mission Impossible (1996)"));
        assertThat(libraryService.movieFolder(custom.getId())).isEqualTo(Path.of("/mnt/films/Alien"));
    }

    @Test
    void seasonFolder_isZeroPadded() {
        SeriesEntity series = seriesRepository.save(SeriesEntity.builder().title("Severance").year(2022).build());

        assertThat(libraryService.seasonFolder(series.getId(), 2))
                .isEqualTo(Path.of(appProperties.getImporter().getSeriesRoot(), "Severance (2022)", "Season 02"));
    }

    @Test
    void findEpisode_carriesSeriesTitleAndProfile() {
        SeriesEntity series = seriesRepository.save(SeriesEntity.builder().title("Severance").tvdbId(371980L).qualityProfileId(2L).build());
        episodeRepository.save(EpisodeEntity.builder().seriesId(series.getId()).seasonNumber(2).episodeNumber(3).build());

        WantedItem episode = libraryService.findEpisode(series.getId(), 2, 3).orElseThrow();

        assertThat(episode.getTitle()).isEqualTo("Severance");
        assertThat(episode.getQualityProfileId()).isEqualTo(2L);
        assertThat(episode.getTarget()).isEqualTo(DownloadTarget.episode(series.getId(), 2, 3));
        assertThat(libraryService.findEpisode(series.getId(), 2, 4)).isEmpty();
    }

    @Test
    void isExcluded_matchesKind() {
        exclusionRepository.save(ExclusionEntity.builder().externalId(329865L).mediaKind(MediaKind.MOVIE).title("Arrival").build());

        assertThat(libraryService.isExcluded(329865L, MediaKind.MOVIE)).isTrue();
        assertThat(libraryService.isExcluded(329865L, MediaKind.EPISODE)).isFalse();
        assertThat(libraryService.isExcluded(null, MediaKind.MOVIE)).isFalse();
    }

    @Test
    void markEpisodeFile_unknownEpisodeThrows() {
        assertThatThrownBy(() -> libraryService.markEpisodeFile(999L, 1, 1, ImportedFile.builder().path("/x").build()))
                .isInstanceOf(APIException.class);
    }
}
