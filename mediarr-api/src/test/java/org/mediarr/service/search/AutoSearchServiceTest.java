package org.mediarr.service.search;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mediarr.config.AppProperties;
import org.mediarr.exception.APIException;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.dto.GrabResult;
import org.mediarr.model.dto.Release;
import org.mediarr.model.dto.ReleaseDecision;
import org.mediarr.model.dto.ScoredRelease;
import org.mediarr.model.dto.WantedItem;
import org.mediarr.model.dto.WantedSeries;
import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.GrabOutcome;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.model.enums.SearchType;
import org.mediarr.service.download.BlacklistService;
import org.mediarr.service.download.DownloadService;
import org.mediarr.service.download.GrabService;
import org.mediarr.service.indexer.IndexerService;
import org.mediarr.service.library.LibraryService;
import org.mediarr.service.quality.QualityProfileOracle;
import org.mediarr.service.release.TitleMatcher;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AutoSearchServiceTest {

    @Mock
    private IndexerService indexerService;

    @Mock
    private LibraryService libraryService;

    @Mock
    private DownloadService downloadService;

    @Mock
    private GrabService grabService;

    @Mock
    private BlacklistService blacklistService;

    @Mock
    private ReleaseDecisionService decisionService;

    @Mock
    private ReleaseScorer releaseScorer;

    @Mock
    private QualityProfileOracle qualityProfileOracle;

    private AutoSearchService autoSearchService;

    private final WantedItem arrival = WantedItem.builder()
            .target(DownloadTarget.movie(42L))
            .externalId(329865L)
            .title("Arrival")
            .year(2016)
            .monitored(true)
            .qualityProfileId(1L)
            .build();

    @BeforeEach
    void setUp() {
        autoSearchService = new AutoSearchService(indexerService, libraryService, downloadService, grabService, blacklistService,
                decisionService, releaseScorer, qualityProfileOracle, new TitleMatcher(Clock.systemUTC()), new AppProperties());
        lenient().when(blacklistService.blacklistedTitles(any())).thenReturn(Set.of());
        lenient().when(releaseScorer.baseScore(any(), any(), any())).thenReturn(100);
    }

    private static Release release(String title, int seeders) {
        return Release.builder().guid(title).title(title).seeders(seeders).downloadUrl("https://tracker/" + title).build();
    }

    private static GrabResult grabbed() {
        return new GrabResult(GrabOutcome.GRABBED, DownloadEntity.builder().id(1L).build(), "ok");
    }

    @Test
    void searchAndGrabMovie_grabsHighestScoringRelease() {
        Release plain = release("Arrival.2016.1080p.WEB-DL-GRP", 200);
        Release preferred = release("Arrival.2016.1080p.BluRay.x264-HQ", 10);
        when(libraryService.findMovie(42L)).thenReturn(Optional.of(arrival));
        when(indexerService.searchMovies("Arrival", 2016, SearchType.AUTOMATIC)).thenReturn(List.of(plain, preferred));
        when(decisionService.evaluate(eq(plain), eq(arrival), any())).thenReturn(ReleaseDecision.accept(0));
        when(decisionService.evaluate(eq(preferred), eq(arrival), any())).thenReturn(ReleaseDecision.accept(50));
        when(grabService.grab(preferred, DownloadTarget.movie(42L), null)).thenReturn(grabbed());

        assertThat(autoSearchService.searchAndGrabMovie(42L, false)).hasValueSatisfying(r -> assertThat(r.isGrabbed()).isTrue());
    }

    @Test
    void searchAndGrabMovie_dropsOtherTitles() {
        Release other = release("Arrival.Of.The.Dead.1985.1080p.BluRay-GRP", 100);
        when(libraryService.findMovie(42L)).thenReturn(Optional.of(arrival));
        when(indexerService.searchMovies("Arrival", 2016, SearchType.AUTOMATIC)).thenReturn(List.of(other));

        assertThat(autoSearchService.searchAndGrabMovie(42L, false)).isEmpty();
        verify(grabService, never()).grab(any(), any(), any());
    }

    @Test
    void searchAndGrabMovie_skipsWhenCutoffMet() {
        WantedItem owned = arrival.toBuilder().hasFile(true).currentQuality("Bluray-1080p").build();
        when(libraryService.findMovie(42L)).thenReturn(Optional.of(owned));
        when(qualityProfileOracle.meetsCutoff(1L, "Bluray-1080p")).thenReturn(true);

        assertThat(autoSearchService.searchAndGrabMovie(42L, false)).isEmpty();
        verifyNoInteractions(indexerService);
    }

    @Test
    void searchAndGrabMovie_skipsWhenDownloadActive() {
        when(libraryService.findMovie(42L)).thenReturn(Optional.of(arrival));
        when(downloadService.hasActive(DownloadTarget.movie(42L))).thenReturn(true);

        assertThat(autoSearchService.searchAndGrabMovie(42L, false)).isEmpty();
        verifyNoInteractions(indexerService);
    }

    @Test
    void searchAndGrabMovie_skipsExcludedMovie() {
        when(libraryService.findMovie(42L)).thenReturn(Optional.of(arrival));
        when(libraryService.isExcluded(329865L, MediaKind.MOVIE)).thenReturn(true);

        assertThat(autoSearchService.searchAndGrabMovie(42L, true)).isEmpty();
        verifyNoInteractions(indexerService);
    }

    @Test
    void searchAndGrabMovie_unknownMovieThrows() {
        when(libraryService.findMovie(7L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> autoSearchService.searchAndGrabMovie(7L, false))
                .isInstanceOf(APIException.class)
                .hasMessageContaining("7");
    }

    @Test
    void searchAndGrabEpisode_ignoresOtherEpisodesAndPacks() {
        WantedItem episode = WantedItem.builder().target(DownloadTarget.episode(8L, 2, 3)).title("Severance")
                .monitored(true).qualityProfileId(1L).build();
        Release wanted = release("Severance.S02E03.1080p.WEB-DL-GRP", 50);
        when(libraryService.findEpisode(8L, 2, 3)).thenReturn(Optional.of(episode));
        when(indexerService.searchTv("Severance", 2, 3, SearchType.AUTOMATIC)).thenReturn(List.of(
                release("Severance.S02E04.1080p.WEB-DL-GRP", 500),
                release("Severance.S02.1080p.WEB-DL-GRP", 500),
                wanted));
        when(decisionService.evaluate(eq(wanted), eq(episode), any())).thenReturn(ReleaseDecision.accept(0));
        when(grabService.grab(wanted, DownloadTarget.episode(8L, 2, 3), null)).thenReturn(grabbed());

        assertThat(autoSearchService.searchAndGrabEpisode(8L, 2, 3)).isPresent();
    }

    @Test
    void searchAndGrabSeason_fallsBackToMissingEpisodes() {
        WantedSeries series = WantedSeries.builder().id(8L).title("Severance").qualityProfileId(1L).build();
        WantedItem owned = WantedItem.builder().target(DownloadTarget.episode(8L, 2, 1)).title("Severance")
                .monitored(true).hasFile(true).qualityProfileId(1L).build();
        WantedItem missing = WantedItem.builder().target(DownloadTarget.episode(8L, 2, 2)).title("Severance")
                .monitored(true).qualityProfileId(1L).build();
        Release pack = release("Severance.S02.1080p.WEB-DL-GRP", 30);
        Release single = release("Severance.S02E02.1080p.WEB-DL-GRP", 30);
        when(libraryService.findSeries(8L)).thenReturn(Optional.of(series));
        when(libraryService.findEpisodesInSeason(8L, 2)).thenReturn(List.of(owned, missing));
        when(indexerService.searchTv("Severance", 2, null, SearchType.AUTOMATIC)).thenReturn(List.of(pack));
        when(decisionService.evaluateSeasonPack(pack, 1L, DownloadTarget.seasonPack(8L, 2), List.of(owned, missing)))
                .thenReturn(ReleaseDecision.reject("Custom format score -10 is below minimum 0", -10));
        when(libraryService.findEpisode(8L, 2, 2)).thenReturn(Optional.of(missing));
        when(indexerService.searchTv("Severance", 2, 2, SearchType.AUTOMATIC)).thenReturn(List.of(single));
        when(decisionService.evaluate(eq(single), eq(missing), any())).thenReturn(ReleaseDecision.accept(0));
        when(grabService.grab(single, DownloadTarget.episode(8L, 2, 2), null)).thenReturn(grabbed());

        assertThat(autoSearchService.searchAndGrabSeason(8L, 2)).isPresent();
        verify(grabService, never()).grab(eq(pack), any(), any());
    }

    @Test
    void retry_movieSearchesEvenWhenCutoffMet() {
        WantedItem owned = arrival.toBuilder().hasFile(true).currentQuality("Bluray-1080p").build();
        when(libraryService.findMovie(42L)).thenReturn(Optional.of(owned));
        when(indexerService.searchMovies("Arrival", 2016, SearchType.AUTOMATIC)).thenReturn(List.of());

        assertThat(autoSearchService.retry(DownloadTarget.movie(42L))).isEmpty();
        verify(indexerService).searchMovies("Arrival", 2016, SearchType.AUTOMATIC);
        verify(qualityProfileOracle, never()).meetsCutoff(any(), anyString());
    }

    @Test
    void searchAllMissing_failureForOneItemDoesNotStopOthers() {
        WantedItem broken = arrival.toBuilder().target(DownloadTarget.movie(41L)).title("Broken").build();
        Release release = release("Arrival.2016.1080p.WEB-DL-GRP", 10);
        when(libraryService.findMissingMovies()).thenReturn(List.of(broken, arrival));
        when(libraryService.findMissingEpisodes()).thenReturn(List.of());
        when(libraryService.findMovie(41L)).thenThrow(new IllegalStateException("database gone"));
        when(libraryService.findMovie(42L)).thenReturn(Optional.of(arrival));
        when(indexerService.searchMovies("Arrival", 2016, SearchType.AUTOMATIC)).thenReturn(List.of(release));
        when(decisionService.evaluate(eq(release), eq(arrival), any())).thenReturn(ReleaseDecision.accept(0));
        when(grabService.grab(release, DownloadTarget.movie(42L), null)).thenReturn(grabbed());

        assertThat(autoSearchService.searchAllMissing()).isEqualTo(1);
    }

    @Test
    void searchCutoffUnmet_onlyItemsBelowCutoff() {
        WantedItem meets = arrival.toBuilder().target(DownloadTarget.movie(40L)).hasFile(true).currentQuality("Bluray-1080p").build();
        when(libraryService.findMoviesWithFiles()).thenReturn(List.of(meets));
        when(libraryService.findEpisodesWithFiles()).thenReturn(List.of());
        when(qualityProfileOracle.isUpgradeAllowed(1L)).thenReturn(true);
        when(qualityProfileOracle.meetsCutoff(1L, "Bluray-1080p")).thenReturn(true);

        assertThat(autoSearchService.searchCutoffUnmet()).isZero();
        verify(libraryService, never()).findMovie(any());
    }

    @Test
    void rank_tieBrokenBySeeders() {
        Release few = release("A", 5);
        Release many = release("B", 50);

        Optional<ScoredRelease> best = autoSearchService.rank(List.of(few, many), MediaKind.MOVIE, 1L, r -> ReleaseDecision.accept(0));

        assertThat(best).hasValueSatisfying(s -> assertThat(s.release()).isEqualTo(many));
    }
}
