package org.mediarr.service.customformat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mediarr.exception.APIException;
import org.mediarr.model.dto.FormatSpecification;
import org.mediarr.model.dto.Release;
import org.mediarr.model.entity.CustomFormatEntity;
import org.mediarr.model.entity.QualityProfileFormatScoreEntity;
import org.mediarr.model.enums.FormatMediaType;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.model.enums.SpecificationKind;
import org.mediarr.repository.CustomFormatRepository;
import org.mediarr.repository.QualityProfileFormatScoreRepository;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CustomFormatServiceTest {

    @Mock
    private CustomFormatRepository customFormatRepository;

    @Mock
    private QualityProfileFormatScoreRepository formatScoreRepository;

    private CustomFormatService customFormatService;

    @BeforeEach
    void setUp() {
        customFormatService = new CustomFormatService(customFormatRepository, formatScoreRepository, new SpecificationEvaluator());
    }

    private static FormatSpecification title(String regex, boolean required, boolean negate) {
        return FormatSpecification.builder()
                .name(regex)
                .kind(SpecificationKind.RELEASE_TITLE)
                .value(regex)
                .required(required)
                .negate(negate)
                .build();
    }

    @Test
    void matchesFormat_emptySpecificationsNeverMatch() {
        assertThat(customFormatService.matchesFormat("Movie.2020.1080p", List.of(), null)).isFalse();
        assertThat(customFormatService.matchesFormat("Movie.2020.1080p", null, null)).isFalse();
    }

    @Test
    void matchesFormat_allRequiredMustPass() {
        List<FormatSpecification> specs = List.of(title("1080p", true, false), title("x265", true, false));
        assertThat(customFormatService.matchesFormat("Movie.2020.1080p.x265", specs, null)).isTrue();
        assertThat(customFormatService.matchesFormat("Movie.2020.1080p.x264", specs, null)).isFalse();
    }

    @Test
    void matchesFormat_optionalNeedsAtLeastOne() {
        List<FormatSpecification> specs = List.of(title("DV", false, false), title("HDR", false, false));
        assertThat(customFormatService.matchesFormat("Movie.2020.2160p.HDR", specs, null)).isTrue();
        assertThat(customFormatService.matchesFormat("Movie.2020.2160p.SDR", specs, null)).isFalse();
    }

    @Test
    void matchesFormat_negateInvertsSingleSpecification() {
        List<FormatSpecification> specs = List.of(title("1080p", true, false), title("x264", true, true));
        assertThat(customFormatService.matchesFormat("Movie.2020.1080p.x265", specs, null)).isTrue();
        assertThat(customFormatService.matchesFormat("Movie.2020.1080p.x264", specs, null)).isFalse();
    }

    @Test
    void calculateReleaseScore_sumsProfileScoresOfMatchingFormats() {
        CustomFormatEntity hdr = CustomFormatEntity.builder().id(1L).name("HDR")
                .specifications(List.of(title("HDR", true, false))).build();
        CustomFormatEntity x265 = CustomFormatEntity.builder().id(2L).name("x265")
                .specifications(List.of(title("x265", true, false))).build();
        CustomFormatEntity seriesOnly = CustomFormatEntity.builder().id(3L).name("Anime").mediaType(FormatMediaType.SERIES)
                .specifications(List.of(title("2160p", true, false))).build();
        when(formatScoreRepository.findByQualityProfileId(7L)).thenReturn(List.of(
                score(7L, 1L, 50), score(7L, 2L, -10), score(7L, 3L, 1000)));
        when(customFormatRepository.findAllById(anyCollection())).thenReturn(List.of(hdr, x265, seriesOnly));

        Release release = Release.builder().title("Movie.2020.2160p.HDR.x265").build();

        assertThat(customFormatService.calculateReleaseScore(release, 7L, MediaKind.MOVIE)).isEqualTo(40);
    }

    @Test
    void calculateReleaseScore_zeroWithoutProfileOrScores() {
        assertThat(customFormatService.calculateReleaseScore("Movie.2020", null, null)).isZero();
        when(formatScoreRepository.findByQualityProfileId(1L)).thenReturn(List.of());
        assertThat(customFormatService.calculateReleaseScore("Movie.2020", 1L, null)).isZero();
        verify(customFormatRepository, never()).findAllById(anyCollection());
    }

    @Test
    void save_rejectsInvalidRegex() {
        CustomFormatEntity broken = CustomFormatEntity.builder().name("Broken")
                .specifications(List.of(title("(open", true, false))).build();

        assertThatThrownBy(() -> customFormatService.save(broken)).isInstanceOf(APIException.class);
        verify(customFormatRepository, never()).save(any());
    }

    @Test
    void setScore_updatesExistingAssignment() {
        QualityProfileFormatScoreEntity existing = score(1L, 2L, 5);
        when(formatScoreRepository.findByQualityProfileIdAndCustomFormatId(1L, 2L)).thenReturn(Optional.of(existing));
        when(formatScoreRepository.save(existing)).thenReturn(existing);

        assertThat(customFormatService.setScore(1L, 2L, 75).getScore()).isEqualTo(75);
    }

    private static QualityProfileFormatScoreEntity score(Long profileId, Long formatId, int score) {
        return QualityProfileFormatScoreEntity.builder().qualityProfileId(profileId).customFormatId(formatId).score(score).build();
    }
}
