package org.mediarr.service.customformat;

import org.junit.jupiter.api.Test;
import org.mediarr.model.dto.FormatSpecification;
import org.mediarr.model.enums.SpecificationKind;

import static org.assertj.core.api.Assertions.assertThat;

class SpecificationEvaluatorTest {

    private static final long GB = 1024L * 1024L * 1024L;

    private final SpecificationEvaluator evaluator = new SpecificationEvaluator();

    private static FormatSpecification spec(SpecificationKind kind, String value) {
        return FormatSpecification.builder().name(kind.name()).kind(kind).value(value).build();
    }

    @Test
    void releaseTitle_regexIsCaseInsensitive() {
        FormatSpecification hdr = spec(SpecificationKind.RELEASE_TITLE, "\\bhdr(10)?\\b");
        assertThat(evaluator.evaluate(hdr, FormatInput.of("Movie.2020.2160p.HDR10.WEB-DL", null))).isTrue();
        assertThat(evaluator.evaluate(hdr, FormatInput.of("Movie.2020.1080p.WEB-DL", null))).isFalse();
    }

    @Test
    void releaseTitle_invalidRegexNeverMatches() {
        assertThat(evaluator.evaluate(spec(SpecificationKind.RELEASE_TITLE, "(unclosed"), FormatInput.of("(unclosed", null))).isFalse();
    }

    @Test
    void releaseGroup_matchesParsedGroupOnly() {
        FormatSpecification group = spec(SpecificationKind.RELEASE_GROUP, "^FLUX$");
        assertThat(evaluator.evaluate(group, FormatInput.of("Show.S01E01.1080p.WEB-DL.x264-FLUX", null))).isTrue();
        assertThat(evaluator.evaluate(group, FormatInput.of("FLUX.Show.S01E01.1080p.WEB-DL-OTHER", null))).isFalse();
    }

    @Test
    void sourceAndResolution() {
        String title = "Movie.2020.1080p.BluRay.x264-GRP";
        assertThat(evaluator.evaluate(spec(SpecificationKind.SOURCE, "9"), FormatInput.of(title, null))).isTrue();
        assertThat(evaluator.evaluate(spec(SpecificationKind.SOURCE, "7"), FormatInput.of(title, null))).isFalse();
        assertThat(evaluator.evaluate(spec(SpecificationKind.RESOLUTION, "1080"), FormatInput.of(title, null))).isTrue();
        assertThat(evaluator.evaluate(spec(SpecificationKind.RESOLUTION, "r2160p"), FormatInput.of(title, null))).isFalse();
    }

    @Test
    void language_originalMeansNoForeignTag() {
        FormatSpecification original = spec(SpecificationKind.LANGUAGE, "1");
        assertThat(evaluator.evaluate(original, FormatInput.of("Movie.2020.1080p.WEB-DL", null))).isTrue();
        assertThat(evaluator.evaluate(original, FormatInput.of("Movie.2020.FRENCH.1080p.WEB-DL", null))).isFalse();
        assertThat(evaluator.evaluate(spec(SpecificationKind.LANGUAGE, "4"), FormatInput.of("Movie.2020.GERMAN.1080p", null))).isTrue();
    }

    @Test
    void indexerFlag_freeleechFromReleaseOrTitle() {
        FormatSpecification freeleech = spec(SpecificationKind.INDEXER_FLAG, "1");
        assertThat(evaluator.evaluate(freeleech, new FormatInput("Movie.2020.1080p", null, true))).isTrue();
        assertThat(evaluator.evaluate(freeleech, FormatInput.of("Movie.2020.1080p.FreeLeech", null))).isTrue();
        assertThat(evaluator.evaluate(freeleech, FormatInput.of("Movie.2020.1080p", null))).isFalse();
    }

    @Test
    void size_boundsInGigabytes() {
        FormatSpecification size = FormatSpecification.builder().kind(SpecificationKind.SIZE).min(1d).max(5d).build();
        assertThat(evaluator.evaluate(size, FormatInput.of("Movie", 2 * GB))).isTrue();
        assertThat(evaluator.evaluate(size, FormatInput.of("Movie", 8 * GB))).isFalse();
        assertThat(evaluator.evaluate(size, FormatInput.of("Movie", GB / 2))).isFalse();
        assertThat(evaluator.evaluate(size, FormatInput.of("Movie", null))).isTrue();
    }

    @Test
    void qualityModifier() {
        assertThat(evaluator.evaluate(spec(SpecificationKind.QUALITY_MODIFIER, "1"), FormatInput.of("Movie.2020.1080p.BluRay.REMUX", null))).isTrue();
        assertThat(evaluator.evaluate(spec(SpecificationKind.QUALITY_MODIFIER, "2"), FormatInput.of("Movie.2020.PROPER.1080p", null))).isTrue();
        assertThat(evaluator.evaluate(spec(SpecificationKind.QUALITY_MODIFIER, "3"), FormatInput.of("Movie.2020.1080p", null))).isFalse();
    }
}
