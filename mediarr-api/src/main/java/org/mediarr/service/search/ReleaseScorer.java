package org.mediarr.service.search;

import lombok.RequiredArgsConstructor;
import org.mediarr.model.dto.Release;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.model.enums.Quality;
import org.mediarr.model.enums.QualitySource;
import org.mediarr.service.quality.QualityProfileOracle;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Base ranking score of a release, before custom format scores are added.
 */
@Component
@RequiredArgsConstructor
public class ReleaseScorer {

    private static final long MB = 1024L * 1024L;
    private static final Map<Integer, Long> EXPECTED_MOVIE_SIZE = Map.of(480, 700 * MB, 720, 1536 * MB, 1080, 3072 * MB, 2160, 10240 * MB);
    private static final Map<Integer, Long> EXPECTED_EPISODE_SIZE = Map.of(480, 200 * MB, 720, 500 * MB, 1080, 1024 * MB, 2160, 3072 * MB);

    private final QualityProfileOracle qualityProfileOracle;

    public int baseScore(Release release, Long profileId, MediaKind mediaKind) {
        Quality quality = Quality.fromLabel(ReleaseDecisionService.qualityOf(release));
        int score = 0;

        if (qualityProfileOracle.meetsProfile(profileId, quality.getLabel())) {
            score += 100;
        }

        int distance = quality.getWeight() - qualityProfileOracle.cutoffWeight(profileId);
        if (distance == 0) {
            score += 50;
        } else if (distance < 0) {
            score += Math.max(0, 50 + distance * 10);
        } else {
            score += Math.max(0, 50 - distance * 5);
        }

        if (release.getSeeders() != null) {
            score += Math.min(50, release.getSeeders() / 2);
        }

        score += sizePenalty(release.getSize(), quality, mediaKind);

        if (quality.getSource() == QualitySource.WEBDL || quality.getSource() == QualitySource.BLURAY) {
            score += 20;
        }
        return score;
    }

    /**
     * Releases far below the expected size for their resolution are often fakes or samples, and very
     * large ones are usually mislabelled remuxes or bundles.
     */
    static int sizePenalty(Long size, Quality quality, MediaKind mediaKind) {
        if (size == null || size <= 0) {
            return 0;
        }
        Map<Integer, Long> table = mediaKind == MediaKind.MOVIE ? EXPECTED_MOVIE_SIZE : EXPECTED_EPISODE_SIZE;
        Long expected = table.get(quality.getResolution());
        if (expected == null) {
            return 0;
        }
        if (mediaKind == MediaKind.SEASON) {
            expected = expected * 8;
        }
        double ratio = (double) size / expected;
        if (ratio < 0.2) {
            return -50;
        }
        if (ratio < 0.5) {
            return -20;
        }
        if (ratio > 5) {
            return -20;
        }
        return 0;
    }
}
