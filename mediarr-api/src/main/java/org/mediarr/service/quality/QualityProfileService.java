package org.mediarr.service.quality;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.config.AppProperties;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.ReleaseFlags;
import org.mediarr.model.entity.QualityProfileEntity;
import org.mediarr.model.enums.PropersPreference;
import org.mediarr.model.enums.Quality;
import org.mediarr.repository.QualityProfileRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class QualityProfileService implements QualityProfileOracle {

    private final QualityProfileRepository qualityProfileRepository;
    private final AppProperties appProperties;

    public QualityProfileEntity getProfile(Long profileId) {
        return find(profileId).orElseThrow(() -> ApiError.QUALITY_PROFILE_NOT_FOUND.createException(profileId));
    }

    @Override
    public boolean meetsProfile(Long profileId, String qualityLabel) {
        Optional<QualityProfileEntity> profile = find(profileId);
        if (profile.isEmpty()) {
            return false;
        }
        Quality quality = Quality.fromLabel(qualityLabel);
        return profile.get().getAllowedQualities().stream()
                .anyMatch(allowed -> allowed.equalsIgnoreCase(quality.getLabel())
                        || (quality.getGroup() != null && allowed.equalsIgnoreCase(quality.getGroup())));
    }

    /**
     * A same-tier candidate only wins as a PROPER/REPACK of a file that is not already one, and only
     * when the propers preference allows it. Otherwise the candidate must outrank the current file,
     * the current file must be below cutoff, and the candidate must be allowed by the profile.
     */
    @Override
    public boolean shouldUpgrade(Long profileId, String currentQuality, String candidateQuality, ReleaseFlags flags) {
        Optional<QualityProfileEntity> profile = find(profileId);
        if (profile.isEmpty() || !profile.get().isUpgradeAllowed()) {
            return false;
        }
        int currentWeight = Quality.fromLabel(currentQuality).getWeight();
        int candidateWeight = Quality.fromLabel(candidateQuality).getWeight();

        if (candidateWeight == currentWeight) {
            if (flags.currentIsRevision() || !flags.newIsRevision()) {
                return false;
            }
            PropersPreference preference = appProperties.getDownload().getPropersRepacks();
            return preference != PropersPreference.DO_NOT_UPGRADE && meetsProfile(profileId, candidateQuality);
        }
        if (currentWeight >= cutoffWeight(profile.get())) {
            return false;
        }
        if (candidateWeight <= currentWeight) {
            return false;
        }
        return meetsProfile(profileId, candidateQuality);
    }

    @Override
    public boolean meetsCutoff(Long profileId, String qualityLabel) {
        return find(profileId)
                .map(profile -> Quality.fromLabel(qualityLabel).getWeight() >= cutoffWeight(profile))
                .orElse(true);
    }

    @Override
    public boolean isUpgradeAllowed(Long profileId) {
        return find(profileId).map(QualityProfileEntity::isUpgradeAllowed).orElse(false);
    }

    @Override
    public int minCustomFormatScore(Long profileId) {
        return find(profileId).map(QualityProfileEntity::getMinFormatScore).orElse(0);
    }

    @Override
    public int cutoffWeight(Long profileId) {
        return find(profileId).map(this::cutoffWeight).orElse(Quality.UNKNOWN.getWeight());
    }

    private int cutoffWeight(QualityProfileEntity profile) {
        return Quality.fromLabel(profile.getCutoff()).getWeight();
    }

    private Optional<QualityProfileEntity> find(Long profileId) {
        if (profileId == null) {
            return Optional.empty();
        }
        return qualityProfileRepository.findById(profileId);
    }
}
