package org.mediarr.service.quality;

import org.mediarr.model.dto.ReleaseFlags;

public interface QualityProfileOracle {

    boolean meetsProfile(Long profileId, String qualityLabel);

    boolean shouldUpgrade(Long profileId, String currentQuality, String candidateQuality, ReleaseFlags flags);

    boolean meetsCutoff(Long profileId, String qualityLabel);

    boolean isUpgradeAllowed(Long profileId);

    int minCustomFormatScore(Long profileId);

    int cutoffWeight(Long profileId);
}
