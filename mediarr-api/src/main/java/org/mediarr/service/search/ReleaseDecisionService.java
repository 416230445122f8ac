package org.mediarr.service.search;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.model.dto.DownloadTarget;
import org.mediarr.model.dto.Release;
import org.mediarr.model.dto.ReleaseDecision;
import org.mediarr.model.dto.ReleaseFlags;
import org.mediarr.model.dto.WantedItem;
import org.mediarr.service.customformat.CustomFormatService;
import org.mediarr.service.download.BlacklistService;
import org.mediarr.service.quality.QualityProfileOracle;
import org.mediarr.service.release.ReleaseParser;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Accept/reject gate shared by RSS sync and automatic search: profile quality, upgrade rules,
 * blacklist and minimum custom format score.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReleaseDecisionService {

    private final QualityProfileOracle qualityProfileOracle;
    private final CustomFormatService customFormatService;
    private final BlacklistService blacklistService;

    public ReleaseDecision evaluate(Release release, WantedItem item) {
        return evaluate(release, item, blacklistService.blacklistedTitles(item.getTarget()));
    }

    /**
     * @param blacklistedTitles lowercased blacklisted titles for the item's target
     */
    public ReleaseDecision evaluate(Release release, WantedItem item, Set<String> blacklistedTitles) {
        Long profileId = item.getQualityProfileId();
        if (profileId == null) {
            return ReleaseDecision.reject("No quality profile assigned");
        }
        String quality = qualityOf(release);
        if (!qualityProfileOracle.meetsProfile(profileId, quality)) {
            return ReleaseDecision.reject("Quality " + quality + " is not allowed by the profile");
        }
        if (item.isHasFile()) {
            ReleaseFlags flags = new ReleaseFlags(item.isCurrentProper(), item.isCurrentRepack(),
                    ReleaseParser.isProper(release.getTitle()), ReleaseParser.isRepack(release.getTitle()));
            if (!qualityProfileOracle.shouldUpgrade(profileId, item.getCurrentQuality(), quality, flags)) {
                return ReleaseDecision.reject("Not an upgrade over " + item.getCurrentQuality());
            }
        }
        if (blacklistedTitles.contains(release.getTitle().toLowerCase(Locale.ROOT))) {
            return ReleaseDecision.reject("Release is blacklisted");
        }
        return scoreGate(release, profileId, item.getTarget());
    }

    /**
     * Season packs are judged against the whole season. When every episode already has a file the
     * pack is only wanted if the profile allows upgrades at all; per-episode cutoff state is not
     * consulted.
     */
    public ReleaseDecision evaluateSeasonPack(Release release, Long profileId, DownloadTarget seasonTarget, List<WantedItem> episodes) {
        if (profileId == null) {
            return ReleaseDecision.reject("No quality profile assigned");
        }
        List<WantedItem> monitored = episodes.stream().filter(WantedItem::isMonitored).toList();
        if (monitored.isEmpty()) {
            return ReleaseDecision.reject("No monitored episodes in season");
        }
        boolean anyMissing = monitored.stream().anyMatch(e -> !e.isHasFile());
        if (!anyMissing && !qualityProfileOracle.isUpgradeAllowed(profileId)) {
            return ReleaseDecision.reject("Season already complete and upgrades are disabled");
        }
        String quality = qualityOf(release);
        if (!qualityProfileOracle.meetsProfile(profileId, quality)) {
            return ReleaseDecision.reject("Quality " + quality + " is not allowed by the profile");
        }
        if (blacklistService.isBlacklisted(seasonTarget, release.getTitle())) {
            return ReleaseDecision.reject("Release is blacklisted");
        }
        return scoreGate(release, profileId, seasonTarget);
    }

    static String qualityOf(Release release) {
        return release.getQuality() != null ? release.getQuality() : ReleaseParser.detectQuality(release.getTitle()).getLabel();
    }

    private ReleaseDecision scoreGate(Release release, Long profileId, DownloadTarget target) {
        int score = customFormatService.calculateReleaseScore(release, profileId, target.kind());
        int minimum = qualityProfileOracle.minCustomFormatScore(profileId);
        if (score < minimum) {
            return ReleaseDecision.reject("Custom format score " + score + " is below minimum " + minimum, score);
        }
        return ReleaseDecision.accept(score);
    }
}
