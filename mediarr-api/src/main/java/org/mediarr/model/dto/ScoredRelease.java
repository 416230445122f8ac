package org.mediarr.model.dto;

public record ScoredRelease(Release release, int baseScore, int formatScore) {

    public int totalScore() {
        return baseScore + formatScore;
    }
}
