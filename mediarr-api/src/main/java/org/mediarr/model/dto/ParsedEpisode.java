package org.mediarr.model.dto;

public record ParsedEpisode(int season, int episode) {
}
