package org.mediarr.model.enums;

public enum MediaKind {
    MOVIE,
    EPISODE,
    SEASON
}
