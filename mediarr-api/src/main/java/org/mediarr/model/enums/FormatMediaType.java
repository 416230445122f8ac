package org.mediarr.model.enums;

public enum FormatMediaType {
    MOVIE,
    SERIES,
    BOTH;

    public boolean appliesTo(MediaKind kind) {
        if (this == BOTH) {
            return true;
        }
        return this == MOVIE ? kind == MediaKind.MOVIE : kind != MediaKind.MOVIE;
    }
}
