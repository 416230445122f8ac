package org.mediarr.service.customformat;

import org.mediarr.model.dto.Release;

/**
 * The release facts a custom format specification can look at.
 */
public record FormatInput(String title, Long size, boolean freeleech) {

    public static FormatInput of(String title, Long size) {
        return new FormatInput(title, size, false);
    }

    public static FormatInput of(Release release) {
        return new FormatInput(release.getTitle(), release.getSize(), release.isFreeleech());
    }
}
