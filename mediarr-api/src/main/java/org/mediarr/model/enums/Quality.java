package org.mediarr.model.enums;

import lombok.Getter;

import java.util.Arrays;

/**
 * Composite quality tiers ordered by ascending weight. The declaration order is the ranking.
 */
@Getter
public enum Quality {
    UNKNOWN("Unknown", QualitySource.UNKNOWN, 0),
    WORKPRINT("WORKPRINT", QualitySource.WORKPRINT, 0),
    CAM("CAM", QualitySource.CAM, 0),
    TELESYNC("TELESYNC", QualitySource.TELESYNC, 0),
    TELECINE("TELECINE", QualitySource.TELECINE, 0),
    DVDSCR("DVDSCR", QualitySource.DVDSCR, 480),
    REGIONAL("REGIONAL", QualitySource.REGIONAL, 480),
    SDTV("SDTV", QualitySource.TV, 480),
    DVD("DVD", QualitySource.DVD, 480),
    WEBRIP_480P("WEBRip-480p", QualitySource.WEBRIP, 480),
    WEBDL_480P("WEBDL-480p", QualitySource.WEBDL, 480),
    BLURAY_480P("Bluray-480p", QualitySource.BLURAY, 480),
    HDTV_720P("HDTV-720p", QualitySource.TV, 720),
    WEBRIP_720P("WEBRip-720p", QualitySource.WEBRIP, 720),
    WEBDL_720P("WEBDL-720p", QualitySource.WEBDL, 720),
    BLURAY_720P("Bluray-720p", QualitySource.BLURAY, 720),
    HDTV_1080P("HDTV-1080p", QualitySource.TV, 1080),
    WEBRIP_1080P("WEBRip-1080p", QualitySource.WEBRIP, 1080),
    WEBDL_1080P("WEBDL-1080p", QualitySource.WEBDL, 1080),
    BLURAY_1080P("Bluray-1080p", QualitySource.BLURAY, 1080),
    REMUX_1080P("Remux-1080p", QualitySource.REMUX, 1080),
    HDTV_2160P("HDTV-2160p", QualitySource.TV, 2160),
    WEBRIP_2160P("WEBRip-2160p", QualitySource.WEBRIP, 2160),
    WEBDL_2160P("WEBDL-2160p", QualitySource.WEBDL, 2160),
    BLURAY_2160P("Bluray-2160p", QualitySource.BLURAY, 2160),
    REMUX_2160P("Remux-2160p", QualitySource.REMUX, 2160);

    private final String label;
    private final QualitySource source;
    private final int resolution;

    Quality(String label, QualitySource source, int resolution) {
        this.label = label;
        this.source = source;
        this.resolution = resolution;
    }

    public int getWeight() {
        return ordinal();
    }

    /**
     * WEB-DL and WEBRip of the same resolution share a profile group such as {@code WEB-1080p}.
     */
    public String getGroup() {
        if ((source == QualitySource.WEBDL || source == QualitySource.WEBRIP) && resolution > 0) {
            return "WEB-" + resolution + "p";
        }
        return null;
    }

    /**
     * Resolves a label or a group name. A group resolves to its lowest member.
     */
    public static Quality fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String trimmed = label.trim();
        return Arrays.stream(values())
                .filter(q -> q.label.equalsIgnoreCase(trimmed) || q.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseGet(() -> Arrays.stream(values())
                        .filter(q -> trimmed.equalsIgnoreCase(q.getGroup()))
                        .findFirst()
                        .orElse(UNKNOWN));
    }

    public static Quality of(QualitySource source, int resolution) {
        return Arrays.stream(values())
                .filter(q -> q.source == source && q.resolution == resolution)
                .findFirst()
                .orElse(UNKNOWN);
    }
}
