package org.mediarr.model.enums;

public enum QualitySource {
    UNKNOWN,
    WORKPRINT,
    CAM,
    TELESYNC,
    TELECINE,
    DVDSCR,
    REGIONAL,
    TV,
    DVD,
    WEBRIP,
    WEBDL,
    BLURAY,
    REMUX
}
