package org.mediarr.model.enums;

public enum PropersPreference {
    PREFER_AND_UPGRADE,
    DO_NOT_UPGRADE,
    DO_NOT_PREFER
}
