package org.mediarr.model.enums;

public enum NotificationEvent {
    ON_GRAB,
    ON_DOWNLOAD,
    ON_IMPORT,
    ON_DOWNLOAD_FAILURE
}
