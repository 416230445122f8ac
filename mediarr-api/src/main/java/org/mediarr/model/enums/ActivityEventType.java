package org.mediarr.model.enums;

public enum ActivityEventType {
    GRABBED,
    DOWNLOAD_COMPLETED,
    IMPORTED,
    DOWNLOAD_FAILED,
    DOWNLOAD_CANCELLED,
    REDOWNLOAD_STARTED,
    REDOWNLOAD_FAILED
}
