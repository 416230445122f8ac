package org.mediarr.model.enums;

public enum GrabOutcome {
    GRABBED,
    ACTIVE_DOWNLOAD_EXISTS,
    ALREADY_DOWNLOADING,
    BLACKLISTED,
    CLIENT_REJECTED
}
