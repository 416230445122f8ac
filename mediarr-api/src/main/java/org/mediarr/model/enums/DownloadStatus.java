package org.mediarr.model.enums;

import java.util.EnumSet;
import java.util.Set;

public enum DownloadStatus {
    QUEUED,
    DOWNLOADING,
    COMPLETED,
    IMPORTING,
    IMPORTED,
    FAILED;

    public static final Set<DownloadStatus> ACTIVE = EnumSet.of(QUEUED, DOWNLOADING, COMPLETED, IMPORTING);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
