package org.mediarr.model.dto;

import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.GrabOutcome;

public record GrabResult(GrabOutcome outcome, DownloadEntity download, String message) {

    public boolean isGrabbed() {
        return outcome == GrabOutcome.GRABBED;
    }
}
