package org.mediarr.model.dto;

public record RssSyncResult(int indexersChecked, int releasesFound, int newReleases, int grabbed) {

    public static RssSyncResult skipped() {
        return new RssSyncResult(0, 0, 0, 0);
    }
}
