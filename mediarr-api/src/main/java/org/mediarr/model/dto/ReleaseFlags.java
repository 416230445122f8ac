package org.mediarr.model.dto;

public record ReleaseFlags(boolean currentIsProper, boolean currentIsRepack, boolean newIsProper, boolean newIsRepack) {

    public static ReleaseFlags none() {
        return new ReleaseFlags(false, false, false, false);
    }

    public boolean currentIsRevision() {
        return currentIsProper || currentIsRepack;
    }

    public boolean newIsRevision() {
        return newIsProper || newIsRepack;
    }
}
