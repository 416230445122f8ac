package org.mediarr.model.dto;

public record ReleaseDecision(boolean accepted, String rejectionReason, int formatScore) {

    public static ReleaseDecision accept(int formatScore) {
        return new ReleaseDecision(true, null, formatScore);
    }

    public static ReleaseDecision reject(String reason) {
        return new ReleaseDecision(false, reason, 0);
    }

    public static ReleaseDecision reject(String reason, int formatScore) {
        return new ReleaseDecision(false, reason, formatScore);
    }
}
