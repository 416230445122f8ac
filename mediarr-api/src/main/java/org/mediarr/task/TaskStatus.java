package org.mediarr.task;

public enum TaskStatus {
    ACCEPTED,
    IN_PROGRESS,
    COMPLETED,
    SKIPPED,
    FAILED
}
