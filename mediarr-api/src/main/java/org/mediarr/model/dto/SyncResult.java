package org.mediarr.model.dto;

public record SyncResult(int synced, int completed, int failed) {
}
