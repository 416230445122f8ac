package org.mediarr.model.dto;

public record RssCacheStats(long total, long processed, long grabbed) {
}
