package org.mediarr.model.enums;

public enum SearchType {
    AUTOMATIC(IndexerCapability.AUTOMATIC_SEARCH),
    INTERACTIVE(IndexerCapability.INTERACTIVE_SEARCH);

    private final IndexerCapability capability;

    SearchType(IndexerCapability capability) {
        this.capability = capability;
    }

    public IndexerCapability getCapability() {
        return capability;
    }
}
