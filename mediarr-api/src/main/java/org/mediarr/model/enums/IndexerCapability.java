package org.mediarr.model.enums;

public enum IndexerCapability {
    RSS,
    AUTOMATIC_SEARCH,
    INTERACTIVE_SEARCH
}
