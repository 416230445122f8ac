package org.mediarr.model.enums;

public enum IndexerKind {
    TORZNAB,
    NEWZNAB
}
