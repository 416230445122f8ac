package org.mediarr.model.enums;

import java.util.Arrays;
import java.util.Optional;

public enum SpecificationKind {
    RELEASE_TITLE("ReleaseTitleSpecification"),
    SOURCE("SourceSpecification"),
    RESOLUTION("ResolutionSpecification"),
    RELEASE_GROUP("ReleaseGroupSpecification"),
    LANGUAGE("LanguageSpecification"),
    INDEXER_FLAG("IndexerFlagSpecification"),
    SIZE("SizeSpecification"),
    QUALITY_MODIFIER("QualityModifierSpecification");

    private final String implementation;

    SpecificationKind(String implementation) {
        this.implementation = implementation;
    }

    public String getImplementation() {
        return implementation;
    }

    public static Optional<SpecificationKind> fromImplementation(String implementation) {
        return Arrays.stream(values())
                .filter(kind -> kind.implementation.equalsIgnoreCase(implementation) || kind.name().equalsIgnoreCase(implementation))
                .findFirst();
    }
}
