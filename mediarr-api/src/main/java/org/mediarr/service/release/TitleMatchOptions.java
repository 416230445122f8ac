package org.mediarr.service.release;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Strictness knobs for {@link TitleMatcher}. A negative index limit disables the position check and a
 * {@code shortTitleWordCount} of zero disables the short-title rules.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TitleMatchOptions {
    private double minContentRatio;
    private int maxFirstWordIndex;
    private int shortTitleWordCount;
    private int shortTitleMaxFirstWordIndex;
    private int shortTitleMaxExtraWords;
    private double extraWordsFactor;
    private int minExtraWords;

    public static TitleMatchOptions rssDefaults() {
        return TitleMatchOptions.builder()
                .minContentRatio(0.8)
                .maxFirstWordIndex(2)
                .shortTitleWordCount(2)
                .shortTitleMaxFirstWordIndex(1)
                .shortTitleMaxExtraWords(1)
                .extraWordsFactor(0.5)
                .minExtraWords(2)
                .build();
    }

    public static TitleMatchOptions autoSearchDefaults() {
        return TitleMatchOptions.builder()
                .minContentRatio(0.8)
                .maxFirstWordIndex(-1)
                .shortTitleWordCount(0)
                .extraWordsFactor(2.0)
                .minExtraWords(2)
                .build();
    }

    public static TitleMatchOptions indexerFilterDefaults() {
        return TitleMatchOptions.builder()
                .minContentRatio(0.8)
                .maxFirstWordIndex(2)
                .shortTitleWordCount(0)
                .extraWordsFactor(1.0)
                .minExtraWords(2)
                .build();
    }
}
