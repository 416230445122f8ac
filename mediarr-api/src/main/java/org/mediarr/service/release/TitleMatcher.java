package org.mediarr.service.release;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether a release title plausibly names a wanted movie or series.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TitleMatcher {

    private static final Set<String> ARTICLES = Set.of("the", "a", "an", "and", "of", "in", "on", "at", "to", "for");
    private static final Pattern TRAILING_YEAR = Pattern.compile("\\s*\\((?:19|20)\\d{2}\\)\\s*$");
    private static final Pattern ACRONYM_AI = Pattern.compile("\\ba\\.i\\.?", Pattern.CASE_INSENSITIVE);

    private final Clock clock;

    public boolean matches(String releaseTitle, String expectedTitle, Integer expectedYear, TitleMatchOptions options) {
        if (releaseTitle == null || expectedTitle == null) {
            return false;
        }
        if (expectedYear != null && ReleaseParser.hasTvMarker(releaseTitle)) {
            return false;
        }

        List<String> releaseWords = words(normalize(ReleaseParser.extractTitlePrefix(releaseTitle)));
        List<String> expectedWords = words(normalize(TRAILING_YEAR.matcher(expectedTitle).replaceFirst("")))
                .stream()
                .filter(w -> w.length() > 1 || Character.isDigit(w.charAt(0)))
                .toList();
        if (releaseWords.isEmpty() || expectedWords.isEmpty()) {
            return false;
        }

        List<String> contentWords = expectedWords.stream().filter(w -> !ARTICLES.contains(w)).toList();
        if (contentWords.isEmpty()) {
            contentWords = expectedWords;
        }

        Set<String> releaseSet = new HashSet<>(releaseWords);
        long matched = contentWords.stream().filter(releaseSet::contains).count();
        if ((double) matched / contentWords.size() < options.getMinContentRatio()) {
            return false;
        }

        boolean shortTitle = options.getShortTitleWordCount() > 0 && contentWords.size() <= options.getShortTitleWordCount();

        int maxIndex = shortTitle ? options.getShortTitleMaxFirstWordIndex() : options.getMaxFirstWordIndex();
        if (maxIndex >= 0) {
            int firstIndex = firstContentWordIndex(releaseWords, contentWords);
            if (firstIndex < 0 || firstIndex > maxIndex) {
                return false;
            }
        }

        Set<String> expectedSet = new HashSet<>(expectedWords);
        long extraWords = releaseWords.stream().filter(w -> !expectedSet.contains(w)).count();
        long maxExtra = shortTitle
                ? options.getShortTitleMaxExtraWords()
                : Math.max(options.getMinExtraWords(), (long) Math.floor(matched * options.getExtraWordsFactor()));
        if (extraWords > maxExtra) {
            return false;
        }

        if (expectedYear != null) {
            Integer releaseYear = ReleaseParser.extractYear(releaseTitle);
            if (releaseYear == null) {
                return expectedYear < LocalDate.now(clock).getYear();
            }
            return Math.abs(releaseYear - expectedYear) <= 1;
        }
        return true;
    }

    /**
     * Lowercases and strips punctuation. Runs of single letters are joined so "S.H.I.E.L.D." and
     * "S H I E L D" both become "shield".
     */
    public static String normalize(String title) {
        if (title == null) {
            return "";
        }
        String text = ACRONYM_AI.matcher(title).replaceAll("ai");
        text = text.toLowerCase()
                .replace("&", " and ")
                .replace("'", "")
                .replace("’", "")
                .replace("/", " ");
        text = text.replaceAll("[^\\p{L}\\p{N}]+", " ");
        text = text.replaceAll("(?<=\\b\\p{L}) (?=\\p{L}\\b)", "");
        text = text.replaceAll("\\band\\b", " ");
        return text.replaceAll("\\s+", " ").trim();
    }

    private static List<String> words(String normalized) {
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(normalized.split(" ")).filter(w -> !w.isEmpty()).collect(Collectors.toList());
    }

    private static int firstContentWordIndex(List<String> releaseWords, List<String> contentWords) {
        for (String word : contentWords) {
            int index = releaseWords.indexOf(word);
            if (index >= 0) {
                return index;
            }
        }
        return -1;
    }
}
