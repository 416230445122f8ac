package org.mediarr.service.download;

import lombok.experimental.UtilityClass;
import org.mediarr.model.dto.ClientDownload;
import org.mediarr.service.release.TitleMatcher;

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds a client item for a release whose client handle is still unknown, by overlap of title words.
 */
@UtilityClass
public class DownloadHandleMatcher {

    public static Optional<ClientDownload> findByTitle(String releaseTitle, Collection<ClientDownload> items) {
        if (releaseTitle == null || items.isEmpty()) {
            return Optional.empty();
        }
        String normalizedTitle = TitleMatcher.normalize(releaseTitle);
        List<String> words = Arrays.stream(normalizedTitle.split(" ")).filter(w -> w.length() > 2).toList();
        double required = Math.min(3d, words.size() * 0.6);

        return items.stream()
                .filter(item -> item.getName() != null)
                .map(item -> score(item, normalizedTitle, words))
                .filter(candidate -> candidate.exact() || (!words.isEmpty() && candidate.matched() >= required))
                .max(Comparator.comparing(Candidate::exact).thenComparingInt(Candidate::matched))
                .map(Candidate::item);
    }

    private static Candidate score(ClientDownload item, String normalizedTitle, List<String> words) {
        String normalizedName = TitleMatcher.normalize(item.getName());
        List<String> nameWords = Arrays.asList(normalizedName.split(" "));
        int matched = (int) words.stream().filter(nameWords::contains).count();
        return new Candidate(item, matched, normalizedTitle.equals(normalizedName));
    }

    private record Candidate(ClientDownload item, int matched, boolean exact) {
    }
}
