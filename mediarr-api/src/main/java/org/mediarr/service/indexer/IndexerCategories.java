package org.mediarr.service.indexer;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Map;

@UtilityClass
public class IndexerCategories {

    public static final List<Integer> MOVIE_CATEGORIES = List.of(2000, 2010, 2020, 2030, 2040, 2045, 2050, 2060);
    public static final List<Integer> TV_CATEGORIES = List.of(5000, 5010, 5020, 5030, 5040, 5045, 5050, 5060, 5070, 5080);
    public static final List<Integer> RSS_CATEGORIES = List.of(2000, 5000);

    private static final Map<Integer, String> LABELS = Map.ofEntries(
            Map.entry(2000, "Movies"),
            Map.entry(2010, "Movies/Foreign"),
            Map.entry(2020, "Movies/Other"),
            Map.entry(2030, "Movies/SD"),
            Map.entry(2040, "Movies/HD"),
            Map.entry(2045, "Movies/UHD"),
            Map.entry(2050, "Movies/BluRay"),
            Map.entry(2060, "Movies/3D"),
            Map.entry(5000, "TV"),
            Map.entry(5010, "TV/WEB-DL"),
            Map.entry(5020, "TV/Foreign"),
            Map.entry(5030, "TV/SD"),
            Map.entry(5040, "TV/HD"),
            Map.entry(5045, "TV/UHD"),
            Map.entry(5050, "TV/Other"),
            Map.entry(5060, "TV/Sport"),
            Map.entry(5070, "TV/Anime"),
            Map.entry(5080, "TV/Documentary")
    );

    public static String label(int code) {
        return LABELS.getOrDefault(code, String.valueOf(code));
    }

    public static boolean isMovie(int code) {
        return code >= 2000 && code < 3000;
    }

    public static boolean isTv(int code) {
        return code >= 5000 && code < 6000;
    }

    public static String toParam(List<Integer> codes) {
        return String.join(",", codes.stream().map(String::valueOf).toList());
    }
}
