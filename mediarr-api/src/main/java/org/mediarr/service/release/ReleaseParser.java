package org.mediarr.service.release;

import lombok.experimental.UtilityClass;
import org.mediarr.model.dto.ParsedEpisode;
import org.mediarr.model.enums.Quality;
import org.mediarr.model.enums.QualitySource;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure parsing of free-text release titles. Every pattern list is ordered and first match wins.
 */
@UtilityClass
public class ReleaseParser {

    private record EpisodePattern(Pattern pattern, Function<Matcher, ParsedEpisode> extractor) {
    }

    private record SourcePattern(QualitySource source, Pattern pattern) {
    }

    private static final List<EpisodePattern> EPISODE_PATTERNS = List.of(
            new EpisodePattern(Pattern.compile("(?<![a-z0-9])s(\\d{1,2})[ ._-]?e(\\d{1,3})(?!\\d)", Pattern.CASE_INSENSITIVE),
                    m -> new ParsedEpisode(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)))),
            new EpisodePattern(Pattern.compile("(?<![a-z0-9])s(\\d{3,4})[ ._-]?e(\\d{2,4})(?!\\d)", Pattern.CASE_INSENSITIVE),
                    m -> new ParsedEpisode(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)))),
            new EpisodePattern(Pattern.compile("(?<![a-z0-9])(\\d{1,2})x(\\d{2,3})(?!\\d)", Pattern.CASE_INSENSITIVE),
                    m -> new ParsedEpisode(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)))),
            new EpisodePattern(Pattern.compile("season[ ._-]?(\\d{1,2})[ ._-]*episode[ ._-]?(\\d{1,3})", Pattern.CASE_INSENSITIVE),
                    m -> new ParsedEpisode(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)))),
            new EpisodePattern(Pattern.compile("[ ._-](\\d)(\\d{2})[ ._-]"),
                    ReleaseParser::threeDigitEpisode)
    );

    private static final Set<Integer> NON_EPISODE_NUMBERS = Set.of(264, 265, 480, 576, 720);

    private static final Pattern SEASON_PACK = Pattern.compile("(?<![a-z0-9])s(\\d{1,2})(?![e\\d])", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEASON_WORD_PACK = Pattern.compile("\\b(?:complete[ ._-])?season[ ._-]?(\\d{1,2})\\b(?![ ._-]*episode)", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> TV_MARKERS = List.of(
            Pattern.compile("(?<![a-z0-9])s\\d{1,2}[ ._-]?e\\d{1,3}", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<![a-z0-9])s\\d{1,2}\\b(?!\\d)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<![a-z0-9])\\d{1,2}x\\d{2,3}(?!\\d)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bseason[ ._-]?\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bepisode[ ._-]?\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bcomplete[ ._-](?:series|season)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bmini[ ._-]?series\\b", Pattern.CASE_INSENSITIVE)
    );

    private static final Map<Integer, Pattern> RESOLUTIONS = Map.of(
            2160, Pattern.compile("\\b(2160p|4k|uhd)\\b", Pattern.CASE_INSENSITIVE),
            1080, Pattern.compile("\\b1080[pi]\\b", Pattern.CASE_INSENSITIVE),
            720, Pattern.compile("\\b720p\\b", Pattern.CASE_INSENSITIVE),
            480, Pattern.compile("\\b(480p|576p|sdtv)\\b", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Integer> RESOLUTION_ORDER = List.of(2160, 1080, 720, 480);

    private static final List<SourcePattern> LOW_GRADE_SOURCES = List.of(
            new SourcePattern(QualitySource.WORKPRINT, Pattern.compile("\\bworkprint\\b", Pattern.CASE_INSENSITIVE)),
            new SourcePattern(QualitySource.CAM, Pattern.compile("\\b(cam|camrip|hdcam|hqcam)\\b", Pattern.CASE_INSENSITIVE)),
            new SourcePattern(QualitySource.TELESYNC, Pattern.compile("\\b(ts|telesync|hdts|pdvd)\\b", Pattern.CASE_INSENSITIVE)),
            new SourcePattern(QualitySource.TELECINE, Pattern.compile("\\b(tc|telecine|hdtc)\\b", Pattern.CASE_INSENSITIVE)),
            new SourcePattern(QualitySource.DVDSCR, Pattern.compile("\\b(dvdscr|screener|scr)\\b", Pattern.CASE_INSENSITIVE)),
            new SourcePattern(QualitySource.REGIONAL, Pattern.compile("\\br5\\b", Pattern.CASE_INSENSITIVE))
    );

    private static final List<SourcePattern> SOURCES = List.of(
            new SourcePattern(QualitySource.REMUX, Pattern.compile("\\bremux\\b", Pattern.CASE_INSENSITIVE)),
            new SourcePattern(QualitySource.BLURAY, Pattern.compile("\\b(blu-?ray|bdrip|brrip|bd(?:25|50)?)\\b", Pattern.CASE_INSENSITIVE)),
            new SourcePattern(QualitySource.WEBDL, Pattern.compile("\\bweb[ ._-]?dl\\b", Pattern.CASE_INSENSITIVE)),
            new SourcePattern(QualitySource.WEBRIP, Pattern.compile("\\bweb[ ._-]?rip\\b", Pattern.CASE_INSENSITIVE)),
            new SourcePattern(QualitySource.WEBDL, Pattern.compile("\\bweb\\b", Pattern.CASE_INSENSITIVE)),
            new SourcePattern(QualitySource.TV, Pattern.compile("\\b(hdtv|pdtv|dsr|tvrip)\\b", Pattern.CASE_INSENSITIVE)),
            new SourcePattern(QualitySource.DVD, Pattern.compile("\\b(dvdrip|dvd|dvd[59]|ntsc|pal)\\b", Pattern.CASE_INSENSITIVE))
    );

    private static final Pattern PROPER = Pattern.compile("\\bproper\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern REPACK = Pattern.compile("\\b(repack|rerip)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern REAL = Pattern.compile("\\bREAL\\b");

    private static final Pattern YEAR = Pattern.compile("(?<![0-9])((?:19|20)\\d{2})(?![0-9])");

    private static final Pattern VIDEO_EXTENSION = Pattern.compile("\\.(mkv|mp4|avi|m4v|wmv|mov|ts|m2ts)$", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> TITLE_TERMINATORS = List.of(
            Pattern.compile("(?<![a-z0-9])s\\d{1,2}(?:e\\d{1,3})?(?![a-z0-9])", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<![a-z0-9])\\d{1,2}x\\d{2,3}(?![0-9])", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(2160p|1080[pi]|720p|480p|576p|4k|uhd)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(blu-?ray|bdrip|brrip|remux|web-?dl|web-?rip|web|hdtv|dvdrip|x264|x265|h\\.?264|h\\.?265|hevc|xvid)\\b", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern RELEASE_GROUP = Pattern.compile("-([a-z0-9]+)(?:\\[[^\\]]*\\])?(?:\\.(?:mkv|mp4|avi|m4v|wmv|mov|ts|m2ts|nzb|torrent))?$", Pattern.CASE_INSENSITIVE);
    private static final Set<String> NOT_A_GROUP = Set.of("dl", "rip", "hd", "sd", "x264", "x265", "h264", "h265", "hevc", "1080p", "720p", "2160p");

    private static final List<Map.Entry<String, Pattern>> VIDEO_CODECS = List.of(
            Map.entry("x265", Pattern.compile("\\b(x265|h\\.?265|hevc)\\b", Pattern.CASE_INSENSITIVE)),
            Map.entry("x264", Pattern.compile("\\b(x264|h\\.?264|avc)\\b", Pattern.CASE_INSENSITIVE)),
            Map.entry("AV1", Pattern.compile("\\bav1\\b", Pattern.CASE_INSENSITIVE)),
            Map.entry("XviD", Pattern.compile("\\bxvid\\b", Pattern.CASE_INSENSITIVE))
    );

    private static final List<Map.Entry<String, Pattern>> AUDIO_CODECS = List.of(
            Map.entry("TrueHD Atmos", Pattern.compile("\\btruehd[ ._-]?atmos\\b", Pattern.CASE_INSENSITIVE)),
            Map.entry("TrueHD", Pattern.compile("\\btruehd\\b", Pattern.CASE_INSENSITIVE)),
            Map.entry("DTS-HD MA", Pattern.compile("\\bdts[ ._-]?hd[ ._-]?ma\\b", Pattern.CASE_INSENSITIVE)),
            Map.entry("DTS", Pattern.compile("\\bdts\\b", Pattern.CASE_INSENSITIVE)),
            Map.entry("EAC3", Pattern.compile("\\b(e-?ac-?3|ddp|dd\\+)", Pattern.CASE_INSENSITIVE)),
            Map.entry("AC3", Pattern.compile("\\b(ac-?3|dd5[ ._]?1|dd)\\b", Pattern.CASE_INSENSITIVE)),
            Map.entry("AAC", Pattern.compile("\\baac", Pattern.CASE_INSENSITIVE)),
            Map.entry("FLAC", Pattern.compile("\\bflac\\b", Pattern.CASE_INSENSITIVE))
    );

    public static Quality detectQuality(String title) {
        if (title == null || title.isBlank()) {
            return Quality.UNKNOWN;
        }
        String text = separatorsToSpaces(VIDEO_EXTENSION.matcher(title.trim()).replaceFirst(""));
        for (SourcePattern low : LOW_GRADE_SOURCES) {
            if (low.pattern().matcher(text).find()) {
                return Quality.of(low.source(), low.source() == QualitySource.DVDSCR || low.source() == QualitySource.REGIONAL ? 480 : 0);
            }
        }

        Integer resolution = detectResolution(text);
        QualitySource source = detectSource(text);

        if (resolution == null) {
            return switch (source) {
                case REMUX -> Quality.REMUX_1080P;
                case BLURAY -> Quality.BLURAY_1080P;
                case WEBDL, WEBRIP -> Quality.WEBDL_1080P;
                case TV -> Quality.HDTV_1080P;
                case DVD -> Quality.DVD;
                default -> Quality.UNKNOWN;
            };
        }
        if (resolution == 480) {
            return switch (source) {
                case BLURAY, REMUX -> Quality.BLURAY_480P;
                case WEBDL -> Quality.WEBDL_480P;
                case WEBRIP -> Quality.WEBRIP_480P;
                case DVD -> Quality.DVD;
                default -> Quality.SDTV;
            };
        }
        if (source == QualitySource.UNKNOWN || source == QualitySource.DVD) {
            source = QualitySource.TV;
        }
        if (source == QualitySource.REMUX && resolution == 720) {
            source = QualitySource.BLURAY;
        }
        return Quality.of(source, resolution);
    }

    public static boolean isProper(String title) {
        return title != null && PROPER.matcher(separatorsToSpaces(title)).find();
    }

    public static boolean isRepack(String title) {
        return title != null && REPACK.matcher(separatorsToSpaces(title)).find();
    }

    public static boolean isReal(String title) {
        return title != null && REAL.matcher(separatorsToSpaces(title)).find();
    }

    public static boolean isRemux(String title) {
        return title != null && SOURCES.get(0).pattern().matcher(separatorsToSpaces(title)).find();
    }

    public static Optional<ParsedEpisode> parseEpisode(String title) {
        if (title == null) {
            return Optional.empty();
        }
        for (EpisodePattern episodePattern : EPISODE_PATTERNS) {
            Matcher m = episodePattern.pattern().matcher(title);
            while (m.find()) {
                ParsedEpisode parsed = episodePattern.extractor().apply(m);
                if (parsed != null) {
                    return Optional.of(parsed);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Season number of a full-season release: a bare {@code S01} or {@code Season 1} without any episode marker.
     */
    public static Optional<Integer> parseSeasonPack(String title) {
        if (title == null || parseEpisode(title).isPresent()) {
            return Optional.empty();
        }
        Matcher m = SEASON_PACK.matcher(title);
        if (m.find()) {
            return Optional.of(Integer.parseInt(m.group(1)));
        }
        Matcher word = SEASON_WORD_PACK.matcher(separatorsToSpaces(title));
        if (word.find()) {
            return Optional.of(Integer.parseInt(word.group(1)));
        }
        return Optional.empty();
    }

    public static boolean hasTvMarker(String title) {
        if (title == null) {
            return false;
        }
        String text = separatorsToSpaces(title);
        return TV_MARKERS.stream().anyMatch(p -> p.matcher(text).find());
    }

    /**
     * The title part of a release name: everything before the release year, season marker, resolution
     * or source/codec token. The release year is the last year ahead of the other markers, so titles
     * that contain a year ("Blade Runner 2049", "1917") keep it.
     */
    public static String extractTitlePrefix(String title) {
        if (title == null) {
            return "";
        }
        String text = separatorsToSpaces(VIDEO_EXTENSION.matcher(title.trim()).replaceFirst("")).trim();
        int cut = text.length();
        for (Pattern terminator : TITLE_TERMINATORS) {
            Matcher m = terminator.matcher(text);
            while (m.find()) {
                if (m.start() > 0) {
                    cut = Math.min(cut, m.start());
                    break;
                }
            }
        }
        int yearStart = releaseYearStart(text, cut);
        if (yearStart > 0) {
            cut = yearStart;
        }
        return text.substring(0, cut).replaceAll("[\\s(\\[-]+$", "").trim();
    }

    public static Integer extractYear(String title) {
        if (title == null) {
            return null;
        }
        String text = separatorsToSpaces(title).trim();
        int otherCut = text.length();
        for (Pattern terminator : TITLE_TERMINATORS) {
            Matcher m = terminator.matcher(text);
            if (m.find()) {
                otherCut = Math.min(otherCut, m.start());
            }
        }
        int start = releaseYearStart(text, otherCut);
        if (start < 0) {
            Matcher any = YEAR.matcher(text);
            return any.find() ? Integer.parseInt(any.group(1)) : null;
        }
        return Integer.parseInt(text.substring(start, start + 4));
    }

    private static int releaseYearStart(String text, int limit) {
        Matcher m = YEAR.matcher(text);
        int start = -1;
        while (m.find() && m.start() < limit) {
            if (m.start() > 0) {
                start = m.start();
            }
        }
        return start;
    }

    public static String parseReleaseGroup(String title) {
        if (title == null) {
            return null;
        }
        Matcher m = RELEASE_GROUP.matcher(title.trim());
        if (m.find()) {
            String group = m.group(1);
            if (!NOT_A_GROUP.contains(group.toLowerCase())) {
                return group;
            }
        }
        return null;
    }

    public static String parseVideoCodec(String title) {
        return firstLabel(VIDEO_CODECS, title);
    }

    public static String parseAudioCodec(String title) {
        return firstLabel(AUDIO_CODECS, title);
    }

    public static String separatorsToSpaces(String title) {
        return title.replace('.', ' ').replace('_', ' ');
    }

    private static Integer detectResolution(String text) {
        for (Integer resolution : RESOLUTION_ORDER) {
            if (RESOLUTIONS.get(resolution).matcher(text).find()) {
                return resolution;
            }
        }
        return null;
    }

    private static QualitySource detectSource(String text) {
        for (SourcePattern sourcePattern : SOURCES) {
            if (sourcePattern.pattern().matcher(text).find()) {
                return sourcePattern.source();
            }
        }
        return QualitySource.UNKNOWN;
    }

    private static ParsedEpisode threeDigitEpisode(Matcher m) {
        int whole = Integer.parseInt(m.group(1) + m.group(2));
        if (NON_EPISODE_NUMBERS.contains(whole) || Integer.parseInt(m.group(1)) == 0) {
            return null;
        }
        return new ParsedEpisode(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    private static String firstLabel(List<Map.Entry<String, Pattern>> table, String title) {
        if (title == null) {
            return null;
        }
        String text = separatorsToSpaces(title);
        return table.stream()
                .filter(entry -> entry.getValue().matcher(text).find())
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
    }
}
