package org.mediarr.service.customformat;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.mediarr.model.dto.FormatSpecification;
import org.mediarr.service.release.ReleaseParser;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates a single specification against a release, ignoring its negate flag.
 */
@Slf4j
@Component
public class SpecificationEvaluator {

    private static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

    private static final Map<String, Pattern> SOURCE_PATTERNS = Map.of(
            "1", Pattern.compile("\\b(cam|camrip|hdcam)\\b", Pattern.CASE_INSENSITIVE),
            "2", Pattern.compile("\\b(tc|telecine|hdtc)\\b", Pattern.CASE_INSENSITIVE),
            "3", Pattern.compile("\\b(ts|telesync|hdts)\\b", Pattern.CASE_INSENSITIVE),
            "4", Pattern.compile("\\bworkprint\\b", Pattern.CASE_INSENSITIVE),
            "5", Pattern.compile("\\b(dvd|dvdrip|dvd5|dvd9)\\b", Pattern.CASE_INSENSITIVE),
            "6", Pattern.compile("\\b(hdtv|pdtv|sdtv|tvrip)\\b", Pattern.CASE_INSENSITIVE),
            "7", Pattern.compile("\\b(web[ ._-]?dl|web)\\b", Pattern.CASE_INSENSITIVE),
            "8", Pattern.compile("\\bweb[ ._-]?rip\\b", Pattern.CASE_INSENSITIVE),
            "9", Pattern.compile("\\b(blu-?ray|bdrip|brrip|bd25|bd50|remux)\\b", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern FOREIGN_LANGUAGE = Pattern.compile(
            "\\b(french|vff|vostfr|truefrench|german|deutsch|spanish|espanol|castellano|latino|italian|ita|japanese|jap|multi|russian|rus|hindi|korean|portuguese)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, Pattern> LANGUAGE_PATTERNS = Map.of(
            "3", Pattern.compile("\\b(french|vff|vostfr|truefrench)\\b", Pattern.CASE_INSENSITIVE),
            "4", Pattern.compile("\\b(german|deutsch)\\b", Pattern.CASE_INSENSITIVE),
            "5", Pattern.compile("\\b(spanish|espanol|castellano|latino)\\b", Pattern.CASE_INSENSITIVE),
            "6", Pattern.compile("\\b(italian|ita)\\b", Pattern.CASE_INSENSITIVE),
            "8", Pattern.compile("\\b(japanese|jap)\\b", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern FREELEECH = Pattern.compile("\\bfreeleech\\b", Pattern.CASE_INSENSITIVE);

    private final Map<String, Pattern> regexCache = new ConcurrentHashMap<>();

    public boolean evaluate(FormatSpecification specification, FormatInput input) {
        if (specification.getKind() == null || input.title() == null) {
            return false;
        }
        String title = input.title();
        String text = ReleaseParser.separatorsToSpaces(title);
        String value = StringUtils.trimToEmpty(specification.getValue());

        return switch (specification.getKind()) {
            case RELEASE_TITLE -> regexFind(value, title);
            case RELEASE_GROUP -> {
                String group = ReleaseParser.parseReleaseGroup(title);
                yield group != null && regexFind(value, group);
            }
            case SOURCE -> {
                Pattern pattern = SOURCE_PATTERNS.get(value);
                yield pattern != null && pattern.matcher(text).find();
            }
            case RESOLUTION -> matchesResolution(value, title);
            case LANGUAGE -> matchesLanguage(value, text);
            case INDEXER_FLAG -> "1".equals(value) && (input.freeleech() || FREELEECH.matcher(text).find());
            case SIZE -> matchesSize(specification, input.size());
            case QUALITY_MODIFIER -> matchesModifier(value, title);
        };
    }

    private boolean regexFind(String regex, String target) {
        if (regex.isEmpty()) {
            return false;
        }
        Pattern pattern = regexCache.computeIfAbsent(regex, this::compileOrNever);
        return pattern.matcher(target).find();
    }

    private Pattern compileOrNever(String regex) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            log.debug("Invalid custom format regex '{}': {}", regex, e.getDescription());
            return Pattern.compile("(?!)");
        }
    }

    private static boolean matchesResolution(String value, String title) {
        int wanted;
        try {
            wanted = Integer.parseInt(value.replaceAll("\\D", ""));
        } catch (NumberFormatException e) {
            return false;
        }
        return ReleaseParser.detectQuality(title).getResolution() == wanted;
    }

    private static boolean matchesLanguage(String value, String text) {
        if ("1".equals(value)) {
            return !FOREIGN_LANGUAGE.matcher(text).find();
        }
        Pattern pattern = LANGUAGE_PATTERNS.get(value);
        return pattern != null && pattern.matcher(text).find();
    }

    private static boolean matchesSize(FormatSpecification specification, Long size) {
        if (size == null || size <= 0) {
            return true;
        }
        double gigabytes = size / BYTES_PER_GB;
        if (specification.getMin() != null && gigabytes < specification.getMin()) {
            return false;
        }
        return specification.getMax() == null || gigabytes <= specification.getMax();
    }

    private static boolean matchesModifier(String value, String title) {
        return switch (value) {
            case "1" -> ReleaseParser.isRemux(title) || ReleaseParser.detectQuality(title).getLabel().startsWith("Remux");
            case "2" -> ReleaseParser.isProper(title);
            case "3" -> ReleaseParser.isRepack(title);
            case "4" -> ReleaseParser.isReal(title);
            default -> false;
        };
    }

    static boolean isValidRegex(String regex) {
        try {
            Pattern.compile(regex);
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }
}
