package org.mediarr.service.customformat;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.FormatSpecification;
import org.mediarr.model.dto.Release;
import org.mediarr.model.entity.CustomFormatEntity;
import org.mediarr.model.entity.QualityProfileFormatScoreEntity;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.model.enums.SpecificationKind;
import org.mediarr.repository.CustomFormatRepository;
import org.mediarr.repository.QualityProfileFormatScoreRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class CustomFormatService {

    private final CustomFormatRepository customFormatRepository;
    private final QualityProfileFormatScoreRepository formatScoreRepository;
    private final SpecificationEvaluator specificationEvaluator;

    public boolean matchesFormat(String title, List<FormatSpecification> specifications, Long size) {
        return matchesFormat(FormatInput.of(title, size), specifications);
    }

    /**
     * Every required specification must pass. When non-required specifications exist, at least one of
     * them must pass as well. Negate is applied per specification before either rule.
     */
    public boolean matchesFormat(FormatInput input, List<FormatSpecification> specifications) {
        if (specifications == null || specifications.isEmpty()) {
            return false;
        }
        boolean anyOptional = false;
        boolean optionalPassed = false;
        for (FormatSpecification specification : specifications) {
            boolean passed = specificationEvaluator.evaluate(specification, input) != specification.isNegate();
            if (specification.isRequired()) {
                if (!passed) {
                    return false;
                }
            } else {
                anyOptional = true;
                optionalPassed |= passed;
            }
        }
        return !anyOptional || optionalPassed;
    }

    public int calculateReleaseScore(String title, Long profileId, Long size) {
        return calculateReleaseScore(FormatInput.of(title, size), profileId, null);
    }

    public int calculateReleaseScore(Release release, Long profileId, MediaKind mediaKind) {
        return calculateReleaseScore(FormatInput.of(release), profileId, mediaKind);
    }

    /**
     * Sum of the profile's scores over every format the release matches. Formats without a score
     * in the profile contribute nothing.
     */
    public int calculateReleaseScore(FormatInput input, Long profileId, MediaKind mediaKind) {
        if (profileId == null) {
            return 0;
        }
        Map<Long, Integer> scores = formatScoreRepository.findByQualityProfileId(profileId).stream()
                .collect(Collectors.toMap(QualityProfileFormatScoreEntity::getCustomFormatId,
                        QualityProfileFormatScoreEntity::getScore, Integer::sum));
        if (scores.isEmpty()) {
            return 0;
        }
        int total = 0;
        for (CustomFormatEntity format : customFormatRepository.findAllById(scores.keySet())) {
            if (mediaKind != null && !format.getMediaType().appliesTo(mediaKind)) {
                continue;
            }
            if (matchesFormat(input, format.getSpecifications())) {
                total += scores.getOrDefault(format.getId(), 0);
            }
        }
        return total;
    }

    public List<String> getMatchingFormatNames(Release release, MediaKind mediaKind) {
        FormatInput input = FormatInput.of(release);
        return customFormatRepository.findAll().stream()
                .filter(format -> mediaKind == null || format.getMediaType().appliesTo(mediaKind))
                .filter(format -> matchesFormat(input, format.getSpecifications()))
                .map(CustomFormatEntity::getName)
                .toList();
    }

    public CustomFormatEntity save(CustomFormatEntity format) {
        validate(format);
        return customFormatRepository.save(format);
    }

    public QualityProfileFormatScoreEntity setScore(Long profileId, Long formatId, int score) {
        QualityProfileFormatScoreEntity entity = formatScoreRepository.findByQualityProfileIdAndCustomFormatId(profileId, formatId)
                .orElseGet(() -> QualityProfileFormatScoreEntity.builder()
                        .qualityProfileId(profileId)
                        .customFormatId(formatId)
                        .build());
        entity.setScore(score);
        return formatScoreRepository.save(entity);
    }

    void validate(CustomFormatEntity format) {
        if (format.getName() == null || format.getName().isBlank()) {
            throw ApiError.CUSTOM_FORMAT_INVALID.createException("name is required");
        }
        for (FormatSpecification specification : format.getSpecifications()) {
            if (specification.getKind() == null) {
                throw ApiError.CUSTOM_FORMAT_INVALID.createException("specification '" + specification.getName() + "' has no kind");
            }
            boolean regexKind = specification.getKind() == SpecificationKind.RELEASE_TITLE
                    || specification.getKind() == SpecificationKind.RELEASE_GROUP;
            if (regexKind && !SpecificationEvaluator.isValidRegex(String.valueOf(specification.getValue()))) {
                throw ApiError.CUSTOM_FORMAT_INVALID.createException("invalid regex in '" + specification.getName() + "'");
            }
        }
    }
}
