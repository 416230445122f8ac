package org.mediarr.service.customformat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.FormatSpecification;
import org.mediarr.model.entity.CustomFormatEntity;
import org.mediarr.model.enums.FormatMediaType;
import org.mediarr.model.enums.SpecificationKind;
import org.mediarr.repository.CustomFormatRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Imports custom formats exported in the TRaSH guides JSON layout.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomFormatImportService {

    private final ObjectMapper objectMapper;
    private final CustomFormatRepository customFormatRepository;
    private final CustomFormatService customFormatService;

    public CustomFormatEntity importFormat(String json, FormatMediaType mediaType, Long profileId) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw ApiError.CUSTOM_FORMAT_INVALID.createException(e.getMessage());
        }
        String name = root.path("name").asText(null);
        String trashId = root.path("trash_id").asText(null);

        List<FormatSpecification> specifications = new ArrayList<>();
        for (JsonNode spec : root.path("specifications")) {
            Optional<SpecificationKind> kind = SpecificationKind.fromImplementation(spec.path("implementation").asText());
            if (kind.isEmpty()) {
                log.warn("Skipping unsupported specification '{}' ({}) in format '{}'",
                        spec.path("name").asText(), spec.path("implementation").asText(), name);
                continue;
            }
            specifications.add(FormatSpecification.builder()
                    .name(spec.path("name").asText())
                    .kind(kind.get())
                    .negate(spec.path("negate").asBoolean(false))
                    .required(spec.path("required").asBoolean(false))
                    .value(field(spec.path("fields"), "value"))
                    .min(number(field(spec.path("fields"), "min")))
                    .max(number(field(spec.path("fields"), "max")))
                    .build());
        }

        CustomFormatEntity format = Optional.ofNullable(trashId)
                .flatMap(customFormatRepository::findByExternalId)
                .or(() -> Optional.ofNullable(name).flatMap(customFormatRepository::findByNameIgnoreCase))
                .orElseGet(CustomFormatEntity::new);
        format.setName(name);
        format.setExternalId(trashId);
        format.setMediaType(mediaType != null ? mediaType : FormatMediaType.BOTH);
        format.setSpecifications(specifications);
        CustomFormatEntity saved = customFormatService.save(format);

        JsonNode defaultScore = root.path("trash_scores").path("default");
        if (profileId != null && defaultScore.isNumber()) {
            customFormatService.setScore(profileId, saved.getId(), defaultScore.asInt());
        }
        log.info("Imported custom format '{}' with {} specifications", saved.getName(), specifications.size());
        return saved;
    }

    /**
     * Fields come either as an object ({@code {"value": ...}}) or as a list of name/value pairs.
     */
    private static String field(JsonNode fields, String name) {
        if (fields.isObject()) {
            JsonNode value = fields.get(name);
            return value != null && !value.isNull() ? value.asText() : null;
        }
        for (JsonNode entry : fields) {
            if (name.equals(entry.path("name").asText())) {
                JsonNode value = entry.get("value");
                return value != null && !value.isNull() ? value.asText() : null;
            }
        }
        return null;
    }

    private static Double number(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
