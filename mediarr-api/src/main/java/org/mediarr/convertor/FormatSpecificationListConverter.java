package org.mediarr.convertor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.model.dto.FormatSpecification;

import java.util.ArrayList;
import java.util.List;

@Converter
@Slf4j
public class FormatSpecificationListConverter implements AttributeConverter<List<FormatSpecification>, String> {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<List<FormatSpecification>> LIST_TYPE_REF = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<FormatSpecification> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            log.error("Error converting format specifications to JSON", e);
            return "[]";
        }
    }

    @Override
    public List<FormatSpecification> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(dbData, LIST_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.error("Error converting JSON to format specifications", e);
            return new ArrayList<>();
        }
    }
}
