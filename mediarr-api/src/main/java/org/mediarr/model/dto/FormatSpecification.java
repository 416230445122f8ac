package org.mediarr.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.mediarr.model.enums.SpecificationKind;

/**
 * One matching rule of a custom format. {@code value} holds a regex or a numeric code depending
 * on the kind; {@code min}/{@code max} are only read by size rules and are expressed in GB.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class FormatSpecification {
    String name;
    SpecificationKind kind;
    boolean negate;
    boolean required;
    String value;
    Double min;
    Double max;
}
