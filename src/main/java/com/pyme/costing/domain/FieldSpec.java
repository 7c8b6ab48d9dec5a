package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One input of an archetype's cost form, with its constraints and display metadata.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldSpec {
    String name;
    String label;      // user-facing name, used in validation messages
    FieldType type;
    String unit;       // "COP", "COP/mes", "%", "h", "items"

    boolean required;  // required numeric fields must be > 0
    double min;
    Double max;        // null = unbounded
    Double defaultValue;
    String defaultOption;

    @Singular
    List<String> options; // CHOICE fields only

    String rangeMessage;  // overrides the generic "debe estar entre" message

    @JsonIgnore
    public boolean isChoice() {
        return type == FieldType.CHOICE;
    }
}
