package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FieldType {
    AMOUNT,
    PERCENT,
    HOURS,
    COUNT,
    CHOICE;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }
}
