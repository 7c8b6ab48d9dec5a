package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    LOW("BAJO"),
    MEDIUM("MEDIO"),
    HIGH("ALTO");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
