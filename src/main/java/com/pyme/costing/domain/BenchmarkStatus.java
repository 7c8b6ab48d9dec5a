package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BenchmarkStatus {
    GOOD,
    AVERAGE,
    POOR;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }
}
