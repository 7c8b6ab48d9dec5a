package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScoreBand {
    EXCELLENT("excellent"),
    ACCEPTABLE("acceptable"),
    LOW("low");

    private final String code;

    ScoreBand(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ScoreBand of(double score) {
        if (score >= 0.8) {
            return EXCELLENT;
        }
        if (score >= 0.6) {
            return ACCEPTABLE;
        }
        return LOW;
    }
}
