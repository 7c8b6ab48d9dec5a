package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * How long the business has operated, as offered by the debt capacity form.
 */
public enum BusinessTenure {
    LESS_THAN_6_MONTHS("menos-6", 0.5, 3),
    SIX_TO_12_MONTHS("6-12", 0.7, 2),
    ONE_TO_2_YEARS("1-2", 0.85, 1),
    TWO_TO_5_YEARS("2-5", 1.0, 0),
    MORE_THAN_5_YEARS("mas-5", 1.15, 0);

    private final String code;
    private final double capacityMultiplier;
    private final int riskPoints;

    BusinessTenure(String code, double capacityMultiplier, int riskPoints) {
        this.code = code;
        this.capacityMultiplier = capacityMultiplier;
        this.riskPoints = riskPoints;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public double getCapacityMultiplier() {
        return capacityMultiplier;
    }

    public int getRiskPoints() {
        return riskPoints;
    }

    public static Optional<BusinessTenure> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(t -> t.code.equalsIgnoreCase(code.trim())).findFirst();
    }
}
