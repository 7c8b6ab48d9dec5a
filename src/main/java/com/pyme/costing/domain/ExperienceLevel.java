package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ExperienceLevel {
    JUNIOR("junior", 1.0),
    MID("mid", 1.3),
    SENIOR("senior", 1.7),
    EXPERT("expert", 2.2);

    private final String code;
    private final double multiplier;

    ExperienceLevel(String code, double multiplier) {
        this.code = code;
        this.multiplier = multiplier;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public static boolean isKnown(String code) {
        return code != null && Arrays.stream(values()).anyMatch(l -> l.code.equalsIgnoreCase(code.trim()));
    }

    /**
     * Unknown or missing levels price as {@link #MID}.
     */
    public static ExperienceLevel fromCode(String code) {
        if (code == null) {
            return MID;
        }
        return Arrays.stream(values())
                .filter(l -> l.code.equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElse(MID);
    }
}
