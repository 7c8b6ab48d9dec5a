package com.pyme.costing.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Normalised cost inputs for one analysis. Every amount is a non-negative number once
 * validation has passed; fields the caller left out read as 0.
 */
@Value
@Builder(toBuilder = true)
public class CostInput {
    BusinessArchetype archetype;

    @Singular
    Map<String, Double> amounts;

    ExperienceLevel experienceLevel; // SERVICE only

    public double amount(String field) {
        Double value = amounts.get(field);
        return value != null ? value : 0.0;
    }

    public boolean isPresent(String field) {
        if (CostField.EXPERIENCE_LEVEL.equals(field)) {
            return experienceLevel != null;
        }
        return amount(field) > 0;
    }
}
