package com.pyme.costing.engine;

import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.CostInput;
import com.pyme.costing.domain.ExperienceLevel;

/**
 * Reference inputs shared by the engine tests.
 */
final class SampleCosts {

    private SampleCosts() {
    }

    static CostInput of(BusinessArchetype archetype) {
        CostInput.CostInputBuilder builder = CostInput.builder().archetype(archetype);
        return switch (archetype) {
            case MANUFACTURING -> builder
                    .amount("materials", 3000.0)
                    .amount("labor", 2000.0)
                    .amount("packaging", 300.0)
                    .amount("overhead", 9000.0)
                    .build();
            case RESALE -> builder
                    .amount("purchaseCost", 10000.0)
                    .amount("logisticsPct", 5.0)
                    .amount("storage", 3000.0)
                    .amount("desiredMarginPct", 30.0)
                    .build();
            case SERVICE -> builder
                    .amount("hourlyRate", 50000.0)
                    .amount("projectHours", 20.0)
                    .amount("operationalCost", 200000.0)
                    .experienceLevel(ExperienceLevel.SENIOR)
                    .build();
            case HYBRID -> builder
                    .amount("professionalRate", 60000.0)
                    .amount("clientHours", 2.0)
                    .amount("productsCost", 40000.0)
                    .amount("additionalCost", 10000.0)
                    .build();
            case PACKAGE -> builder
                    .amount("componentsCost", 80000.0)
                    .amount("itemsCount", 5.0)
                    .amount("presentation", 15000.0)
                    .amount("discountPct", 10.0)
                    .build();
        };
    }

    static CostInput manufacturing(double materials, double labor, double packaging, double overhead) {
        return CostInput.builder()
                .archetype(BusinessArchetype.MANUFACTURING)
                .amount("materials", materials)
                .amount("labor", labor)
                .amount("packaging", packaging)
                .amount("overhead", overhead)
                .build();
    }
}
