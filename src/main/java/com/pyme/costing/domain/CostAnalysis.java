package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Totals and price tiers for one archetype. Only the fields the archetype's formula
 * produces are set; the rest stay null and are left out of the JSON.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CostAnalysis {
    BusinessArchetype archetype;

    double totalCost;
    double profit;

    // Manufacturing
    Double minPrice;
    Double optimalPrice;
    Double premiumPrice;

    // Resale
    Double logisticsCost;
    Double sellingPrice;
    Double roi;

    // Service
    Double basePrice;
    Double experienceMultiplier;
    Double finalPrice;
    Double monthlyIncome;

    // Hybrid
    Double serviceComponent;
    Double totalPerClient;
    Double serviceMargin;   // %
    Double productMargin;   // %
    Double suggestedPrice;  // also Package
    Double totalProfit;     // also Package

    // Package
    Double totalComponentsCost;
    Double presentationCost;
    Double discountPct;
    Double avgItemPrice;
    Double totalSavings;
    Double profitMargin;    // %

    /**
     * The price the archetype's profit is measured against.
     */
    public double canonicalPrice() {
        return switch (archetype) {
            case MANUFACTURING -> optimalPrice;
            case RESALE -> sellingPrice;
            case SERVICE -> finalPrice;
            case HYBRID, PACKAGE -> suggestedPrice;
        };
    }
}
