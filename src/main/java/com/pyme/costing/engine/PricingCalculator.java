package com.pyme.costing.engine;

import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.CostAnalysis;
import com.pyme.costing.domain.CostInput;
import com.pyme.costing.domain.ExperienceLevel;
import org.springframework.stereotype.Component;

import static com.pyme.costing.domain.CostField.*;

/**
 * Cost totals and price tiers per archetype. The multipliers are part of the
 * published pricing and must not change without a migration of stored analyses.
 */
@Component
public class PricingCalculator {

    static final double DAYS_PER_MONTH = 30.0;
    static final int PROJECTS_PER_MONTH = 4;

    // Manufacturing tiers: 20%, 50% and 100% over cost
    static final double MIN_MARKUP = 1.2;
    static final double OPTIMAL_MARKUP = 1.5;
    static final double PREMIUM_MARKUP = 2.0;

    // Hybrid component margins
    static final double SERVICE_MARGIN_PCT = 60;
    static final double PRODUCT_MARGIN_PCT = 25;
    static final double SERVICE_MARKUP = 1.6;
    static final double PRODUCT_MARKUP = 1.25;

    static final double PACKAGE_MARKUP = 1.3;

    public CostAnalysis computeAnalysis(BusinessArchetype archetype, CostInput costs) {
        return switch (archetype) {
            case MANUFACTURING -> manufacturing(costs);
            case RESALE -> resale(costs);
            case SERVICE -> service(costs);
            case HYBRID -> hybrid(costs);
            case PACKAGE -> bundle(costs);
        };
    }

    private CostAnalysis manufacturing(CostInput costs) {
        double totalCost = costs.amount(MATERIALS) + costs.amount(LABOR) + costs.amount(PACKAGING)
                + costs.amount(OVERHEAD) / DAYS_PER_MONTH;
        double optimalPrice = round(totalCost * OPTIMAL_MARKUP);

        return CostAnalysis.builder()
                .archetype(BusinessArchetype.MANUFACTURING)
                .totalCost(totalCost)
                .minPrice(round(totalCost * MIN_MARKUP))
                .optimalPrice(optimalPrice)
                .premiumPrice(round(totalCost * PREMIUM_MARKUP))
                .profit(optimalPrice - totalCost)
                .build();
    }

    private CostAnalysis resale(CostInput costs) {
        double purchase = costs.amount(PURCHASE_COST);
        double logisticsCost = purchase * costs.amount(LOGISTICS_PCT) / 100;
        double totalCost = purchase + logisticsCost + costs.amount(STORAGE) / DAYS_PER_MONTH;
        double sellingPrice = round(totalCost * (1 + costs.amount(DESIRED_MARGIN_PCT) / 100));
        double profit = sellingPrice - totalCost;

        return CostAnalysis.builder()
                .archetype(BusinessArchetype.RESALE)
                .logisticsCost(logisticsCost)
                .totalCost(totalCost)
                .sellingPrice(sellingPrice)
                .profit(profit)
                .roi(round(ratio(profit, totalCost) * 100))
                .build();
    }

    private CostAnalysis service(CostInput costs) {
        double basePrice = costs.amount(HOURLY_RATE) * costs.amount(PROJECT_HOURS);
        ExperienceLevel level = costs.getExperienceLevel() != null ? costs.getExperienceLevel() : ExperienceLevel.MID;
        double finalPrice = round(basePrice * level.getMultiplier());
        double operational = costs.amount(OPERATIONAL_COST);
        double totalCost = basePrice + operational / DAYS_PER_MONTH;

        return CostAnalysis.builder()
                .archetype(BusinessArchetype.SERVICE)
                .basePrice(basePrice)
                .experienceMultiplier(level.getMultiplier())
                .finalPrice(finalPrice)
                .monthlyIncome(round(finalPrice * PROJECTS_PER_MONTH - operational))
                .totalCost(totalCost)
                .profit(finalPrice - totalCost)
                .build();
    }

    private CostAnalysis hybrid(CostInput costs) {
        double serviceComponent = costs.amount(PROFESSIONAL_RATE) * costs.amount(CLIENT_HOURS);
        double products = costs.amount(PRODUCTS_COST);
        double additional = costs.amount(ADDITIONAL_COST);
        double totalPerClient = serviceComponent + products + additional;
        double suggestedPrice = round(serviceComponent * SERVICE_MARKUP + products * PRODUCT_MARKUP + additional);
        double totalProfit = suggestedPrice - totalPerClient;

        return CostAnalysis.builder()
                .archetype(BusinessArchetype.HYBRID)
                .serviceComponent(serviceComponent)
                .totalPerClient(totalPerClient)
                .serviceMargin(SERVICE_MARGIN_PCT)
                .productMargin(PRODUCT_MARGIN_PCT)
                .suggestedPrice(suggestedPrice)
                .totalProfit(totalProfit)
                .totalCost(totalPerClient)
                .profit(totalProfit)
                .build();
    }

    private CostAnalysis bundle(CostInput costs) {
        double components = costs.amount(COMPONENTS_COST);
        double presentation = costs.amount(PRESENTATION);
        double discountPct = costs.amount(DISCOUNT_PCT);
        double totalBaseCost = components + presentation;
        double suggestedPrice = round(totalBaseCost * (1 - discountPct / 100) * PACKAGE_MARKUP);
        double totalProfit = suggestedPrice - totalBaseCost;

        return CostAnalysis.builder()
                .archetype(BusinessArchetype.PACKAGE)
                .totalComponentsCost(components)
                .presentationCost(presentation)
                .discountPct(discountPct)
                .avgItemPrice(ratio(components, costs.amount(ITEMS_COUNT)))
                .suggestedPrice(suggestedPrice)
                .totalSavings(round(totalBaseCost - suggestedPrice))
                .totalProfit(totalProfit)
                .profitMargin(round(ratio(totalProfit, suggestedPrice) * 100))
                .totalCost(totalBaseCost)
                .profit(totalProfit)
                .build();
    }

    /**
     * Half-up rounding to whole pesos. Stays in double range; {@link Math#round} saturates at Long.MAX_VALUE.
     */
    static double round(double value) {
        return Math.floor(value + 0.5);
    }

    /**
     * {@code numerator / denominator}, or 0 when the denominator is 0.
     */
    static double ratio(double numerator, double denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }
}
