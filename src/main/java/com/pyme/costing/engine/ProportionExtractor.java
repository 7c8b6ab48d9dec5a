package com.pyme.costing.engine;

import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.CostInput;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.pyme.costing.domain.CostField.*;

/**
 * Splits an archetype's costs into components and expresses each as a fraction of
 * their sum. Shared by scoring, alerts, benchmarks and recommendations so they all
 * read the same numbers.
 */
@Component
public class ProportionExtractor {

    public static final String MATERIALS_SHARE = "materials";
    public static final String LABOR_SHARE = "labor";
    public static final String PACKAGING_SHARE = "packaging";
    public static final String OVERHEAD_SHARE = "overhead";
    public static final String PURCHASE_SHARE = "purchase";
    public static final String LOGISTICS_SHARE = "logistics";
    public static final String STORAGE_SHARE = "storage";
    public static final String HOURLY_VALUE_SHARE = "hourlyValue";
    public static final String OPERATIONAL_SHARE = "operational";
    public static final String SERVICE_SHARE = "service";
    public static final String PRODUCTS_SHARE = "products";
    public static final String ADDITIONAL_SHARE = "additional";
    public static final String COMPONENTS_SHARE = "components";
    public static final String PRESENTATION_SHARE = "presentation";

    /**
     * Absolute value of each component, in display order.
     */
    public Map<String, Double> components(BusinessArchetype archetype, CostInput costs) {
        return switch (archetype) {
            case MANUFACTURING -> ordered(
                    MATERIALS_SHARE, costs.amount(MATERIALS),
                    LABOR_SHARE, costs.amount(LABOR),
                    PACKAGING_SHARE, costs.amount(PACKAGING),
                    OVERHEAD_SHARE, costs.amount(OVERHEAD));
            case RESALE -> ordered(
                    PURCHASE_SHARE, costs.amount(PURCHASE_COST),
                    LOGISTICS_SHARE, costs.amount(PURCHASE_COST) * costs.amount(LOGISTICS_PCT) / 100,
                    STORAGE_SHARE, costs.amount(STORAGE));
            case SERVICE -> ordered(
                    HOURLY_VALUE_SHARE, costs.amount(HOURLY_RATE) * costs.amount(PROJECT_HOURS),
                    OPERATIONAL_SHARE, costs.amount(OPERATIONAL_COST) / PricingCalculator.DAYS_PER_MONTH);
            case HYBRID -> ordered(
                    SERVICE_SHARE, costs.amount(PROFESSIONAL_RATE) * costs.amount(CLIENT_HOURS),
                    PRODUCTS_SHARE, costs.amount(PRODUCTS_COST),
                    ADDITIONAL_SHARE, costs.amount(ADDITIONAL_COST));
            case PACKAGE -> ordered(
                    COMPONENTS_SHARE, costs.amount(COMPONENTS_COST),
                    PRESENTATION_SHARE, costs.amount(PRESENTATION));
        };
    }

    /**
     * Fractions of the component total. All 0 when the total is 0.
     */
    public Map<String, Double> proportions(BusinessArchetype archetype, CostInput costs) {
        Map<String, Double> parts = components(archetype, costs);
        double total = parts.values().stream().mapToDouble(Double::doubleValue).sum();

        Map<String, Double> shares = new LinkedHashMap<>();
        parts.forEach((name, value) -> shares.put(name, PricingCalculator.ratio(value, total)));
        return Collections.unmodifiableMap(shares);
    }

    private static Map<String, Double> ordered(Object... namesAndValues) {
        Map<String, Double> parts = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            parts.put((String) namesAndValues[i], (Double) namesAndValues[i + 1]);
        }
        return parts;
    }
}
