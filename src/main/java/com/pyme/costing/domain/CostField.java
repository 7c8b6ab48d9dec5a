package com.pyme.costing.domain;

/**
 * Input field names shared by the schema, the formulas and the JSON contract.
 */
public final class CostField {

    // Manufacturing
    public static final String MATERIALS = "materials";
    public static final String LABOR = "labor";
    public static final String PACKAGING = "packaging";
    public static final String OVERHEAD = "overhead"; // monthly

    // Resale
    public static final String PURCHASE_COST = "purchaseCost";
    public static final String LOGISTICS_PCT = "logisticsPct";
    public static final String STORAGE = "storage"; // monthly
    public static final String DESIRED_MARGIN_PCT = "desiredMarginPct";

    // Service
    public static final String HOURLY_RATE = "hourlyRate";
    public static final String PROJECT_HOURS = "projectHours";
    public static final String OPERATIONAL_COST = "operationalCost"; // monthly
    public static final String EXPERIENCE_LEVEL = "experienceLevel";

    // Hybrid
    public static final String PROFESSIONAL_RATE = "professionalRate";
    public static final String CLIENT_HOURS = "clientHours";
    public static final String PRODUCTS_COST = "productsCost";
    public static final String ADDITIONAL_COST = "additionalCost";

    // Package
    public static final String COMPONENTS_COST = "componentsCost";
    public static final String ITEMS_COUNT = "itemsCount";
    public static final String PRESENTATION = "presentation";
    public static final String DISCOUNT_PCT = "discountPct";

    private CostField() {
    }
}
