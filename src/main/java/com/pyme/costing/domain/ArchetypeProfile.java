package com.pyme.costing.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.pyme.costing.domain.CostField.*;

/**
 * Business parameters of one archetype: its form fields, completeness weights,
 * coherence penalties and benchmark bands.
 * <p>
 * The thresholds come from field experience with small Colombian businesses (amounts in
 * COP) and are tunable, not derived. Profiles are built once and never change.
 */
@Value
@Builder(toBuilder = true)
public class ArchetypeProfile {

    // Benchmark keys
    public static final String MATERIALS_RATIO = "materialsRatio";
    public static final String LABOR_RATIO = "laborRatio";
    public static final String PURCHASE_RATIO = "purchaseRatio";
    public static final String RESALE_MARGIN = "resaleMargin";
    public static final String LOGISTICS = "logistics";
    public static final String HOURLY_RATE_LEVEL = "hourlyRate";
    public static final String PROJECT_VALUE = "projectValue";
    public static final String PROJECT_EFFICIENCY = "projectEfficiency";
    public static final String SERVICE_BALANCE = "serviceBalance";
    public static final String TOTAL_VALUE = "totalValue";

    // Form value ceilings; products of two fields stay finite
    static final double MAX_AMOUNT = 1e12;
    static final double MAX_UNITS = 10_000;

    BusinessArchetype archetype;

    @Singular
    List<FieldSpec> fields;

    /** Field name to weight; weights sum to 1.0. */
    @Singular
    Map<String, Double> completenessWeights;

    @Singular
    List<CoherenceRule> coherenceRules;

    @Singular
    Map<String, BenchmarkRange> benchmarkRanges;

    /** Share of monthly income that can safely go to debt payments. */
    double safeDebtRatio;

    private static final Map<BusinessArchetype, ArchetypeProfile> PROFILES = buildAll();

    public static ArchetypeProfile of(BusinessArchetype archetype) {
        return PROFILES.get(archetype);
    }

    public BenchmarkRange benchmarkRange(String key) {
        return benchmarkRanges.get(key);
    }

    private static Map<BusinessArchetype, ArchetypeProfile> buildAll() {
        Map<BusinessArchetype, ArchetypeProfile> profiles = new EnumMap<>(BusinessArchetype.class);
        Arrays.stream(BusinessArchetype.values()).forEach(a -> profiles.put(a, create(a)));
        return Collections.unmodifiableMap(profiles);
    }

    private static ArchetypeProfile create(BusinessArchetype archetype) {
        return switch (archetype) {
            case MANUFACTURING -> forManufacturing();
            case RESALE -> forResale();
            case SERVICE -> forService();
            case HYBRID -> forHybrid();
            case PACKAGE -> forPackage();
        };
    }

    /**
     * MANUFACTURING: materials should dominate without crowding out labor; overhead is a
     * monthly figure spread over 30 days of production.
     */
    public static ArchetypeProfile forManufacturing() {
        return ArchetypeProfile.builder()
                .archetype(BusinessArchetype.MANUFACTURING)
                .field(amount(MATERIALS, "Materias primas", "COP", true))
                .field(amount(LABOR, "Mano de obra", "COP", true))
                .field(amount(PACKAGING, "Empaque", "COP", false))
                .field(amount(OVERHEAD, "Gastos indirectos", "COP/mes", false))
                .completenessWeight(MATERIALS, 0.4)
                .completenessWeight(LABOR, 0.3)
                .completenessWeight(PACKAGING, 0.2)
                .completenessWeight(OVERHEAD, 0.1)
                .coherenceRule(proportionBand("Materias primas fuera de 30-70%", MATERIALS, 0.3, 0.7, 0.2))
                .coherenceRule(proportionBand("Mano de obra fuera de 10-50%", LABOR, 0.1, 0.5, 0.15))
                .coherenceRule(proportionBand("Empaque sobre 20%", PACKAGING, null, 0.2, 0.1))
                .coherenceRule(CoherenceRule.builder()
                        .description("Sin gastos indirectos")
                        .basis(CoherenceRule.Basis.AMOUNT)
                        .key(OVERHEAD)
                        .zeroTriggers(true)
                        .penalty(0.2)
                        .build())
                .benchmarkRange(MATERIALS_RATIO, BenchmarkRange.builder()
                        .goodMin(40).goodMax(60).poorBelow(30).poorAbove(70).label("40-60%").build())
                .benchmarkRange(LABOR_RATIO, BenchmarkRange.builder()
                        .goodMin(15).goodMax(35).poorBelow(10).poorAbove(45).label("15-35%").build())
                .safeDebtRatio(0.35)
                .build();
    }

    /**
     * RESALE: purchase cost is most of the total; logistics is a percentage of purchase
     * and storage a monthly figure. Missing margin defaults to 30%.
     */
    public static ArchetypeProfile forResale() {
        return ArchetypeProfile.builder()
                .archetype(BusinessArchetype.RESALE)
                .field(amount(PURCHASE_COST, "Costo de compra", "COP", true))
                .field(FieldSpec.builder()
                        .name(LOGISTICS_PCT).label("Logística").type(FieldType.PERCENT).unit("%")
                        .min(0).max(100.0)
                        .rangeMessage("Logística debe estar entre 0% y 100%")
                        .build())
                .field(amount(STORAGE, "Almacenamiento", "COP/mes", false))
                .field(FieldSpec.builder()
                        .name(DESIRED_MARGIN_PCT).label("Margen").type(FieldType.PERCENT).unit("%")
                        .required(true).min(0).max(200.0).defaultValue(30.0)
                        .rangeMessage("Margen debe estar entre 1% y 200%")
                        .build())
                .completenessWeight(PURCHASE_COST, 0.6)
                .completenessWeight(LOGISTICS_PCT, 0.2)
                .completenessWeight(STORAGE, 0.1)
                .completenessWeight(DESIRED_MARGIN_PCT, 0.1)
                .coherenceRule(proportionBand("Compra fuera de 40-80%", "purchase", 0.4, 0.8, 0.2))
                .coherenceRule(amountBand("Logística fuera de 2-15%", LOGISTICS_PCT, 2.0, 15.0, 0.15))
                .coherenceRule(amountBand("Margen fuera de 10-100%", DESIRED_MARGIN_PCT, 10.0, 100.0, 0.2))
                .benchmarkRange(PURCHASE_RATIO, BenchmarkRange.builder()
                        .goodMin(50).goodMax(70).poorAbove(80).label("50-70%").build())
                .benchmarkRange(RESALE_MARGIN, BenchmarkRange.builder()
                        .goodMin(20).poorBelow(10).label("25-50%").build())
                .benchmarkRange(LOGISTICS, BenchmarkRange.builder()
                        .goodMax(8).poorAbove(15).label("≤10%").build())
                .safeDebtRatio(0.40)
                .build();
    }

    /**
     * SERVICE: hourly value should carry the price. Rates are judged against Colombian
     * market levels; 4 billable projects per month are assumed downstream.
     */
    public static ArchetypeProfile forService() {
        return ArchetypeProfile.builder()
                .archetype(BusinessArchetype.SERVICE)
                .field(amount(HOURLY_RATE, "Valor por hora", "COP/h", true))
                .field(FieldSpec.builder()
                        .name(PROJECT_HOURS).label("Horas por proyecto").type(FieldType.HOURS).unit("h")
                        .required(true).min(0).max(MAX_UNITS)
                        .build())
                .field(amount(OPERATIONAL_COST, "Gastos operativos", "COP/mes", false))
                .field(FieldSpec.builder()
                        .name(EXPERIENCE_LEVEL).label("Nivel de experiencia").type(FieldType.CHOICE)
                        .option("junior").option("mid").option("senior").option("expert")
                        .defaultOption("mid")
                        .build())
                .completenessWeight(HOURLY_RATE, 0.4)
                .completenessWeight(PROJECT_HOURS, 0.3)
                .completenessWeight(OPERATIONAL_COST, 0.2)
                .completenessWeight(EXPERIENCE_LEVEL, 0.1)
                .coherenceRule(proportionBand("Valor hora bajo 40%", "hourlyValue", 0.4, null, 0.3))
                .coherenceRule(amountBand("Tarifa fuera de 10.000-200.000", HOURLY_RATE, 10000.0, 200000.0, 0.2))
                .coherenceRule(amountBand("Horas fuera de 1-200", PROJECT_HOURS, 1.0, 200.0, 0.15))
                .benchmarkRange(HOURLY_RATE_LEVEL, BenchmarkRange.builder()
                        .goodMin(50000).poorBelow(25000).label("$50.000+").build())
                .benchmarkRange(PROJECT_VALUE, BenchmarkRange.builder()
                        .goodMin(500000).poorBelow(150000).label("$500.000+").build())
                .benchmarkRange(PROJECT_EFFICIENCY, BenchmarkRange.builder()
                        .goodMax(40).poorAbove(100).label("≤40h").build())
                .safeDebtRatio(0.30)
                .build();
    }

    /**
     * HYBRID: professional time plus bundled products; neither side should vanish.
     */
    public static ArchetypeProfile forHybrid() {
        return ArchetypeProfile.builder()
                .archetype(BusinessArchetype.HYBRID)
                .field(amount(PROFESSIONAL_RATE, "Valor hora profesional", "COP/h", true))
                .field(FieldSpec.builder()
                        .name(CLIENT_HOURS).label("Horas por cliente").type(FieldType.HOURS).unit("h")
                        .required(true).min(0).max(MAX_UNITS)
                        .build())
                .field(amount(PRODUCTS_COST, "Costo de productos", "COP", true))
                .field(amount(ADDITIONAL_COST, "Gastos adicionales", "COP", false))
                .completenessWeight(PROFESSIONAL_RATE, 0.3)
                .completenessWeight(CLIENT_HOURS, 0.2)
                .completenessWeight(PRODUCTS_COST, 0.3)
                .completenessWeight(ADDITIONAL_COST, 0.2)
                .coherenceRule(proportionBand("Servicio fuera de 20-80%", "service", 0.2, 0.8, 0.2))
                .coherenceRule(proportionBand("Productos fuera de 10-70%", "products", 0.1, 0.7, 0.2))
                .coherenceRule(CoherenceRule.builder()
                        .description("Falta servicio o productos")
                        .basis(CoherenceRule.Basis.PROPORTION)
                        .key("service")
                        .key("products")
                        .zeroTriggers(true)
                        .penalty(0.3)
                        .build())
                .benchmarkRange(SERVICE_BALANCE, BenchmarkRange.builder()
                        .goodMin(25).goodMax(75).label("30-70%").build())
                .benchmarkRange(TOTAL_VALUE, BenchmarkRange.builder()
                        .goodMin(600000).poorBelow(300000).label("$600.000+").build())
                .safeDebtRatio(0.32)
                .build();
    }

    /**
     * PACKAGE: bundles of existing products sold with a discount; no coherence bands yet.
     */
    public static ArchetypeProfile forPackage() {
        return ArchetypeProfile.builder()
                .archetype(BusinessArchetype.PACKAGE)
                .field(amount(COMPONENTS_COST, "Costo de componentes", "COP", true))
                .field(FieldSpec.builder()
                        .name(ITEMS_COUNT).label("Número de items").type(FieldType.COUNT).unit("items")
                        .required(true).min(0).max(MAX_UNITS)
                        .build())
                .field(amount(PRESENTATION, "Empaque y presentación", "COP", false))
                .field(FieldSpec.builder()
                        .name(DISCOUNT_PCT).label("Descuento del paquete").type(FieldType.PERCENT).unit("%")
                        .min(0).max(100.0)
                        .rangeMessage("Descuento del paquete debe estar entre 0% y 100%")
                        .build())
                .completenessWeight(COMPONENTS_COST, 0.4)
                .completenessWeight(ITEMS_COUNT, 0.3)
                .completenessWeight(PRESENTATION, 0.2)
                .completenessWeight(DISCOUNT_PCT, 0.1)
                .safeDebtRatio(0.30)
                .build();
    }

    private static FieldSpec amount(String name, String label, String unit, boolean required) {
        return FieldSpec.builder()
                .name(name)
                .label(label)
                .type(FieldType.AMOUNT)
                .unit(unit)
                .required(required)
                .min(0)
                .max(MAX_AMOUNT)
                .build();
    }

    private static CoherenceRule proportionBand(String description, String component,
                                                Double below, Double above, double penalty) {
        return CoherenceRule.builder()
                .description(description)
                .basis(CoherenceRule.Basis.PROPORTION)
                .key(component)
                .below(below)
                .above(above)
                .penalty(penalty)
                .build();
    }

    private static CoherenceRule amountBand(String description, String field,
                                            Double below, Double above, double penalty) {
        return CoherenceRule.builder()
                .description(description)
                .basis(CoherenceRule.Basis.AMOUNT)
                .key(field)
                .below(below)
                .above(above)
                .penalty(penalty)
                .build();
    }
}
