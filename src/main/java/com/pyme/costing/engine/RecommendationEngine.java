package com.pyme.costing.engine;

import com.pyme.costing.domain.BenchmarkInsight;
import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.CostField;
import com.pyme.costing.domain.CostInput;
import com.pyme.costing.domain.OptimizationOpportunity;
import com.pyme.costing.domain.PriorityRecommendation;
import com.pyme.costing.domain.RecommendationSet;
import com.pyme.costing.domain.StrategicInitiative;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.pyme.costing.engine.ProportionExtractor.*;

/**
 * Priority, optimization, benchmark and strategic advice per archetype.
 * <p>
 * Percentages are shares of the archetype's cost components (see
 * {@link ProportionExtractor}); savings estimates are fractions of {@code totalCost}.
 * Business types without a dedicated generator get {@link #generic(double)}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecommendationEngine {

    /** Working hours in a month, the base for a service project's time share. */
    static final double MONTHLY_HOURS = 160;

    private final ProportionExtractor proportionExtractor;

    public RecommendationSet generateRecommendations(BusinessArchetype archetype, CostInput costs, double totalCost) {
        if (archetype == null) {
            return generic(totalCost);
        }
        Map<String, Double> shares = proportionExtractor.proportions(archetype, costs);
        RecommendationSet set = switch (archetype) {
            case MANUFACTURING -> manufacturing(shares, totalCost);
            case RESALE -> resale(shares, totalCost);
            case SERVICE -> service(shares, costs, totalCost);
            case HYBRID -> hybrid(shares, totalCost);
            case PACKAGE -> generic(totalCost);
        };
        log.debug("{} recommendations: {} priority, {} optimization", archetype,
                set.getPriority().size(), set.getOptimization().size());
        return set;
    }

    private RecommendationSet manufacturing(Map<String, Double> shares, double totalCost) {
        double materialsPct = pct(shares, MATERIALS_SHARE);
        double laborPct = pct(shares, LABOR_SHARE);
        double packagingPct = pct(shares, PACKAGING_SHARE);

        return RecommendationSet.builder()
                .addPriority(PriorityRecommendation.builder()
                        .title("Optimizar costo de materia prima")
                        .impact(materialsPct > 70 ? "Alto" : materialsPct > 50 ? "Medio" : "Bajo")
                        .roi(materialsPct > 70 ? "25-40%" : "15-25%")
                        .currentValue(Formats.oneDecimal(materialsPct))
                        .targetValue("45-55%")
                        .step("Negociar con 3-5 proveedores diferentes")
                        .step("Evaluar compras por volumen (descuentos 10-15%)")
                        .step("Buscar materiales alternativos de calidad similar")
                        .step("Implementar sistema de inventario justo a tiempo")
                        .build())
                .addPriority(PriorityRecommendation.builder()
                        .title("Automatizar procesos de producción")
                        .impact(laborPct > 40 ? "Alto" : "Medio")
                        .roi("30-50%")
                        .currentValue(Formats.oneDecimal(laborPct))
                        .targetValue("25-35%")
                        .step("Identificar tareas repetitivas para automatizar")
                        .step("Invertir en maquinaria semi-automática")
                        .step("Capacitar personal en nuevas tecnologías")
                        .step("Medir productividad por operario")
                        .build())
                .addOptimization(opportunity("Materiales",
                        "Reducir desperdicio en " + Formats.oneDecimal(Math.max(materialsPct - 50, 5)) + "%",
                        savings(totalCost, Math.max(materialsPct - 50, 5)), "2-3 meses"))
                .addOptimization(opportunity("Producción", "Aumentar eficiencia por lote",
                        savings(totalCost, 15), "1-2 meses"))
                .addOptimization(opportunity("Empaque",
                        packagingPct > 10 ? "Optimizar packaging" : "Packaging eficiente",
                        savings(totalCost, Math.max(packagingPct - 8, 3)), "1 mes"))
                .addBenchmark(insight("Materia Prima", materialsPct, "45-55%",
                        materialsPct > 55 ? "Por encima" : materialsPct < 45 ? "Por debajo" : "En rango",
                        materialsPct > 55 ? "Reducir" : materialsPct < 45 ? "Revisar calidad" : "Mantener"))
                .addBenchmark(insight("Mano de Obra", laborPct, "25-35%",
                        laborPct > 35 ? "Por encima" : laborPct < 25 ? "Por debajo" : "En rango",
                        laborPct > 35 ? "Automatizar" : "Optimizar"))
                .addBenchmark(insight("Otros gastos", packagingPct, "5-15%",
                        packagingPct > 15 ? "Por encima" : "En rango",
                        packagingPct > 15 ? "Optimizar" : "Mantener"))
                .addStrategic(initiative("Escalar producción", "Aumentar volumen para reducir costos unitarios",
                        "Reducción 20-30% costo unitario", "Media-Alta", "6-12 meses"))
                .addStrategic(initiative("Integración vertical", "Control directo de la cadena de suministro",
                        "Reducción 15-25% costos materiales", "Alta", "12-18 meses"))
                .addStrategic(initiative("Diversificación de productos", "Aprovechar capacidad instalada",
                        "Aumento 25-40% ingresos", "Media", "3-6 meses"))
                .build();
    }

    private RecommendationSet resale(Map<String, Double> shares, double totalCost) {
        double purchasePct = pct(shares, PURCHASE_SHARE);
        double logisticsPct = pct(shares, LOGISTICS_SHARE);
        double storagePct = pct(shares, STORAGE_SHARE);

        return RecommendationSet.builder()
                .addPriority(PriorityRecommendation.builder()
                        .title("Negociar mejores precios de compra")
                        .impact(purchasePct > 75 ? "Alto" : "Medio")
                        .roi("20-35%")
                        .currentValue(Formats.oneDecimal(purchasePct))
                        .targetValue("60-70%")
                        .step("Consolidar compras con menos proveedores")
                        .step("Negociar descuentos por volumen anual")
                        .step("Buscar proveedores directos (eliminar intermediarios)")
                        .step("Evaluar importación directa para productos clave")
                        .build())
                .addPriority(PriorityRecommendation.builder()
                        .title("Optimizar rotación de inventario")
                        .impact(storagePct > 15 ? "Alto" : "Medio")
                        .roi("15-30%")
                        .currentValue(Formats.oneDecimal(storagePct))
                        .targetValue("8-12%")
                        .step("Implementar sistema ABC de inventarios")
                        .step("Establecer puntos de reorden automático")
                        .step("Liquidar productos de baja rotación")
                        .step("Negociar consignación con proveedores")
                        .build())
                .addOptimization(opportunity("Compras",
                        "Reducir costo compra en " + Formats.oneDecimal(Math.max(purchasePct - 65, 5)) + "%",
                        savings(totalCost, Math.max(purchasePct - 65, 5)), "1-2 meses"))
                .addOptimization(opportunity("Logística", "Consolidar envíos y rutas",
                        savings(totalCost, 5), "1 mes"))
                .addOptimization(opportunity("Almacenamiento",
                        storagePct > 12 ? "Reducir espacio físico" : "Optimizar espacio",
                        savings(totalCost, Math.max(storagePct - 10, 2)), "2-3 meses"))
                .addBenchmark(insight("Costo de Compra", purchasePct, "60-70%",
                        purchasePct > 70 ? "Por encima" : purchasePct < 60 ? "Excelente" : "En rango",
                        purchasePct > 70 ? "Negociar" : "Mantener"))
                .addBenchmark(insight("Logística", logisticsPct, "5-15%",
                        logisticsPct > 15 ? "Por encima" : "En rango",
                        logisticsPct > 15 ? "Optimizar rutas" : "Mantener"))
                .addBenchmark(insight("Almacenamiento", storagePct, "8-12%",
                        storagePct > 12 ? "Por encima" : "En rango",
                        storagePct > 12 ? "Reducir inventario" : "Optimizar"))
                .addStrategic(initiative("Marca propia (Private Label)", "Desarrollar productos con mayor margen",
                        "Aumento 40-60% margen bruto", "Media", "6-9 meses"))
                .addStrategic(initiative("E-commerce y omnicanalidad", "Expandir canales de venta digitales",
                        "Aumento 30-50% ventas", "Media", "3-6 meses"))
                .addStrategic(initiative("Distribución mayorista", "Vender a otros retailers",
                        "Aumento 25-40% volumen", "Baja-Media", "2-4 meses"))
                .build();
    }

    private RecommendationSet service(Map<String, Double> shares, CostInput costs, double totalCost) {
        double hourlyValuePct = pct(shares, HOURLY_VALUE_SHARE);
        double expensesPct = pct(shares, OPERATIONAL_SHARE);
        double timePct = PricingCalculator.ratio(costs.amount(CostField.PROJECT_HOURS), MONTHLY_HOURS) * 100;

        return RecommendationSet.builder()
                .addPriority(PriorityRecommendation.builder()
                        .title("Aumentar tarifa por hora")
                        .impact(hourlyValuePct < 60 ? "Alto" : "Medio")
                        .roi("Inmediato 25-50%")
                        .currentValue(Formats.oneDecimal(hourlyValuePct))
                        .targetValue("65-75%")
                        .step("Investigar tarifas de competencia en el mercado")
                        .step("Documentar valor agregado y especialización")
                        .step("Implementar aumentos graduales (15-20% cada 6 meses)")
                        .step("Ofrecer paquetes de valor con servicios premium")
                        .build())
                .addPriority(PriorityRecommendation.builder()
                        .title("Automatizar procesos repetitivos")
                        .impact(timePct > 40 ? "Alto" : "Medio")
                        .roi("30-45%")
                        .currentValue(Formats.oneDecimal(timePct))
                        .targetValue("25-35%")
                        .step("Identificar tareas que consumen más tiempo")
                        .step("Implementar templates y metodologías estándar")
                        .step("Usar herramientas de automatización")
                        .step("Delegar tareas operativas a junior staff")
                        .build())
                .addOptimization(opportunity("Productividad", "Reducir tiempo por proyecto",
                        savings(totalCost, 25), "1-2 meses"))
                .addOptimization(opportunity("Tarifas",
                        hourlyValuePct < 65 ? "Aumentar valor hora" : "Optimizar paquetes",
                        savings(totalCost, Math.max(65 - hourlyValuePct, 10)), "Inmediato"))
                .addOptimization(opportunity("Gastos",
                        expensesPct > 20 ? "Reducir gastos operativos" : "Optimizar gastos",
                        savings(totalCost, Math.max(expensesPct - 15, 5)), "1 mes"))
                .addBenchmark(insight("Valor por Hora", hourlyValuePct, "65-75%",
                        hourlyValuePct > 65 ? "En rango" : "Por debajo",
                        hourlyValuePct < 65 ? "Aumentar tarifas" : "Mantener"))
                .addBenchmark(insight("Eficiencia Tiempo", timePct, "25-35%",
                        timePct > 35 ? "Ineficiente" : "Eficiente",
                        timePct > 35 ? "Automatizar" : "Optimizar"))
                .addBenchmark(insight("Gastos Operativos", expensesPct, "10-20%",
                        expensesPct > 20 ? "Por encima" : "En rango",
                        expensesPct > 20 ? "Reducir" : "Controlar"))
                .addStrategic(initiative("Servicios recurrentes", "Crear contratos mensuales/anuales",
                        "Ingresos predecibles +40%", "Baja", "1-3 meses"))
                .addStrategic(initiative("Especialización premium", "Enfocarse en nicho de alto valor",
                        "Aumento tarifas 50-100%", "Media", "6-12 meses"))
                .addStrategic(initiative("Equipo y subcontratación", "Escalar con recursos adicionales",
                        "Capacidad 3x-5x actual", "Alta", "6-18 meses"))
                .build();
    }

    private RecommendationSet hybrid(Map<String, Double> shares, double totalCost) {
        double productsPct = pct(shares, PRODUCTS_SHARE);
        double servicePct = pct(shares, SERVICE_SHARE);
        double otherPct = pct(shares, ADDITIONAL_SHARE);

        return RecommendationSet.builder()
                .addPriority(PriorityRecommendation.builder()
                        .title("Balancear componente servicio-producto")
                        .impact(Math.abs(productsPct - servicePct) > 30 ? "Alto" : "Medio")
                        .roi("25-40%")
                        .currentValue(Formats.oneDecimal(productsPct) + "% / " + Formats.oneDecimal(servicePct) + "%")
                        .targetValue("40-60% / 40-60%")
                        .step("Evaluar rentabilidad de cada componente")
                        .step("Ajustar proporción producto/servicio por proyecto")
                        .step("Crear paquetes estándar balanceados")
                        .step("Medir satisfacción cliente por componente")
                        .build())
                .addPriority(PriorityRecommendation.builder()
                        .title("Optimizar márgenes por componente")
                        .impact("Alto")
                        .roi("30-50%")
                        .currentValue("Mixto")
                        .targetValue("Optimizado")
                        .step("Calcular margen individual de productos vs servicios")
                        .step("Identificar componente más rentable")
                        .step("Ajustar precios por valor percibido")
                        .step("Crear ofertas bundled con alta rentabilidad")
                        .build())
                .addOptimization(opportunity("Balance P/S", "Optimizar proporción producto-servicio",
                        savings(totalCost, 20), "2-3 meses"))
                .addOptimization(opportunity("Productos",
                        productsPct > 60 ? "Reducir costo productos" : "Aumentar margen productos",
                        savings(totalCost, 15), "1-2 meses"))
                .addOptimization(opportunity("Servicios",
                        servicePct < 40 ? "Aumentar valor servicios" : "Optimizar eficiencia",
                        savings(totalCost, 25), "1 mes"))
                .addBenchmark(insight("Componente Productos", productsPct, "40-60%",
                        productsPct > 60 ? "Producto-heavy" : productsPct < 40 ? "Servicio-heavy" : "Balanceado",
                        productsPct > 60 ? "Aumentar servicios" : productsPct < 40 ? "Incluir más productos" : "Mantener"))
                .addBenchmark(insight("Componente Servicios", servicePct, "40-60%",
                        servicePct > 60 ? "Servicio-heavy" : servicePct < 40 ? "Producto-heavy" : "Balanceado",
                        servicePct > 60 ? "Estandarizar procesos" : "Aumentar valor servicios"))
                .addBenchmark(insight("Otros Gastos", otherPct, "5-15%",
                        otherPct > 15 ? "Por encima" : "En rango",
                        otherPct > 15 ? "Reducir gastos" : "Controlar"))
                .addStrategic(initiative("Paquetes productizados", "Crear ofertas estándar producto+servicio",
                        "Aumento eficiencia 35%", "Media", "3-6 meses"))
                .addStrategic(initiative("Escalamiento modular", "Componentes intercambiables según cliente",
                        "Flexibilidad +50%, margen +25%", "Media-Alta", "6-9 meses"))
                .addStrategic(initiative("Suscripciones híbridas", "Servicios recurrentes + productos bajo demanda",
                        "Ingresos predecibles +60%", "Alta", "9-12 meses"))
                .build();
    }

    /**
     * Advice that holds for any business, used when no archetype-specific generator exists.
     */
    public RecommendationSet generic(double totalCost) {
        return RecommendationSet.builder()
                .addPriority(PriorityRecommendation.builder()
                        .title("Optimizar estructura de costos")
                        .impact("Medio")
                        .roi("15-25%")
                        .currentValue("N/A")
                        .targetValue("Optimizado")
                        .step("Analizar cada componente de costo")
                        .step("Identificar oportunidades de reducción")
                        .step("Implementar controles de costos")
                        .step("Monitorear resultados mensualmente")
                        .build())
                .addOptimization(opportunity("General", "Reducir costos operativos",
                        savings(totalCost, 10), "2-3 meses"))
                .addBenchmark(BenchmarkInsight.builder()
                        .metric("Eficiencia General")
                        .yourValue("Por determinar")
                        .industry("Variable")
                        .status("Evaluando")
                        .recommendation("Análisis detallado")
                        .build())
                .addStrategic(initiative("Análisis detallado por tipo de negocio",
                        "Definir categoría específica para recomendaciones precisas",
                        "Recomendaciones personalizadas", "Baja", "Inmediato"))
                .build();
    }

    private static double pct(Map<String, Double> shares, String component) {
        return shares.getOrDefault(component, 0.0) * 100;
    }

    private static double savings(double totalCost, double percent) {
        return PricingCalculator.round(totalCost * percent / 100);
    }

    private static OptimizationOpportunity opportunity(String category, String opportunity,
                                                       double savings, String timeframe) {
        return OptimizationOpportunity.builder()
                .category(category)
                .opportunity(opportunity)
                .estimatedSavings(savings)
                .timeframe(timeframe)
                .build();
    }

    private static BenchmarkInsight insight(String metric, double valuePct, String industry,
                                            String status, String recommendation) {
        return BenchmarkInsight.builder()
                .metric(metric)
                .yourValue(Formats.oneDecimal(valuePct) + "%")
                .industry(industry)
                .status(status)
                .recommendation(recommendation)
                .build();
    }

    private static StrategicInitiative initiative(String title, String description, String impact,
                                                  String investment, String timeline) {
        return StrategicInitiative.builder()
                .title(title)
                .description(description)
                .impact(impact)
                .investment(investment)
                .timeline(timeline)
                .build();
    }
}
