package com.pyme.costing.engine;

import com.pyme.costing.domain.ArchetypeProfile;
import com.pyme.costing.domain.Benchmark;
import com.pyme.costing.domain.BenchmarkRange;
import com.pyme.costing.domain.BenchmarkStatus;
import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.CostInput;
import com.pyme.costing.domain.Metrics;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.pyme.costing.domain.ArchetypeProfile.*;
import static com.pyme.costing.domain.CostField.*;
import static com.pyme.costing.engine.ProportionExtractor.*;

/**
 * Places an analysis against fixed industry reference ranges.
 */
@Component
public class BenchmarkComparator {

    static final double MANUFACTURING_STANDARD_MARGIN_PCT = 50;

    /**
     * {@code archetype} may be null: unknown business types get the generic benchmark.
     */
    public List<Benchmark> compareBenchmarks(BusinessArchetype archetype, CostInput costs, Metrics metrics) {
        if (archetype == null) {
            return generic();
        }
        ArchetypeProfile profile = ArchetypeProfile.of(archetype);
        return switch (archetype) {
            case MANUFACTURING -> manufacturing(profile, metrics);
            case RESALE -> resale(profile, costs, metrics);
            case SERVICE -> service(profile, costs);
            case HYBRID -> hybrid(profile, costs, metrics);
            case PACKAGE -> generic();
        };
    }

    public List<Benchmark> generic() {
        return List.of(Benchmark.builder()
                .metric("Eficiencia General")
                .yourValue("Por determinar")
                .industryRange("Variable")
                .comparison("Sin referencia")
                .status(BenchmarkStatus.AVERAGE)
                .recommendation("Análisis detallado")
                .build());
    }

    private List<Benchmark> manufacturing(ArchetypeProfile profile, Metrics metrics) {
        double materials = metrics.proportion(MATERIALS_SHARE) * 100;
        BenchmarkRange materialsRange = profile.benchmarkRange(MATERIALS_RATIO);
        BenchmarkStatus materialsStatus = materialsRange.classify(materials);

        double labor = metrics.proportion(LABOR_SHARE) * 100;
        BenchmarkRange laborRange = profile.benchmarkRange(LABOR_RATIO);
        BenchmarkStatus laborStatus = laborRange.classify(labor);

        return List.of(
                Benchmark.builder()
                        .metric("Ratio Materias Primas")
                        .yourValue(Math.round(materials) + "%")
                        .industryRange(materialsRange.getLabel())
                        .comparison(band(materials, materialsRange, "Óptimo", "Alto", "Bajo"))
                        .status(materialsStatus)
                        .recommendation(materialsStatus == BenchmarkStatus.GOOD ? "Mantener"
                                : materials > materialsRange.getGoodMax() ? "Negociar con proveedores"
                                : "Verificar que incluiste todos los materiales")
                        .build(),
                Benchmark.builder()
                        .metric("Ratio Mano de Obra")
                        .yourValue(Math.round(labor) + "%")
                        .industryRange(laborRange.getLabel())
                        .comparison(band(labor, laborRange, "Óptimo", "Alto", "Bajo"))
                        .status(laborStatus)
                        .recommendation(laborStatus == BenchmarkStatus.GOOD ? "Mantener"
                                : labor > laborRange.getGoodMax() ? "Automatizar procesos"
                                : "Revisar el costo real de la mano de obra")
                        .build(),
                Benchmark.builder()
                        .metric("Margen Manufactura")
                        .yourValue(Formats.plain(MANUFACTURING_STANDARD_MARGIN_PCT) + "%")
                        .industryRange("50%")
                        .comparison("Estándar Industria")
                        .status(BenchmarkStatus.GOOD)
                        .recommendation("Usa el precio óptimo como referencia")
                        .build());
    }

    private List<Benchmark> resale(ArchetypeProfile profile, CostInput costs, Metrics metrics) {
        double purchase = metrics.proportion(PURCHASE_SHARE) * 100;
        BenchmarkRange purchaseRange = profile.benchmarkRange(PURCHASE_RATIO);
        BenchmarkStatus purchaseStatus = purchaseRange.classify(purchase);

        double margin = costs.amount(DESIRED_MARGIN_PCT);
        BenchmarkStatus marginStatus = profile.benchmarkRange(RESALE_MARGIN).classify(margin);
        String marginComparison = margin >= 25 && margin <= 50 ? "Competitivo" : margin > 50 ? "Premium" : "Bajo";

        double logistics = costs.amount(LOGISTICS_PCT);
        BenchmarkRange logisticsRange = profile.benchmarkRange(LOGISTICS);
        BenchmarkStatus logisticsStatus = logisticsRange.classify(logistics);

        return List.of(
                Benchmark.builder()
                        .metric("Costo vs Precio")
                        .yourValue(Math.round(purchase) + "%")
                        .industryRange(purchaseRange.getLabel())
                        .comparison(band(purchase, purchaseRange, "Saludable", "Alto", "Excelente"))
                        .status(purchaseStatus)
                        .recommendation(purchase > purchaseRange.getGoodMax() ? "Negociar mejores precios de compra" : "Mantener")
                        .build(),
                Benchmark.builder()
                        .metric("Margen Reventa")
                        .yourValue(Formats.plain(margin) + "%")
                        .industryRange(profile.benchmarkRange(RESALE_MARGIN).getLabel())
                        .comparison(marginComparison)
                        .status(marginStatus)
                        .recommendation(marginStatus == BenchmarkStatus.GOOD ? "Mantener" : "Aumentar el margen")
                        .build(),
                Benchmark.builder()
                        .metric("Logística")
                        .yourValue(Formats.plain(logistics) + "%")
                        .industryRange(logisticsRange.getLabel())
                        .comparison(logistics <= 10 ? "Eficiente" : "Alto")
                        .status(logisticsStatus)
                        .recommendation(logisticsStatus == BenchmarkStatus.GOOD ? "Mantener" : "Consolidar envíos y rutas")
                        .build());
    }

    private List<Benchmark> service(ArchetypeProfile profile, CostInput costs) {
        double rate = costs.amount(HOURLY_RATE);
        String tier = rate < 30000 ? "Junior" : rate < 80000 ? "Intermedio" : rate < 150000 ? "Senior" : "Premium";
        BenchmarkRange rateRange = profile.benchmarkRange(HOURLY_RATE_LEVEL);
        BenchmarkStatus rateStatus = rateRange.classify(rate);

        double projectValue = rate * costs.amount(PROJECT_HOURS);
        String valueTier = projectValue >= 500000 ? "Alto Valor" : projectValue >= 200000 ? "Medio" : "Básico";
        BenchmarkRange valueRange = profile.benchmarkRange(PROJECT_VALUE);
        BenchmarkStatus valueStatus = valueRange.classify(projectValue);

        double hours = costs.amount(PROJECT_HOURS);
        String pace = hours <= 20 ? "Ágil" : hours <= 80 ? "Normal" : "Extenso";
        BenchmarkRange hoursRange = profile.benchmarkRange(PROJECT_EFFICIENCY);
        BenchmarkStatus hoursStatus = hoursRange.classify(hours);

        return List.of(
                Benchmark.builder()
                        .metric("Tarifa Horaria")
                        .yourValue(Formats.cop(rate))
                        .industryRange(rateRange.getLabel())
                        .comparison(tier)
                        .status(rateStatus)
                        .recommendation(rateStatus == BenchmarkStatus.GOOD ? "Mantener" : "Aumentar tarifa gradualmente")
                        .build(),
                Benchmark.builder()
                        .metric("Valor Proyecto")
                        .yourValue(Formats.cop(projectValue))
                        .industryRange(valueRange.getLabel())
                        .comparison(valueTier)
                        .status(valueStatus)
                        .recommendation(valueStatus == BenchmarkStatus.GOOD ? "Mantener" : "Ofrecer paquetes de mayor valor")
                        .build(),
                Benchmark.builder()
                        .metric("Eficiencia")
                        .yourValue(Formats.plain(hours) + "h")
                        .industryRange(hoursRange.getLabel())
                        .comparison(pace)
                        .status(hoursStatus)
                        .recommendation(hoursStatus == BenchmarkStatus.GOOD ? "Mantener" : "Dividir el proyecto en fases")
                        .build());
    }

    private List<Benchmark> hybrid(ArchetypeProfile profile, CostInput costs, Metrics metrics) {
        double service = metrics.proportion(SERVICE_SHARE) * 100;
        String balance = service >= 30 && service <= 70 ? "Balanceado" : service > 70 ? "Pro Servicio" : "Pro Producto";
        BenchmarkRange balanceRange = profile.benchmarkRange(SERVICE_BALANCE);
        BenchmarkStatus balanceStatus = balanceRange.classify(service);

        double totalValue = costs.amount(PROFESSIONAL_RATE) * costs.amount(CLIENT_HOURS)
                + costs.amount(PRODUCTS_COST) + costs.amount(ADDITIONAL_COST);
        String valueTier = totalValue >= 800000 ? "Premium" : totalValue >= 400000 ? "Medio" : "Básico";
        BenchmarkRange valueRange = profile.benchmarkRange(TOTAL_VALUE);
        BenchmarkStatus valueStatus = valueRange.classify(totalValue);

        return List.of(
                Benchmark.builder()
                        .metric("Balance Servicio")
                        .yourValue(Math.round(service) + "%")
                        .industryRange(balanceRange.getLabel())
                        .comparison(balance)
                        .status(balanceStatus)
                        .recommendation(balanceStatus == BenchmarkStatus.GOOD ? "Mantener"
                                : service > balanceRange.getGoodMax() ? "Incluir más productos" : "Aumentar el componente profesional")
                        .build(),
                Benchmark.builder()
                        .metric("Valor Total")
                        .yourValue(Formats.cop(totalValue))
                        .industryRange(valueRange.getLabel())
                        .comparison(valueTier)
                        .status(valueStatus)
                        .recommendation(valueStatus == BenchmarkStatus.GOOD ? "Mantener" : "Crear paquetes de mayor valor")
                        .build(),
                Benchmark.builder()
                        .metric("Complejidad")
                        .yourValue("Híbrido")
                        .industryRange("Modelo Avanzado")
                        .comparison("Modelo Avanzado")
                        .status(BenchmarkStatus.GOOD)
                        .recommendation("Estandarizar paquetes producto+servicio")
                        .build());
    }

    private static String band(double value, BenchmarkRange range, String inRange, String above, String below) {
        if (value >= range.getGoodMin() && value <= range.getGoodMax()) {
            return inRange;
        }
        return value > range.getGoodMax() ? above : below;
    }
}
