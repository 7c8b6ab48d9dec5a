package com.pyme.costing.engine;

import com.pyme.costing.domain.Alert;
import com.pyme.costing.domain.AlertType;
import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.CostInput;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AlertGeneratorTest {

    private final MetricsScorer scorer = new MetricsScorer(new ProportionExtractor());
    private final AlertGenerator generator = new AlertGenerator();

    @Test
    void dominantMaterialsRaiseWarning() {
        List<Alert> alerts = alerts(BusinessArchetype.MANUFACTURING, SampleCosts.manufacturing(8000, 1000, 500, 500));

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getType()).isEqualTo(AlertType.WARNING);
            assertThat(alert.getTitle()).isEqualTo("Materias Primas Muy Altas");
            assertThat(alert.getMessage()).startsWith("80%");
        });
    }

    @Test
    void excessiveLaborIsDanger() {
        List<Alert> alerts = alerts(BusinessArchetype.MANUFACTURING, SampleCosts.manufacturing(3000, 6000, 500, 500));

        assertThat(alerts).extracting(Alert::getType).containsExactly(AlertType.DANGER);
        assertThat(alerts.get(0).getTitle()).isEqualTo("Mano de Obra Excesiva");
    }

    @Test
    void lowMaterialsIsInformational() {
        List<Alert> alerts = alerts(BusinessArchetype.MANUFACTURING, SampleCosts.of(BusinessArchetype.MANUFACTURING));

        assertThat(alerts).extracting(Alert::getTitle).containsExactly("Materias Primas Bajas");
        assertThat(alerts.get(0).getType()).isEqualTo(AlertType.INFO);
    }

    @Test
    void healthyResaleHasNoAlerts() {
        assertThat(alerts(BusinessArchetype.RESALE, SampleCosts.of(BusinessArchetype.RESALE))).isEmpty();
    }

    @Test
    void resalePurchaseBandsAreExclusive() {
        CostInput heavyPurchase = CostInput.builder()
                .archetype(BusinessArchetype.RESALE)
                .amount("purchaseCost", 10000.0)
                .amount("logisticsPct", 2.0)
                .amount("storage", 500.0)
                .build();
        CostInput lightPurchase = CostInput.builder()
                .archetype(BusinessArchetype.RESALE)
                .amount("purchaseCost", 1000.0)
                .amount("storage", 5000.0)
                .build();

        assertThat(alerts(BusinessArchetype.RESALE, heavyPurchase)).extracting(Alert::getTitle)
                .containsExactly("Costo de Compra Alto");
        assertThat(alerts(BusinessArchetype.RESALE, lightPurchase)).extracting(Alert::getTitle)
                .containsExactly("Margen Muy Alto");
    }

    @Test
    void longServiceProjectIsFlagged() {
        CostInput costs = CostInput.builder()
                .archetype(BusinessArchetype.SERVICE)
                .amount("hourlyRate", 50000.0)
                .amount("projectHours", 120.0)
                .build();

        List<Alert> alerts = alerts(BusinessArchetype.SERVICE, costs);

        assertThat(alerts).extracting(Alert::getTitle).containsExactly("Proyecto Extenso");
        assertThat(alerts.get(0).getMessage()).startsWith("120 horas");
    }

    @Test
    void lowHourlyValueWarns() {
        CostInput costs = CostInput.builder()
                .archetype(BusinessArchetype.SERVICE)
                .amount("hourlyRate", 10000.0)
                .amount("projectHours", 1.0)
                .amount("operationalCost", 3_000_000.0)
                .build();

        assertThat(alerts(BusinessArchetype.SERVICE, costs)).extracting(Alert::getTitle)
                .containsExactly("Valor Hora Bajo");
    }

    @Test
    void productHeavyHybridGetsBothAlerts() {
        CostInput costs = CostInput.builder()
                .archetype(BusinessArchetype.HYBRID)
                .amount("professionalRate", 10000.0)
                .amount("clientHours", 1.0)
                .amount("productsCost", 90000.0)
                .build();

        assertThat(alerts(BusinessArchetype.HYBRID, costs)).extracting(Alert::getTitle)
                .containsExactly("Componente Servicio Bajo", "Orientado a Productos");
    }

    @Test
    void packagesHaveNoAlerts() {
        assertThat(alerts(BusinessArchetype.PACKAGE, SampleCosts.of(BusinessArchetype.PACKAGE))).isEmpty();
    }

    private List<Alert> alerts(BusinessArchetype archetype, CostInput costs) {
        return generator.generateAlerts(archetype, costs, scorer.computeMetrics(archetype, costs, null));
    }
}
