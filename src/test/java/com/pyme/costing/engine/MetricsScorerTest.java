package com.pyme.costing.engine;

import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.CostInput;
import com.pyme.costing.domain.Metrics;
import com.pyme.costing.domain.ProgressIndicator;
import com.pyme.costing.domain.ScoreBand;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricsScorerTest {

    private final PricingCalculator calculator = new PricingCalculator();
    private final MetricsScorer scorer = new MetricsScorer(new ProportionExtractor());

    @Test
    void lowMaterialShareCostsCoherence() {
        Metrics metrics = score(BusinessArchetype.MANUFACTURING, SampleCosts.of(BusinessArchetype.MANUFACTURING));

        assertThat(metrics.getCoherenceScore()).isCloseTo(0.8, within(1e-9));
        assertThat(metrics.getCompleteness()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.getOverallScore()).isCloseTo(0.88, within(1e-9));
        assertThat(metrics.getOverallBand()).isEqualTo(ScoreBand.EXCELLENT);
        assertThat(metrics.getOverallAssessment()).startsWith("Excelente estructura de costos para manufactura");
    }

    @Test
    void missingOverheadIsPenalisedAndLowersCompleteness() {
        Metrics metrics = score(BusinessArchetype.MANUFACTURING, SampleCosts.manufacturing(3000, 2000, 300, 0));

        assertThat(metrics.getCoherenceScore()).isCloseTo(0.8, within(1e-9));
        assertThat(metrics.getCompleteness()).isCloseTo(0.9, within(1e-9));
        assertThat(metrics.getOverallScore()).isCloseTo(0.84, within(1e-9));
    }

    @Test
    void balancedServiceScoresFull() {
        Metrics metrics = score(BusinessArchetype.SERVICE, SampleCosts.of(BusinessArchetype.SERVICE));

        assertThat(metrics.getCoherenceScore()).isEqualTo(1.0);
        assertThat(metrics.getCompleteness()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.getCoherenceMessage()).startsWith("Excelente coherencia para servicio");
    }

    @Test
    void outOfRangeResaleInputsStackPenalties() {
        CostInput costs = CostInput.builder()
                .archetype(BusinessArchetype.RESALE)
                .amount("purchaseCost", 10000.0)
                .amount("logisticsPct", 40.0)
                .amount("desiredMarginPct", 150.0)
                .build();

        Metrics metrics = score(BusinessArchetype.RESALE, costs);

        // logistics above 15 and margin above 100
        assertThat(metrics.getCoherenceScore()).isCloseTo(0.65, within(1e-9));
        assertThat(metrics.getCoherenceBand()).isEqualTo(ScoreBand.ACCEPTABLE);
    }

    @Test
    void scoresStayInBoundsForEmptyInput() {
        for (BusinessArchetype archetype : BusinessArchetype.values()) {
            CostInput empty = CostInput.builder().archetype(archetype).build();
            Metrics metrics = scorer.computeMetrics(archetype, empty, null);

            assertThat(metrics.getCoherenceScore()).as(archetype.name()).isBetween(0.0, 1.0);
            assertThat(metrics.getCompleteness()).as(archetype.name()).isBetween(0.0, 1.0);
            assertThat(metrics.getOverallScore()).as(archetype.name()).isNotNaN()
                    .isCloseTo(0.6 * metrics.getCoherenceScore() + 0.4 * metrics.getCompleteness(), within(1e-9));
            assertThat(metrics.getProportions().values()).allMatch(v -> v == 0.0);
        }
    }

    @Test
    void packageHasNoCoherenceRules() {
        Metrics metrics = score(BusinessArchetype.PACKAGE, SampleCosts.of(BusinessArchetype.PACKAGE));

        assertThat(metrics.getCoherenceScore()).isEqualTo(1.0);
    }

    @Test
    void progressMarksFilledFields() {
        List<ProgressIndicator> progress = scorer.progressIndicators(BusinessArchetype.MANUFACTURING,
                SampleCosts.manufacturing(3000, 2000, 0, 0));

        assertThat(progress).extracting(ProgressIndicator::getCompletion).containsExactly(100, 100, 0, 0);
        assertThat(progress.get(0).getName()).isEqualTo("Materias primas");
    }

    private Metrics score(BusinessArchetype archetype, CostInput costs) {
        return scorer.computeMetrics(archetype, costs, calculator.computeAnalysis(archetype, costs));
    }
}
