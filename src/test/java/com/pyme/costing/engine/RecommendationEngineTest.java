package com.pyme.costing.engine;

import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.OptimizationOpportunity;
import com.pyme.costing.domain.RecommendationSet;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationEngineTest {

    private final RecommendationEngine engine = new RecommendationEngine(new ProportionExtractor());

    @Test
    void everyArchetypeFillsAllSections() {
        for (BusinessArchetype archetype : BusinessArchetype.values()) {
            RecommendationSet set = engine.generateRecommendations(archetype, SampleCosts.of(archetype), 10000);

            assertThat(set.getPriority()).as(archetype.name()).isNotEmpty();
            assertThat(set.getOptimization()).as(archetype.name()).isNotEmpty();
            assertThat(set.getBenchmarks()).as(archetype.name()).isNotEmpty();
            assertThat(set.getStrategic()).as(archetype.name()).isNotEmpty();
        }
    }

    @Test
    void manufacturingSavingsAreFractionsOfTotalCost() {
        RecommendationSet set = engine.generateRecommendations(BusinessArchetype.MANUFACTURING,
                SampleCosts.of(BusinessArchetype.MANUFACTURING), 5600);

        assertThat(set.getOptimization()).extracting(OptimizationOpportunity::getEstimatedSavings)
                .containsExactly(280.0, 840.0, 168.0);
        assertThat(set.getOptimization().get(0).getOpportunity()).isEqualTo("Reducir desperdicio en 5.0%");
        assertThat(set.getOptimization().get(2).getOpportunity()).isEqualTo("Packaging eficiente");
    }

    @Test
    void manufacturingPriorityReflectsMaterialShare() {
        RecommendationSet set = engine.generateRecommendations(BusinessArchetype.MANUFACTURING,
                SampleCosts.manufacturing(8000, 1000, 500, 500), 10000);

        assertThat(set.getPriority().get(0).getImpact()).isEqualTo("Alto");
        assertThat(set.getPriority().get(0).getRoi()).isEqualTo("25-40%");
        assertThat(set.getPriority().get(0).getCurrentValue()).isEqualTo("80.0");
        assertThat(set.getPriority().get(0).getSteps()).hasSize(4);
        assertThat(set.getBenchmarks().get(0).getStatus()).isEqualTo("Por encima");
        assertThat(set.getBenchmarks().get(0).getYourValue()).isEqualTo("80.0%");
    }

    @Test
    void serviceTimeShareIsHoursOverWorkingMonth() {
        RecommendationSet set = engine.generateRecommendations(BusinessArchetype.SERVICE,
                SampleCosts.of(BusinessArchetype.SERVICE), 1_000_000);

        assertThat(set.getPriority().get(1).getCurrentValue()).isEqualTo("12.5");
        assertThat(set.getPriority().get(1).getImpact()).isEqualTo("Medio");
        assertThat(set.getBenchmarks().get(1).getStatus()).isEqualTo("Eficiente");
    }

    @Test
    void hybridShowsProductAndServiceShares() {
        RecommendationSet set = engine.generateRecommendations(BusinessArchetype.HYBRID,
                SampleCosts.of(BusinessArchetype.HYBRID), 170000);

        assertThat(set.getPriority().get(0).getCurrentValue()).isEqualTo("23.5% / 70.6%");
        assertThat(set.getPriority().get(0).getImpact()).isEqualTo("Alto");
    }

    @Test
    void unknownArchetypeGetsGenericAdvice() {
        RecommendationSet set = engine.generateRecommendations(null, null, 1000);

        assertThat(set.getPriority()).singleElement()
                .satisfies(p -> assertThat(p.getTitle()).isEqualTo("Optimizar estructura de costos"));
        assertThat(set.getOptimization().get(0).getEstimatedSavings()).isEqualTo(100.0);
        assertThat(set.getBenchmarks().get(0).getMetric()).isEqualTo("Eficiencia General");
    }

    @Test
    void packageUsesGenericAdvice() {
        assertThat(engine.generateRecommendations(BusinessArchetype.PACKAGE,
                SampleCosts.of(BusinessArchetype.PACKAGE), 95000))
                .isEqualTo(engine.generic(95000));
    }
}
