package com.pyme.costing.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DomainModelTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void archetypeResolvesCodeOrName() {
        assertThat(BusinessArchetype.fromCode("reventa")).contains(BusinessArchetype.RESALE);
        assertThat(BusinessArchetype.fromCode(" Servicio ")).contains(BusinessArchetype.SERVICE);
        assertThat(BusinessArchetype.fromCode("hybrid")).contains(BusinessArchetype.HYBRID);
        assertThat(BusinessArchetype.fromCode("restaurante")).isEmpty();
        assertThat(BusinessArchetype.fromCode(null)).isEmpty();
    }

    @Test
    void enumsSerialiseAsCodes() throws Exception {
        assertThat(mapper.writeValueAsString(BusinessArchetype.MANUFACTURING)).isEqualTo("\"manufactura\"");
        assertThat(mapper.writeValueAsString(AlertType.DANGER)).isEqualTo("\"danger\"");
        assertThat(mapper.writeValueAsString(RiskLevel.MEDIUM)).isEqualTo("\"MEDIO\"");
        assertThat(mapper.readValue("\"paquete\"", BusinessArchetype.class)).isEqualTo(BusinessArchetype.PACKAGE);
    }

    @Test
    void unknownExperienceFallsBackToMid() {
        assertThat(ExperienceLevel.fromCode("expert").getMultiplier()).isEqualTo(2.2);
        assertThat(ExperienceLevel.fromCode("guru")).isEqualTo(ExperienceLevel.MID);
        assertThat(ExperienceLevel.fromCode(null)).isEqualTo(ExperienceLevel.MID);
        assertThat(ExperienceLevel.isKnown("guru")).isFalse();
    }

    @Test
    void experienceLevelCarriesOnlyCodeAndMultiplier() throws Exception {
        assertThat(mapper.writeValueAsString(ExperienceLevel.SENIOR)).isEqualTo("\"senior\"");
        assertThat(ExperienceLevel.values()).extracting(ExperienceLevel::getMultiplier)
                .containsExactly(1.0, 1.3, 1.7, 2.2);
    }

    @Test
    void benchmarkRangeHasAverageZoneBetweenGoodAndPoor() {
        BenchmarkRange range = BenchmarkRange.builder().goodMin(40).goodMax(60).poorBelow(30).poorAbove(70).build();

        assertThat(range.classify(50)).isEqualTo(BenchmarkStatus.GOOD);
        assertThat(range.classify(40)).isEqualTo(BenchmarkStatus.GOOD);
        assertThat(range.classify(35)).isEqualTo(BenchmarkStatus.AVERAGE);
        assertThat(range.classify(65)).isEqualTo(BenchmarkStatus.AVERAGE);
        assertThat(range.classify(29)).isEqualTo(BenchmarkStatus.POOR);
        assertThat(range.classify(71)).isEqualTo(BenchmarkStatus.POOR);
    }

    @Test
    void openRangeIsGoodAboveMinimum() {
        BenchmarkRange range = BenchmarkRange.builder().goodMin(50000).poorBelow(25000).build();

        assertThat(range.classify(1_000_000)).isEqualTo(BenchmarkStatus.GOOD);
        assertThat(range.classify(30000)).isEqualTo(BenchmarkStatus.AVERAGE);
    }

    @Test
    void coherenceRuleTriggers() {
        CoherenceRule band = CoherenceRule.builder().key("materials").below(0.3).above(0.7).penalty(0.2).build();
        CoherenceRule zero = CoherenceRule.builder().key("overhead").zeroTriggers(true).penalty(0.2).build();

        assertThat(band.triggeredBy(0.5)).isFalse();
        assertThat(band.triggeredBy(0.2)).isTrue();
        assertThat(band.triggeredBy(0.8)).isTrue();
        assertThat(zero.triggeredBy(0.0)).isTrue();
        assertThat(zero.triggeredBy(10.0)).isFalse();
    }

    @Test
    void scoreBandThresholds() {
        assertThat(ScoreBand.of(0.8)).isEqualTo(ScoreBand.EXCELLENT);
        assertThat(ScoreBand.of(0.79)).isEqualTo(ScoreBand.ACCEPTABLE);
        assertThat(ScoreBand.of(0.6)).isEqualTo(ScoreBand.ACCEPTABLE);
        assertThat(ScoreBand.of(0.59)).isEqualTo(ScoreBand.LOW);
    }

    @Test
    void completenessWeightsSumToOne() {
        for (BusinessArchetype archetype : BusinessArchetype.values()) {
            double sum = ArchetypeProfile.of(archetype).getCompletenessWeights().values().stream()
                    .mapToDouble(Double::doubleValue).sum();

            assertThat(sum).as(archetype.name()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void canonicalPriceFollowsArchetype() {
        CostAnalysis service = CostAnalysis.builder()
                .archetype(BusinessArchetype.SERVICE).finalPrice(1_700_000.0).basePrice(1_000_000.0).build();
        CostAnalysis bundle = CostAnalysis.builder()
                .archetype(BusinessArchetype.PACKAGE).suggestedPrice(111150.0).build();

        assertThat(service.canonicalPrice()).isEqualTo(1_700_000.0);
        assertThat(bundle.canonicalPrice()).isEqualTo(111150.0);
    }
}
