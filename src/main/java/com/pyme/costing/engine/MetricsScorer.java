package com.pyme.costing.engine;

import com.pyme.costing.domain.ArchetypeProfile;
import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.CoherenceRule;
import com.pyme.costing.domain.CostAnalysis;
import com.pyme.costing.domain.CostInput;
import com.pyme.costing.domain.FieldSpec;
import com.pyme.costing.domain.Metrics;
import com.pyme.costing.domain.ProgressIndicator;
import com.pyme.costing.domain.ScoreBand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Heuristic data-quality scores: how plausible the cost proportions look for the
 * archetype (coherence) and how much of the form was filled in (completeness).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsScorer {

    static final double COHERENCE_WEIGHT = 0.6;
    static final double COMPLETENESS_WEIGHT = 0.4;

    private final ProportionExtractor proportionExtractor;

    public Metrics computeMetrics(BusinessArchetype archetype, CostInput costs, CostAnalysis analysis) {
        ArchetypeProfile profile = ArchetypeProfile.of(archetype);
        Map<String, Double> proportions = proportionExtractor.proportions(archetype, costs);

        double coherence = coherence(profile, costs, proportions);
        double completeness = completeness(profile, costs);
        double overall = COHERENCE_WEIGHT * coherence + COMPLETENESS_WEIGHT * completeness;

        log.debug("{} metrics: total={} coherence={} completeness={} overall={}",
                archetype, analysis != null ? analysis.getTotalCost() : null, coherence, completeness, overall);

        return Metrics.builder()
                .proportions(proportions)
                .coherenceScore(coherence)
                .completeness(completeness)
                .overallScore(overall)
                .coherenceBand(ScoreBand.of(coherence))
                .overallBand(ScoreBand.of(overall))
                .coherenceMessage(coherenceMessage(ScoreBand.of(coherence), archetype))
                .overallAssessment(overallAssessment(ScoreBand.of(overall), archetype))
                .build();
    }

    /**
     * One indicator per form field: 100 when filled with a non-zero value.
     */
    public List<ProgressIndicator> progressIndicators(BusinessArchetype archetype, CostInput costs) {
        return ArchetypeProfile.of(archetype).getFields().stream()
                .map(spec -> new ProgressIndicator(spec.getName(), spec.getLabel(),
                        costs.isPresent(spec.getName()) ? 100 : 0))
                .collect(Collectors.toList());
    }

    private double coherence(ArchetypeProfile profile, CostInput costs, Map<String, Double> proportions) {
        double score = 1.0;
        for (CoherenceRule rule : profile.getCoherenceRules()) {
            boolean triggered = rule.getKeys().stream()
                    .mapToDouble(key -> rule.getBasis() == CoherenceRule.Basis.PROPORTION
                            ? proportions.getOrDefault(key, 0.0)
                            : costs.amount(key))
                    .anyMatch(rule::triggeredBy);
            if (triggered) {
                log.debug("Coherence penalty {} ({})", rule.getPenalty(), rule.getDescription());
                score -= rule.getPenalty();
            }
        }
        return Math.max(0.0, score);
    }

    private double completeness(ArchetypeProfile profile, CostInput costs) {
        double score = 0.0;
        for (FieldSpec spec : profile.getFields()) {
            if (costs.isPresent(spec.getName())) {
                score += profile.getCompletenessWeights().getOrDefault(spec.getName(), 0.0);
            }
        }
        return Math.min(1.0, score);
    }

    private String coherenceMessage(ScoreBand band, BusinessArchetype archetype) {
        String name = archetype.getDisplayName().toLowerCase();
        return switch (band) {
            case EXCELLENT -> "Excelente coherencia para " + name + ". Los costos están bien balanceados.";
            case ACCEPTABLE -> "Coherencia aceptable para " + name + ". Algunas proporciones pueden mejorarse.";
            case LOW -> "Coherencia baja para " + name + ". Revisa las proporciones de costos.";
        };
    }

    private String overallAssessment(ScoreBand band, BusinessArchetype archetype) {
        String name = archetype.getDisplayName().toLowerCase();
        return switch (band) {
            case EXCELLENT -> "Excelente estructura de costos para " + name + ". Análisis completo y coherente.";
            case ACCEPTABLE -> "Buen análisis para " + name + ". Algunas áreas pueden optimizarse.";
            case LOW -> "El análisis de " + name + " necesita refinamiento. Revisa los componentes principales.";
        };
    }
}
