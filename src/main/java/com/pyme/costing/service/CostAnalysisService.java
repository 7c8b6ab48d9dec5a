package com.pyme.costing.service;

import com.pyme.costing.domain.Alert;
import com.pyme.costing.domain.AnalysisReport;
import com.pyme.costing.domain.Benchmark;
import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.CostAnalysis;
import com.pyme.costing.domain.DebtCapacityAssessment;
import com.pyme.costing.domain.DebtCapacityRequest;
import com.pyme.costing.domain.FieldSpec;
import com.pyme.costing.domain.Metrics;
import com.pyme.costing.domain.RecommendationSet;
import com.pyme.costing.domain.ValidationResult;
import com.pyme.costing.engine.AlertGenerator;
import com.pyme.costing.engine.ArchetypeSchemaRegistry;
import com.pyme.costing.engine.BenchmarkComparator;
import com.pyme.costing.engine.DebtCapacityEstimator;
import com.pyme.costing.engine.MetricsScorer;
import com.pyme.costing.engine.PricingCalculator;
import com.pyme.costing.engine.RecommendationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one cost analysis end to end: validate, price, score, alert, benchmark and
 * recommend. Stateless; the caller owns any session association.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CostAnalysisService {

    private final ArchetypeSchemaRegistry schemaRegistry;
    private final PricingCalculator pricingCalculator;
    private final MetricsScorer metricsScorer;
    private final AlertGenerator alertGenerator;
    private final BenchmarkComparator benchmarkComparator;
    private final RecommendationEngine recommendationEngine;
    private final DebtCapacityEstimator debtCapacityEstimator;

    public Optional<List<FieldSpec>> schemaFor(String archetypeCode) {
        return BusinessArchetype.fromCode(archetypeCode).map(schemaRegistry::getSchema);
    }

    /**
     * Resolves {@code archetypeCode} first. Unknown codes produce an invalid report with
     * the generic benchmarks and recommendations.
     */
    public AnalysisReport analyze(String archetypeCode, Map<String, ?> rawInput, String sessionId) {
        Optional<BusinessArchetype> archetype = BusinessArchetype.fromCode(archetypeCode);
        if (archetype.isPresent()) {
            return analyze(archetype.get(), rawInput, sessionId);
        }

        log.warn("Unknown business type '{}' (session {}), falling back to generic advice",
                loggable(archetypeCode), loggable(sessionId));
        ValidationResult validation = schemaRegistry.validate(null, rawInput);
        double total = sumOfNumbers(rawInput);
        return AnalysisReport.builder()
                .sessionId(sessionId)
                .valid(false)
                .errors(validation.getErrors())
                .costs(validation.getCosts())
                .benchmarks(benchmarkComparator.compareBenchmarks(null, validation.getCosts(), null))
                .recommendations(recommendationEngine.generateRecommendations(null, validation.getCosts(), total))
                .build();
    }

    public AnalysisReport analyze(BusinessArchetype archetype, Map<String, ?> rawInput, String sessionId) {
        long startTime = System.currentTimeMillis();

        ValidationResult validation = schemaRegistry.validate(archetype, rawInput);
        if (!validation.isValid()) {
            log.warn("Rejected {} input (session {}): {}", archetype, loggable(sessionId), validation.getErrors());
            return AnalysisReport.builder()
                    .archetype(archetype)
                    .sessionId(sessionId)
                    .valid(false)
                    .errors(validation.getErrors())
                    .costs(validation.getCosts())
                    .build();
        }

        CostAnalysis analysis = pricingCalculator.computeAnalysis(archetype, validation.getCosts());
        Metrics metrics = metricsScorer.computeMetrics(archetype, validation.getCosts(), analysis);
        List<Alert> alerts = alertGenerator.generateAlerts(archetype, validation.getCosts(), metrics);
        List<Benchmark> benchmarks = benchmarkComparator.compareBenchmarks(archetype, validation.getCosts(), metrics);
        RecommendationSet recommendations = recommendationEngine.generateRecommendations(
                archetype, validation.getCosts(), analysis.getTotalCost());

        log.info("Analysed {} (session {}): totalCost={} price={} overallScore={} alerts={} in {} ms",
                archetype, loggable(sessionId), analysis.getTotalCost(), analysis.canonicalPrice(),
                String.format("%.2f", metrics.getOverallScore()), alerts.size(),
                System.currentTimeMillis() - startTime);

        return AnalysisReport.builder()
                .archetype(archetype)
                .sessionId(sessionId)
                .valid(true)
                .errors(List.of())
                .costs(validation.getCosts())
                .analysis(analysis)
                .metrics(metrics)
                .progress(metricsScorer.progressIndicators(archetype, validation.getCosts()))
                .alerts(alerts)
                .benchmarks(benchmarks)
                .recommendations(recommendations)
                .build();
    }

    public DebtCapacityAssessment estimateDebtCapacity(DebtCapacityRequest request) {
        BusinessArchetype archetype = request != null
                ? BusinessArchetype.fromCode(request.getArchetype()).orElse(null)
                : null;
        DebtCapacityAssessment assessment = debtCapacityEstimator.estimate(archetype, request);
        if (assessment.isValid()) {
            log.info("Debt capacity for {}: maxNewDebt={} risk={}", archetype,
                    assessment.getMaxNewDebt(), assessment.getRiskLevel());
        }
        return assessment;
    }

    /**
     * Caller-supplied text with line breaks replaced, so it cannot forge log lines.
     */
    static String loggable(String value) {
        return value == null ? null : value.replaceAll("[\\r\\n]", "_");
    }

    private static double sumOfNumbers(Map<String, ?> rawInput) {
        if (rawInput == null) {
            return 0.0;
        }
        return rawInput.values().stream()
                .filter(Number.class::isInstance)
                .mapToDouble(v -> ((Number) v).doubleValue())
                .filter(Double::isFinite)
                .sum();
    }
}
