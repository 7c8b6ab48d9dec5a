package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything one analysis produces. An invalid report carries only the validation
 * outcome; the computed sections are null.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisReport {
    BusinessArchetype archetype;
    String sessionId;

    boolean valid;
    List<String> errors;
    CostInput costs;

    CostAnalysis analysis;
    Metrics metrics;
    List<ProgressIndicator> progress;
    List<Alert> alerts;
    List<Benchmark> benchmarks;
    RecommendationSet recommendations;
}
