package com.pyme.costing.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class Metrics {
    /** Cost component to fraction of the component total, in display order. */
    Map<String, Double> proportions;

    double coherenceScore;
    double completeness;
    double overallScore;

    ScoreBand coherenceBand;
    ScoreBand overallBand;
    String coherenceMessage;
    String overallAssessment;

    public double proportion(String component) {
        Double value = proportions.get(component);
        return value != null ? value : 0.0;
    }
}
