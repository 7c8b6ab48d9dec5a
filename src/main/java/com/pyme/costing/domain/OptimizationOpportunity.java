package com.pyme.costing.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OptimizationOpportunity {
    String category;
    String opportunity;
    double estimatedSavings; // COP, rounded
    String timeframe;
}
