package com.pyme.costing.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Good band plus the secondary thresholds beyond which a value is poor. Values between
 * the good band and a poor threshold are average. Open sides use infinities.
 */
@Value
@Builder
public class BenchmarkRange {
    @Builder.Default
    double goodMin = Double.NEGATIVE_INFINITY;
    @Builder.Default
    double goodMax = Double.POSITIVE_INFINITY;
    @Builder.Default
    double poorBelow = Double.NEGATIVE_INFINITY;
    @Builder.Default
    double poorAbove = Double.POSITIVE_INFINITY;

    String label; // "40-60%"

    public BenchmarkStatus classify(double value) {
        if (value >= goodMin && value <= goodMax) {
            return BenchmarkStatus.GOOD;
        }
        if (value < poorBelow || value > poorAbove) {
            return BenchmarkStatus.POOR;
        }
        return BenchmarkStatus.AVERAGE;
    }
}
