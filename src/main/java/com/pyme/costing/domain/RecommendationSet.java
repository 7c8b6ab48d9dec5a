package com.pyme.costing.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RecommendationSet {
    @Singular("addPriority")
    List<PriorityRecommendation> priority;

    @Singular("addOptimization")
    List<OptimizationOpportunity> optimization;

    @Singular("addBenchmark")
    List<BenchmarkInsight> benchmarks;

    @Singular("addStrategic")
    List<StrategicInitiative> strategic;
}
