package com.pyme.costing.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Benchmark {
    String metric;
    String yourValue;     // formatted, e.g. "54%" or "$50.000"
    String industryRange;
    String comparison;    // "Óptimo", "Alto", "Senior"...
    BenchmarkStatus status;
    String recommendation;
}
