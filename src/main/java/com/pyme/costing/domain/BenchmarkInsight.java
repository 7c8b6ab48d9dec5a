package com.pyme.costing.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BenchmarkInsight {
    String metric;
    String yourValue;
    String industry;
    String status;
    String recommendation;
}
