package com.pyme.costing.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PriorityRecommendation {
    String title;
    String impact;        // "Alto", "Medio", "Bajo"
    String roi;
    String currentValue;
    String targetValue;

    @Singular
    List<String> steps;
}
