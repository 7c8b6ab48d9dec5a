package com.pyme.costing.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StrategicInitiative {
    String title;
    String description;
    String impact;
    String investment;
    String timeline;
}
