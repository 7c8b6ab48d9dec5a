package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Alert {
    AlertType type;
    String title;
    String message;
    String suggestion;
}
