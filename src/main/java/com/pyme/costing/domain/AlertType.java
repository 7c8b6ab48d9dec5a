package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {
    WARNING,
    DANGER,
    INFO;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }
}
