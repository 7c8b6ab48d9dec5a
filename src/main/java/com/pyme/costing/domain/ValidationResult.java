package com.pyme.costing.domain;

import lombok.Value;

import java.util.List;

@Value
public class ValidationResult {
    CostInput costs;
    List<String> errors;

    public boolean isValid() {
        return errors.isEmpty();
    }
}
