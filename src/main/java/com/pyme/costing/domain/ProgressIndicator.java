package com.pyme.costing.domain;

import lombok.Value;

@Value
public class ProgressIndicator {
    String field;
    String name;
    int completion; // 0 or 100
}
