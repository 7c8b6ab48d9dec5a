package com.pyme.costing.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Subtracts {@code penalty} from the coherence score when any of {@code keys} is below
 * {@code below}, above {@code above}, or (with {@code zeroTriggers}) exactly zero.
 */
@Value
@Builder
public class CoherenceRule {

    public enum Basis {
        PROPORTION, // key is a proportion component
        AMOUNT      // key is a raw input field
    }

    String description;
    Basis basis;

    @Singular
    List<String> keys;

    Double below;
    Double above;
    boolean zeroTriggers;

    double penalty;

    public boolean triggeredBy(double value) {
        if (zeroTriggers && value == 0.0) {
            return true;
        }
        return (below != null && value < below) || (above != null && value > above);
    }
}
