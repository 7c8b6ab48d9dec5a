package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Business models supported by the engine. Every engine component switches over this
 * enum, so adding a constant is a compile error until each component handles it.
 */
public enum BusinessArchetype {
    MANUFACTURING("manufactura", "Manufactura"),
    RESALE("reventa", "Reventa"),
    SERVICE("servicio", "Servicio"),
    HYBRID("hibrido", "Híbrido"),
    PACKAGE("paquete", "Paquete");

    private final String code;
    private final String displayName;

    BusinessArchetype(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a wire code ("manufactura") or constant name ("MANUFACTURING"), ignoring case.
     */
    public static Optional<BusinessArchetype> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(a -> a.code.equalsIgnoreCase(normalized) || a.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    static BusinessArchetype fromJson(String code) {
        return fromCode(code).orElse(null);
    }
}
