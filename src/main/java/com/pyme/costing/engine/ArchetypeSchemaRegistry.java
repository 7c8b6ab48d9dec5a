package com.pyme.costing.engine;

import com.pyme.costing.domain.ArchetypeProfile;
import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.CostInput;
import com.pyme.costing.domain.ExperienceLevel;
import com.pyme.costing.domain.FieldSpec;
import com.pyme.costing.domain.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Field table per archetype, plus validation of raw form input against it.
 * Validation never throws: every problem becomes a user-facing message.
 */
@Slf4j
@Component
public class ArchetypeSchemaRegistry {

    static final String UNSUPPORTED_ARCHETYPE = "Tipo de negocio no soportado";

    public List<FieldSpec> getSchema(BusinessArchetype archetype) {
        return ArchetypeProfile.of(archetype).getFields();
    }

    public ValidationResult validate(BusinessArchetype archetype, Map<String, ?> rawInput) {
        if (archetype == null) {
            return new ValidationResult(CostInput.builder().build(), List.of(UNSUPPORTED_ARCHETYPE));
        }
        Map<String, ?> input = rawInput != null ? rawInput : Map.of();

        List<String> errors = new ArrayList<>();
        CostInput.CostInputBuilder costs = CostInput.builder().archetype(archetype);

        for (FieldSpec spec : getSchema(archetype)) {
            Object raw = input.get(spec.getName());
            if (spec.isChoice()) {
                validateChoice(spec, raw, costs, errors);
            } else {
                validateNumber(spec, raw, costs, errors);
            }
        }

        if (log.isDebugEnabled()) {
            input.keySet().stream()
                    .filter(key -> getSchema(archetype).stream().noneMatch(s -> s.getName().equals(key)))
                    .forEach(key -> log.debug("Ignoring unknown field '{}' for {}", key, archetype));
        }
        return new ValidationResult(costs.build(), List.copyOf(errors));
    }

    private void validateChoice(FieldSpec spec, Object raw, CostInput.CostInputBuilder costs, List<String> errors) {
        String value = raw != null ? raw.toString().trim() : "";
        if (value.isEmpty()) {
            if (spec.getDefaultOption() != null) {
                costs.experienceLevel(ExperienceLevel.fromCode(spec.getDefaultOption()));
            }
            return;
        }
        boolean known = spec.getOptions().stream().anyMatch(o -> o.equalsIgnoreCase(value));
        if (!known || !ExperienceLevel.isKnown(value)) {
            errors.add(spec.getLabel() + " debe ser uno de: " + String.join(", ", spec.getOptions()));
            costs.experienceLevel(ExperienceLevel.fromCode(spec.getDefaultOption()));
            return;
        }
        costs.experienceLevel(ExperienceLevel.fromCode(value));
    }

    private void validateNumber(FieldSpec spec, Object raw, CostInput.CostInputBuilder costs, List<String> errors) {
        double value;
        if (isBlank(raw)) {
            value = spec.getDefaultValue() != null ? spec.getDefaultValue() : 0.0;
        } else {
            Double parsed = parse(raw);
            if (parsed == null) {
                errors.add(spec.getLabel() + " debe ser un número válido");
                costs.amount(spec.getName(), 0.0);
                return;
            }
            value = parsed;
        }
        costs.amount(spec.getName(), value);

        if (spec.isRequired() && value <= 0) {
            errors.add(spec.getRangeMessage() != null
                    ? spec.getRangeMessage()
                    : spec.getLabel() + " debe ser mayor a 0");
        } else if (value < spec.getMin()) {
            errors.add(value < 0
                    ? spec.getLabel() + " no puede ser negativo"
                    : rangeMessage(spec));
        } else if (spec.getMax() != null && value > spec.getMax()) {
            errors.add(rangeMessage(spec));
        }
    }

    private String rangeMessage(FieldSpec spec) {
        if (spec.getRangeMessage() != null) {
            return spec.getRangeMessage();
        }
        return String.format("%s debe estar entre %s y %s", spec.getLabel(),
                Formats.plain(spec.getMin()), Formats.plain(spec.getMax()));
    }

    private static boolean isBlank(Object raw) {
        return raw == null || (raw instanceof CharSequence && raw.toString().isBlank());
    }

    private static Double parse(Object raw) {
        double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else {
            try {
                value = Double.parseDouble(raw.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isFinite(value) ? value : null;
    }
}
