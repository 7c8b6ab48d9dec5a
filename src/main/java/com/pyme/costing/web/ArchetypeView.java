package com.pyme.costing.web;

import com.pyme.costing.domain.BusinessArchetype;
import lombok.Value;

@Value
public class ArchetypeView {
    String code;
    String displayName;

    static ArchetypeView of(BusinessArchetype archetype) {
        return new ArchetypeView(archetype.getCode(), archetype.getDisplayName());
    }
}
