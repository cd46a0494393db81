package com.shoryokuka.domain.plan.model;

import java.util.List;

/**
 * One slot of a section template.
 *
 * @param name           composer key, unique within the template
 * @param role           rhetorical role
 * @param band           expected length band
 * @param requiredFacts  facts the slot cannot be written without
 * @param optionalFacts  facts used when available
 */
public record TemplateSlot(
        String name,
        SlotRole role,
        LengthBand band,
        List<FactField> requiredFacts,
        List<FactField> optionalFacts
) {
    public TemplateSlot {
        requiredFacts = List.copyOf(requiredFacts);
        optionalFacts = List.copyOf(optionalFacts);
    }
}
