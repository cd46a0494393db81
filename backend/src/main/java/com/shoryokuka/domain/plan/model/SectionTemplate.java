package com.shoryokuka.domain.plan.model;

import java.util.List;

/**
 * Rhetorical skeleton of one document section.
 *
 * @param sectionId       section the template renders
 * @param slots           ordered slots
 * @param processTemplate industry process template the illustrations may cite
 */
public record SectionTemplate(
        SectionId sectionId,
        List<TemplateSlot> slots,
        ProcessTemplate processTemplate
) {
    public SectionTemplate {
        if (slots.isEmpty()) {
            throw new IllegalArgumentException("Template " + sectionId + " has no slots");
        }
        slots = List.copyOf(slots);
    }

    public int slotCount() {
        return slots.size();
    }

    public TemplateSlot slot(int index) {
        return slots.get(index);
    }

    public SectionTemplate withProcessTemplate(ProcessTemplate template) {
        return new SectionTemplate(sectionId, slots, template);
    }
}
