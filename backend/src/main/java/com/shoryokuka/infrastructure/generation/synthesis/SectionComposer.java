package com.shoryokuka.infrastructure.generation.synthesis;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionTemplate;

/**
 * Writes the slot texts of one section type.
 */
public interface SectionComposer {

    SectionId sectionId();

    /**
     * Compose one slot.
     *
     * @throws com.shoryokuka.domain.plan.exception.TemplateMismatchException if the slot name is unknown
     */
    String compose(String slotName, FactModel fact, SectionTemplate template);
}
