package com.shoryokuka.infrastructure.generation.synthesis;

import com.shoryokuka.domain.plan.exception.TemplateMismatchException;
import com.shoryokuka.domain.plan.model.FactField;
import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.SectionDraft;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import com.shoryokuka.domain.plan.model.SlotRole;
import com.shoryokuka.domain.plan.model.TemplateSlot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the first draft of a section from the fact model and the section template.
 * <p>
 * Composition is delegated to the {@link SectionComposer} registered for the section id.
 * All required facts of all slots are checked before any slot is written, so a missing
 * fact fails the section without producing a partial draft.
 * </p>
 */
@Slf4j
@Component
public class SectionSynthesizer {

    private final Map<SectionId, SectionComposer> composers = new EnumMap<>(SectionId.class);

    public SectionSynthesizer(List<SectionComposer> composerList) {
        for (SectionComposer composer : composerList) {
            SectionComposer previous = composers.put(composer.sectionId(), composer);
            if (previous != null) {
                throw new IllegalStateException("Duplicate composer for section " + composer.sectionId());
            }
        }
    }

    public SectionDraft synthesize(FactModel fact, SectionTemplate template) {
        return synthesize(fact, template, SectionDraft.DEFAULT_MAX_ITERATIONS);
    }

    /**
     * @throws com.shoryokuka.domain.plan.exception.MissingFactException if a required fact is unavailable
     * @throws TemplateMismatchException                                if the template does not match the composer
     */
    public SectionDraft synthesize(FactModel fact, SectionTemplate template, int maxIterations) {
        for (TemplateSlot slot : template.slots()) {
            requireFacts(fact, slot);
        }
        SectionComposer composer = composerFor(template.sectionId());

        List<String> texts = new ArrayList<>(template.slotCount());
        for (TemplateSlot slot : template.slots()) {
            texts.add(composer.compose(slot.name(), fact, template));
        }

        SectionDraft draft = new SectionDraft(template.sectionId(), fact, maxIterations);
        draft.populate(texts);
        log.debug("Synthesized section {} with {} slots ({} chars)",
                template.sectionId().code(), texts.size(), draft.text().length());
        return draft;
    }

    /**
     * Re-create a single slot, used when the repair engine realigns a drifted section.
     */
    public String synthesizeSlot(FactModel fact, SectionTemplate template, int slotIndex) {
        TemplateSlot slot = template.slot(slotIndex);
        requireFacts(fact, slot);
        return composerFor(template.sectionId()).compose(slot.name(), fact, template);
    }

    /**
     * Fact-grounded sentences that may be appended to a slot of the given role.
     */
    public List<String> elaborations(FactModel fact, SlotRole role) {
        return SlotElaborations.forRole(fact, role);
    }

    private static void requireFacts(FactModel fact, TemplateSlot slot) {
        for (FactField field : slot.requiredFacts()) {
            fact.require(field);
        }
    }

    private SectionComposer composerFor(SectionId sectionId) {
        SectionComposer composer = composers.get(sectionId);
        if (composer == null) {
            throw new TemplateMismatchException("セクションの文章生成器が登録されていません: " + sectionId.code());
        }
        return composer;
    }
}
