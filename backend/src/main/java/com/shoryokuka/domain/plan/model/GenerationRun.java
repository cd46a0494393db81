package com.shoryokuka.domain.plan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one pipeline run over a set of sections.
 *
 * @param factModel          inputs shared by every section
 * @param sections           per-section results in request order
 * @param documentValidation whole-document pass (null when the run was cancelled)
 * @param residualIssues     issues the document pass found; not repaired
 * @param cancelled          true if the run was cancelled before completion
 */
public record GenerationRun(
        FactModel factModel,
        Map<SectionId, SectionResult> sections,
        ValidationResult documentValidation,
        List<ValidationIssue> residualIssues,
        boolean cancelled
) {
    public GenerationRun {
        sections = Collections.unmodifiableMap(new LinkedHashMap<>(sections));
        residualIssues = List.copyOf(residualIssues);
    }

    public SectionResult section(SectionId id) {
        return sections.get(id);
    }

    /**
     * Texts of accepted or exhausted sections, keyed by section id in request order.
     */
    public Map<SectionId, String> finalizedTexts() {
        Map<SectionId, String> texts = new LinkedHashMap<>();
        sections.forEach((id, result) -> {
            if (result.status() == SectionStatus.ACCEPTED || result.status() == SectionStatus.EXHAUSTED) {
                texts.put(id, result.text());
            }
        });
        return texts;
    }
}
