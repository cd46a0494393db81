package com.shoryokuka.domain.plan.model;

import java.util.List;

/**
 * Outcome of one section.
 *
 * @param sectionId     section
 * @param status        terminal status
 * @param draft         frozen draft (null when the section failed before synthesis)
 * @param validation    last validation of the kept text (null when failed)
 * @param scoreHistory  score of every validated iteration, in order
 * @param bestIteration iteration whose text was kept, -1 when failed
 * @param errorCode     error code for FAILED sections
 * @param errorMessage  error message for FAILED sections
 */
public record SectionResult(
        SectionId sectionId,
        SectionStatus status,
        SectionDraft draft,
        ValidationResult validation,
        List<Double> scoreHistory,
        int bestIteration,
        String errorCode,
        String errorMessage
) {
    public SectionResult {
        scoreHistory = List.copyOf(scoreHistory);
    }

    public static SectionResult failed(SectionId sectionId, String errorCode, String errorMessage) {
        return new SectionResult(sectionId, SectionStatus.FAILED, null, null, List.of(), -1, errorCode, errorMessage);
    }

    public String text() {
        return draft == null ? null : draft.text();
    }

    public int iterations() {
        return draft == null ? 0 : draft.getIteration();
    }

    public double score() {
        return validation == null ? 0.0 : validation.score();
    }
}
