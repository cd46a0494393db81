package com.shoryokuka.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shoryokuka.application.plan.PlanGenerationResult;
import com.shoryokuka.domain.plan.model.GenerationRun;
import com.shoryokuka.domain.plan.model.SectionResult;
import com.shoryokuka.domain.plan.model.ValidationIssue;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanGenerationResponse(
        List<SectionEntry> sections,
        Double documentScore,
        List<IssueEntry> residualIssues,
        String document,
        boolean cancelled
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SectionEntry(
            String code,
            String title,
            String status,
            String text,
            Double score,
            Integer iterations,
            List<Double> scoreHistory,
            List<IssueEntry> issues,
            String errorCode,
            String errorMessage
    ) {}

    public record IssueEntry(String category, String severity, String section, int slot, String message,
                             String matchedText) {}

    public static PlanGenerationResponse from(PlanGenerationResult result) {
        GenerationRun run = result.run();
        List<SectionEntry> sections = run.sections().values().stream()
                .map(PlanGenerationResponse::toEntry)
                .toList();
        Double documentScore = run.documentValidation() == null ? null : run.documentValidation().score();
        return new PlanGenerationResponse(sections, documentScore, toIssues(run.residualIssues()),
                result.document(), run.cancelled());
    }

    private static SectionEntry toEntry(SectionResult r) {
        boolean hasValidation = r.validation() != null;
        return new SectionEntry(
                r.sectionId().code(),
                r.sectionId().title(),
                r.status().name(),
                r.text(),
                hasValidation ? r.score() : null,
                r.draft() == null ? null : r.iterations(),
                r.scoreHistory().isEmpty() ? null : r.scoreHistory(),
                hasValidation ? toIssues(r.validation().issues()) : null,
                r.errorCode(),
                r.errorMessage());
    }

    private static List<IssueEntry> toIssues(List<ValidationIssue> issues) {
        return issues.stream()
                .map(i -> new IssueEntry(i.category().name(), i.severity().name(),
                        i.location().sectionId() == null ? null : i.location().sectionId().code(),
                        i.slotIndex(), i.message(), i.matchedText()))
                .toList();
    }
}
