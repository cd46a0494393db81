package com.shoryokuka.infrastructure.generation.loop;

import com.shoryokuka.domain.plan.exception.BackendUnavailableException;
import com.shoryokuka.domain.plan.exception.MissingFactException;
import com.shoryokuka.domain.plan.exception.TemplateMismatchException;
import com.shoryokuka.domain.plan.exception.PlanGenerationException;
import com.shoryokuka.domain.plan.model.DraftSnapshot;
import com.shoryokuka.domain.plan.model.DraftState;
import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.SectionDraft;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionResult;
import com.shoryokuka.domain.plan.model.SectionStatus;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import com.shoryokuka.domain.plan.model.ValidationResult;
import com.shoryokuka.infrastructure.generation.repair.RepairEngine;
import com.shoryokuka.infrastructure.generation.synthesis.SectionSynthesizer;
import com.shoryokuka.infrastructure.generation.template.TemplateRegistry;
import com.shoryokuka.infrastructure.generation.validation.DefectDetector;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Generate → validate → repair loop of a single section, run on a worker thread.
 * Progress (best snapshot and score history) is published after every validation so a
 * cancelled run can still report the best text seen so far.
 */
@Slf4j
class SectionTask {

    private final SectionId sectionId;
    private final FactModel fact;
    private final TemplateRegistry templateRegistry;
    private final SectionSynthesizer synthesizer;
    private final DefectDetector detector;
    private final RepairEngine repairEngine;
    private final GenerationProperties properties;
    private final BooleanSupplier cancelled;

    private volatile Progress progress = new Progress(null, null, List.of());

    SectionTask(SectionId sectionId, FactModel fact, TemplateRegistry templateRegistry,
                SectionSynthesizer synthesizer, DefectDetector detector, RepairEngine repairEngine,
                GenerationProperties properties, BooleanSupplier cancelled) {
        this.sectionId = sectionId;
        this.fact = fact;
        this.templateRegistry = templateRegistry;
        this.synthesizer = synthesizer;
        this.detector = detector;
        this.repairEngine = repairEngine;
        this.properties = properties;
        this.cancelled = cancelled;
    }

    SectionResult run() {
        long start = System.currentTimeMillis();
        try {
            SectionTemplate template = templateRegistry.get(sectionId, fact.industryTag());
            SectionDraft draft = synthesizer.synthesize(fact, template, properties.getMaxIterations());
            SectionStateMachine machine = new SectionStateMachine(properties.getQualityThreshold());

            while (true) {
                if (isCancelled()) {
                    return cancelledResult();
                }
                ValidationResult result = detector.validate(draft.text(), template);
                DraftState next = machine.onValidated(draft, result);
                publish(machine);
                log.debug("Section {} iteration {}: score={} -> {}",
                        sectionId.code(), draft.getIteration(), result.score(), next);

                switch (next) {
                    case ACCEPTED -> {
                        draft.freeze();
                        log.info("Section {} accepted at iteration {} (score={}, {}ms)",
                                sectionId.code(), draft.getIteration(), result.score(),
                                System.currentTimeMillis() - start);
                        return new SectionResult(sectionId, SectionStatus.ACCEPTED, draft, result,
                                machine.scoreHistory(), draft.getIteration(), null, null);
                    }
                    case EXHAUSTED -> {
                        machine.restoreBest(draft);
                        draft.freeze();
                        log.info("Section {} exhausted after {} iterations, keeping iteration {} (score={}, {}ms)",
                                sectionId.code(), draft.getIteration(), machine.best().iteration(),
                                machine.bestValidation().score(), System.currentTimeMillis() - start);
                        return new SectionResult(sectionId, SectionStatus.EXHAUSTED, draft, machine.bestValidation(),
                                machine.scoreHistory(), machine.best().iteration(), null, null);
                    }
                    case REPAIRING -> repairEngine.repair(draft, result.issues(), fact, template);
                    default -> throw new IllegalStateException("Unexpected state " + next);
                }
            }
        } catch (MissingFactException | TemplateMismatchException | BackendUnavailableException e) {
            return failed(e);
        }
    }

    /**
     * Result for a section that was cancelled: the best text seen so far, or none.
     */
    SectionResult cancelledResult() {
        Progress current = progress;
        if (current.best() == null) {
            return new SectionResult(sectionId, SectionStatus.CANCELLED, null, null, current.scoreHistory(), -1,
                    "CANCELLED", "生成がキャンセルされました");
        }
        SectionDraft draft = SectionDraft.restored(sectionId, fact, properties.getMaxIterations(), current.best());
        draft.freeze();
        return new SectionResult(sectionId, SectionStatus.CANCELLED, draft, current.bestValidation(),
                current.scoreHistory(), current.best().iteration(), "CANCELLED", "生成がキャンセルされました");
    }

    private SectionResult failed(PlanGenerationException e) {
        log.warn("Section {} failed [{}]: {}", sectionId.code(), e.getErrorCode(), e.getMessage());
        return SectionResult.failed(sectionId, e.getErrorCode(), e.getMessage());
    }

    private void publish(SectionStateMachine machine) {
        progress = new Progress(machine.best(), machine.bestValidation(), machine.scoreHistory());
    }

    private boolean isCancelled() {
        return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    private record Progress(DraftSnapshot best, ValidationResult bestValidation, List<Double> scoreHistory) {
    }
}
