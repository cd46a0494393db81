package com.shoryokuka.infrastructure.generation.loop;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.GenerationRun;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionResult;
import com.shoryokuka.domain.plan.service.TextGenerationBackend;
import com.shoryokuka.infrastructure.generation.repair.RepairEngine;
import com.shoryokuka.infrastructure.generation.synthesis.SectionSynthesizer;
import com.shoryokuka.infrastructure.generation.template.TemplateRegistry;
import com.shoryokuka.infrastructure.generation.validation.DefectDetector;
import com.shoryokuka.infrastructure.generation.validation.QualityRubric;
import com.shoryokuka.infrastructure.generation.validation.RubricLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/**
 * Drives every requested section to a terminal state.
 * <p>
 * Pipeline per run:
 *   load rubric → per section (concurrently): synthesize → validate → repair ... → accept | exhaust
 *   → document pass over accepted and exhausted texts.
 * </p>
 * A missing fact, a template mismatch or an unavailable backend fails only the affected
 * section; its siblings run to completion.
 */
@Slf4j
@Component
public class ConvergenceLoop {

    private final TemplateRegistry templateRegistry;
    private final SectionSynthesizer synthesizer;
    private final RubricLoader rubricLoader;
    private final GenerationProperties properties;
    private final ExecutorService executor;
    private final TextGenerationBackend backend;

    public ConvergenceLoop(TemplateRegistry templateRegistry,
                           SectionSynthesizer synthesizer,
                           RubricLoader rubricLoader,
                           GenerationProperties properties,
                           @Qualifier("sectionExecutor") ExecutorService executor,
                           Optional<TextGenerationBackend> backend) {
        this.templateRegistry = templateRegistry;
        this.synthesizer = synthesizer;
        this.rubricLoader = rubricLoader;
        this.properties = properties;
        this.executor = executor;
        this.backend = backend.orElse(null);
    }

    public GenerationRun run(FactModel fact, List<SectionId> sectionIds) {
        return start(fact, sectionIds).await();
    }

    /**
     * Submit the sections and return immediately.
     */
    public RunHandle start(FactModel fact, List<SectionId> sectionIds) {
        QualityRubric rubric = rubricLoader.load(properties.getRubricLocation());
        DefectDetector detector = new DefectDetector(rubric);
        RepairEngine repairEngine = new RepairEngine(rubric, synthesizer, backend);

        RunHandle handle = new RunHandle(fact, detector);
        Set<SectionId> targets = new LinkedHashSet<>(sectionIds);
        for (SectionId sectionId : targets) {
            SectionTask task = new SectionTask(sectionId, fact, templateRegistry, synthesizer, detector,
                    repairEngine, properties, handle::isCancelled);
            Callable<SectionResult> work = task::run;
            handle.add(sectionId, task, executor.submit(work));
        }
        log.info("Started generation of {} sections (maxIterations={}, threshold={}, backend={})",
                targets.size(), properties.getMaxIterations(), properties.getQualityThreshold(),
                backend != null ? "enabled" : "disabled");
        return handle;
    }
}
