package com.shoryokuka.infrastructure.generation.loop;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.GenerationRun;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionResult;
import com.shoryokuka.domain.plan.model.ValidationResult;
import com.shoryokuka.infrastructure.generation.validation.DefectDetector;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of a running generation. {@link #await()} blocks until every section is terminal,
 * then runs the whole-document pass; {@link #cancel()} stops sections that are still working.
 */
@Slf4j
public class RunHandle {

    private final FactModel fact;
    private final DefectDetector detector;
    private final Map<SectionId, SectionTask> tasks = new LinkedHashMap<>();
    private final Map<SectionId, Future<SectionResult>> futures = new LinkedHashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    RunHandle(FactModel fact, DefectDetector detector) {
        this.fact = fact;
        this.detector = detector;
    }

    void add(SectionId sectionId, SectionTask task, Future<SectionResult> future) {
        tasks.put(sectionId, task);
        futures.put(sectionId, future);
    }

    /**
     * Cancel the run. Sections already accepted or exhausted keep their result; the others
     * end CANCELLED with their best text so far. The document pass is skipped.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancelling generation run ({} sections)", futures.size());
            futures.values().forEach(future -> future.cancel(true));
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public GenerationRun await() {
        Map<SectionId, SectionResult> results = new LinkedHashMap<>();
        for (SectionId sectionId : futures.keySet()) {
            results.put(sectionId, collect(sectionId));
        }

        if (cancelled.get()) {
            return new GenerationRun(fact, results, null, List.of(), true);
        }

        GenerationRun partial = new GenerationRun(fact, results, null, List.of(), false);
        ValidationResult document = detector.validateDocument(partial.finalizedTexts());
        if (!document.issues().isEmpty()) {
            log.info("Document pass found {} residual issues (score={})", document.issues().size(), document.score());
        }
        return new GenerationRun(fact, results, document, document.issues(), false);
    }

    private SectionResult collect(SectionId sectionId) {
        try {
            return futures.get(sectionId).get();
        } catch (CancellationException e) {
            return tasks.get(sectionId).cancelledResult();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return tasks.get(sectionId).cancelledResult();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("Section {} failed unexpectedly", sectionId.code(), cause);
            return SectionResult.failed(sectionId, "INTERNAL_ERROR", String.valueOf(cause.getMessage()));
        }
    }
}
