package com.shoryokuka.application.plan;

import com.shoryokuka.domain.plan.model.GenerationRun;

/**
 * A finished run together with the assembled document text.
 */
public record PlanGenerationResult(GenerationRun run, String document) {}
