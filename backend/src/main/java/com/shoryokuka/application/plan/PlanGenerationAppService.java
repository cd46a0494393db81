package com.shoryokuka.application.plan;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.GenerationRun;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionResult;
import com.shoryokuka.domain.plan.service.DocumentAssembler;
import com.shoryokuka.infrastructure.generation.loop.ConvergenceLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlanGenerationAppService {

    private final ConvergenceLoop convergenceLoop;
    private final DocumentAssembler documentAssembler;

    /**
     * Generate the requested sections and assemble the finalized ones.
     *
     * @param fact       hearing-sheet facts
     * @param sectionIds sections to generate; empty or null means every section
     */
    public PlanGenerationResult generate(FactModel fact, List<SectionId> sectionIds) {
        List<SectionId> targets = sectionIds == null || sectionIds.isEmpty()
                ? Arrays.asList(SectionId.values())
                : sectionIds;

        long start = System.currentTimeMillis();
        GenerationRun run = convergenceLoop.run(fact, targets);
        String document = documentAssembler.assemble(run.finalizedTexts());

        log.info("Plan generation finished in {}ms: {}", System.currentTimeMillis() - start, summary(run));
        return new PlanGenerationResult(run, document);
    }

    public static List<SectionId> parseSectionCodes(List<String> codes) {
        if (codes == null) {
            return List.of();
        }
        return codes.stream().map(SectionId::fromCode).toList();
    }

    private static String summary(GenerationRun run) {
        StringBuilder sb = new StringBuilder();
        for (SectionResult result : run.sections().values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(result.sectionId().code()).append('=').append(result.status())
                    .append("(score=").append(result.score())
                    .append(", iterations=").append(result.iterations()).append(')');
        }
        return sb.toString();
    }
}
