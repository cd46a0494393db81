package com.shoryokuka.interfaces.api.plan;

import com.shoryokuka.application.plan.PlanGenerationAppService;
import com.shoryokuka.application.plan.PlanGenerationResult;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.interfaces.api.dto.HearingSheetRequest;
import com.shoryokuka.interfaces.api.dto.PlanGenerationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/plans")
@RequiredArgsConstructor
public class PlanGenerationController {

    private final PlanGenerationAppService planGenerationAppService;

    @PostMapping("/generate")
    public ResponseEntity<PlanGenerationResponse> generate(@Valid @RequestBody HearingSheetRequest request) {
        List<SectionId> sectionIds = PlanGenerationAppService.parseSectionCodes(request.sections());

        PlanGenerationResult result = planGenerationAppService.generate(request.toFactModel(), sectionIds);

        return ResponseEntity.ok(PlanGenerationResponse.from(result));
    }
}
