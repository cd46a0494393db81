package com.shoryokuka.infrastructure.assembly;

import com.shoryokuka.domain.plan.model.SectionId;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SectionTextAssemblerTest {

    private final SectionTextAssembler assembler = new SectionTextAssembler();

    @Test
    void 見出し付きで順に並べる() {
        Map<SectionId, String> sections = new LinkedHashMap<>();
        sections.put(SectionId.CURRENT_ANALYSIS, "本文A");
        sections.put(SectionId.PRODUCTIVITY, "本文B");

        assertThat(assembler.assemble(sections))
                .isEqualTo("【1-1 現状分析】\n本文A\n\n\n【3-1 付加価値額の向上と賃上げ】\n本文B");
    }

    @Test
    void セクションがなければ空文字() {
        assertThat(assembler.assemble(Map.of())).isEmpty();
    }
}
