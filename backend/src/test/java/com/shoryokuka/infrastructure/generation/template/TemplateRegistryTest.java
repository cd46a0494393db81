package com.shoryokuka.infrastructure.generation.template;

import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import com.shoryokuka.domain.plan.model.SlotRole;
import com.shoryokuka.domain.plan.model.TemplateSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRegistryTest {

    private TemplateRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TemplateRegistry();
    }

    @ParameterizedTest
    @EnumSource(SectionId.class)
    @DisplayName("全セクションにPREP構成のテンプレートがある")
    void 全セクションのテンプレート(SectionId sectionId) {
        SectionTemplate template = registry.get(sectionId, "");

        assertThat(template.sectionId()).isEqualTo(sectionId);
        assertThat(template.slots()).isNotEmpty();
        assertThat(template.slot(0).role()).isEqualTo(SlotRole.ASSERTION);
        assertThat(template.slot(template.slotCount() - 1).role()).isEqualTo(SlotRole.RESTATEMENT);
        for (TemplateSlot slot : template.slots()) {
            assertThat(slot.band().min()).isLessThan(slot.band().max());
        }
    }

    @ParameterizedTest
    @CsvSource({
            "建設業, 建設",
            "金属製品製造業, 製造",
            "情報通信業, IT",
            "飲食店, 飲食",
            "介護事業, サービス",
            "小売業, 小売",
            "農業, default"
    })
    void 業種タグで工程テンプレートが選ばれる(String industry, String expectedKey) {
        SectionTemplate template = registry.get(SectionId.BEFORE_AFTER, industry);

        assertThat(template.processTemplate().industryKey()).isEqualTo(expectedKey);
        assertThat(template.processTemplate().steps()).isNotEmpty();
    }

    @Test
    void 生産性セクションは成長率と時給を必須にする() {
        SectionTemplate template = registry.get(SectionId.PRODUCTIVITY, "建設業");

        assertThat(template.slots())
                .filteredOn(slot -> slot.name().equals("basis"))
                .singleElement()
                .satisfies(slot -> assertThat(slot.requiredFacts())
                        .extracting(f -> f.key())
                        .contains("plan.growthRate", "plan.hourlyWage"));
    }
}
