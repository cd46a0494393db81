package com.shoryokuka.infrastructure.generation.validation;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.IssueCategory;
import com.shoryokuka.domain.plan.model.LengthBand;
import com.shoryokuka.domain.plan.model.ProcessTemplate;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import com.shoryokuka.domain.plan.model.SlotRole;
import com.shoryokuka.domain.plan.model.TemplateSlot;
import com.shoryokuka.domain.plan.model.ValidationIssue;
import com.shoryokuka.domain.plan.model.ValidationIssue.Severity;
import com.shoryokuka.domain.plan.model.ValidationResult;
import com.shoryokuka.infrastructure.generation.synthesis.SectionSynthesizer;
import com.shoryokuka.infrastructure.generation.template.TemplateRegistry;
import com.shoryokuka.support.PlanFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DefectDetectorTest {

    private DefectDetector detector;

    @BeforeEach
    void setUp() {
        detector = new DefectDetector(PlanFixtures.rubric());
    }

    private static SectionTemplate template(TemplateSlot... slots) {
        return new SectionTemplate(SectionId.CURRENT_ANALYSIS, List.of(slots), new ProcessTemplate("default", List.of()));
    }

    private static TemplateSlot slot(SlotRole role, int min, int max) {
        return new TemplateSlot(role.name().toLowerCase(), role, new LengthBand(min, max), List.of(), List.of());
    }

    private ValidationResult validateSingle(String text) {
        return detector.validate(text, template(slot(SlotRole.ASSERTION, 5, 500)));
    }

    @Nested
    @DisplayName("規則1: 構造の崩れ")
    class Structure {

        @Test
        void 段落数がスロット数と違えばERROR() {
            ValidationResult result = validateSingle("当社は建設業を営む。\n\n売上は伸びている。");

            assertThat(result.hasStructuralDrift()).isTrue();
            assertThat(result.errors()).anyMatch(i -> i.ruleId().equals(DefectDetector.RULE_SLOT_COUNT));
        }

        @Test
        void 役割の書き出しが違えばERROR() {
            SectionTemplate template = template(
                    slot(SlotRole.ASSERTION, 5, 500),
                    slot(SlotRole.JUSTIFICATION, 5, 500));

            ValidationResult result = detector.validate("当社は建設業を営む。\n\n具体的には、売上が伸びている。", template);

            assertThat(result.errors())
                    .singleElement()
                    .satisfies(issue -> {
                        assertThat(issue.ruleId()).isEqualTo(DefectDetector.RULE_ROLE_ORDER);
                        assertThat(issue.slotIndex()).isEqualTo(1);
                    });
        }

        @Test
        void 空のスロットはERROR() {
            SectionTemplate template = template(
                    slot(SlotRole.ASSERTION, 5, 500),
                    slot(SlotRole.RESTATEMENT, 5, 500));

            ValidationResult result = detector.validate("当社は建設業を営む。\n\n  ", template);

            assertThat(result.errors()).anyMatch(i -> i.ruleId().equals(DefectDetector.RULE_EMPTY_SLOT));
        }

        @Test
        void 穴あき表現は構造の崩れとして検出() {
            ValidationResult result = validateSingle("当社は〇〇市で建設業を営み、売上はNone円である。");

            assertThat(result.issuesOf(IssueCategory.STRUCTURAL_DRIFT))
                    .extracting(ValidationIssue::ruleId)
                    .containsExactly("hole.placeholder", "hole.null-value");
        }
    }

    @Nested
    @DisplayName("規則2: 文字数")
    class Length {

        @Test
        void 下限を下回ればWARNING() {
            ValidationResult result = detector.validate("当社は建設業。", template(slot(SlotRole.ASSERTION, 40, 200)));

            assertThat(result.issuesOf(IssueCategory.LENGTH_VIOLATION))
                    .singleElement()
                    .satisfies(issue -> {
                        assertThat(issue.severity()).isEqualTo(Severity.WARNING);
                        assertThat(issue.ruleId()).isEqualTo(DefectDetector.RULE_TOO_SHORT);
                    });
        }

        @Test
        void 空白は文字数に数えない() {
            String text = "当社は　建設業を\n営む 企業である。";

            assertThat(TextSegmenter.visibleLength(text)).isEqualTo(15);
            assertThat(detector.validate(text, template(slot(SlotRole.ASSERTION, 15, 15))).issues()).isEmpty();
        }
    }

    @Nested
    @DisplayName("規則3: 汎用表現")
    class GenericPhrases {

        @Test
        void 出現ごとに1件検出() {
            ValidationResult result = validateSingle("当社は様々な工事を請け負い、様々な顧客を持つ。");

            assertThat(result.issuesOf(IssueCategory.GENERIC_PHRASE)).hasSize(2)
                    .allMatch(i -> "様々な".equals(i.matchedText()));
            assertThat(result.score()).isEqualTo(0.9);
        }
    }

    @Nested
    @DisplayName("規則4: 繰り返し")
    class Repetition {

        @Test
        void 同じ書き出しが3回続けば検出され減点される() {
            ValidationResult result = validateSingle("当社は木材加工を行っている。当社は愛知県にある。当社は従業員を募集している。");

            assertThat(result.issuesOf(IssueCategory.REPETITION))
                    .singleElement()
                    .satisfies(issue -> {
                        assertThat(issue.ruleId()).isEqualTo(DefectDetector.RULE_OPENING);
                        assertThat(issue.matchedText()).isEqualTo("当社は");
                    });
            assertThat(result.score()).isLessThan(1.0).isEqualTo(0.92);
        }

        @Test
        void 同じ文の重複を検出() {
            ValidationResult result = validateSingle("受注は年々増え続けている。工期も厳しい。受注は年々増え続けている。");

            assertThat(result.issuesOf(IssueCategory.REPETITION))
                    .anyMatch(i -> i.ruleId().equals(DefectDetector.RULE_DUPLICATE));
        }

        @Test
        void 同じ文末が3文続けば検出() {
            ValidationResult result = validateSingle("職人は現場に出ている。事務員は電話を受けている。社長は見積を作っている。");

            assertThat(result.issuesOf(IssueCategory.REPETITION))
                    .singleElement()
                    .satisfies(issue -> assertThat(issue.ruleId()).isEqualTo(DefectDetector.RULE_ENDING_RUN));
        }

        @Test
        void 箇条書きの行は対象外() {
            String text = "具体的には、次の工程がある。\n・「拾い出し」手作業：60分\n・「拾い出し」手作業：60分\n・「拾い出し」手作業：60分";

            ValidationResult result = detector.validate(text, template(slot(SlotRole.ILLUSTRATION, 5, 500)));

            assertThat(result.issuesOf(IssueCategory.REPETITION)).isEmpty();
        }
    }

    @Nested
    @DisplayName("規則5: 不自然な表現")
    class UnnaturalPatterns {

        @Test
        void カタログの表現を検出() {
            ValidationResult result = validateSingle("本設備の導入は当社にとって有益と言えるでしょう。");

            assertThat(result.issuesOf(IssueCategory.UNNATURAL_PATTERN))
                    .singleElement()
                    .satisfies(issue -> assertThat(issue.ruleId()).isEqualTo("unnatural.hedge-ieru"));
        }

        @Test
        void 機械的な列挙は上限を超えた分だけ検出() {
            ValidationResult result = validateSingle("まず図面を読む。次に数量を拾う。さらに単価を入れる。最後に見積書を出す。");

            assertThat(result.issuesOf(IssueCategory.UNNATURAL_PATTERN))
                    .extracting(ValidationIssue::matchedText)
                    .containsExactly("さらに", "最後に");
        }
    }

    @Test
    void スコアは0未満にならない() {
        String text = "様々な様々な様々な様々な様々な様々な様々な様々な様々な様々な様々な様々な様々な様々な様々な様々な様々な様々な様々な様々な様々な。";

        assertThat(validateSingle(text).score()).isZero();
    }

    @Test
    void 同じ入力には常に同じ結果を返す() {
        String text = "当社は木材加工を行っている。当社は愛知県にある。当社は様々な従業員を募集している。";

        ValidationResult first = validateSingle(text);
        ValidationResult second = validateSingle(text);

        assertThat(second).isEqualTo(first);
    }

    @Nested
    @DisplayName("文書全体の検査")
    class DocumentPass {

        @Test
        void セクションをまたぐ同一文を検出() {
            Map<SectionId, String> sections = new LinkedHashMap<>();
            sections.put(SectionId.CURRENT_ANALYSIS, "人手不足が経営を圧迫している。");
            sections.put(SectionId.MANAGEMENT_ISSUES, "人手不足が経営を圧迫している。");

            ValidationResult result = detector.validateDocument(sections);

            assertThat(result.issues())
                    .singleElement()
                    .satisfies(issue -> {
                        assertThat(issue.ruleId()).isEqualTo(DefectDetector.RULE_DOCUMENT_DUPLICATE);
                        assertThat(issue.location().sectionId()).isEqualTo(SectionId.MANAGEMENT_ISSUES);
                    });
        }

        @Test
        void 文書全体で同じ書き出しが上限を超えれば検出() {
            Map<SectionId, String> sections = new LinkedHashMap<>();
            sections.put(SectionId.CURRENT_ANALYSIS, "当社はA。当社はB。当社はC。当社はD。");
            sections.put(SectionId.MANAGEMENT_ISSUES, "当社はE。当社はF。当社はG。");

            ValidationResult result = detector.validateDocument(sections);

            assertThat(result.issues())
                    .singleElement()
                    .satisfies(issue -> assertThat(issue.ruleId()).isEqualTo(DefectDetector.RULE_DOCUMENT_OPENING));
        }
    }

    @Nested
    @DisplayName("生成された本文の検査")
    class ComposedText {

        private final SectionSynthesizer synthesizer = PlanFixtures.synthesizer();
        private final TemplateRegistry registry = new TemplateRegistry();
        private final FactModel fact = PlanFixtures.fullFacts().build();

        @ParameterizedTest
        @EnumSource(SectionId.class)
        void 生成直後の本文に構造の崩れはない(SectionId sectionId) {
            SectionTemplate template = registry.get(sectionId, fact.industryTag());

            ValidationResult result = detector.validate(synthesizer.synthesize(fact, template).text(), template);

            assertThat(result.hasStructuralDrift()).as(result.issues().toString()).isFalse();
        }

        @ParameterizedTest
        @EnumSource(SectionId.class)
        void 再検査しても結果は変わらない(SectionId sectionId) {
            SectionTemplate template = registry.get(sectionId, fact.industryTag());
            String text = synthesizer.synthesize(fact, template).text();

            assertThat(detector.validate(text, template)).isEqualTo(detector.validate(text, template));
        }
    }
}
