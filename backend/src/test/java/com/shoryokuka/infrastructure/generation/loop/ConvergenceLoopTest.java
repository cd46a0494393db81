package com.shoryokuka.infrastructure.generation.loop;

import com.shoryokuka.domain.plan.exception.BackendUnavailableException;
import com.shoryokuka.domain.plan.model.FactField;
import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.GenerationRun;
import com.shoryokuka.domain.plan.model.IssueCategory;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionResult;
import com.shoryokuka.domain.plan.model.SectionStatus;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import com.shoryokuka.domain.plan.service.TextGenerationBackend;
import com.shoryokuka.infrastructure.generation.repair.FactGuard;
import com.shoryokuka.infrastructure.generation.synthesis.FactFormatter;
import com.shoryokuka.infrastructure.generation.template.TemplateRegistry;
import com.shoryokuka.infrastructure.generation.validation.RubricLoader;
import com.shoryokuka.infrastructure.generation.validation.TextSegmenter;
import com.shoryokuka.support.PlanFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConvergenceLoopTest {

    private ExecutorService executor;
    private GenerationProperties properties;

    @BeforeEach
    void setUp() {
        executor = new GenerationConfig().sectionExecutor(new GenerationProperties());
        properties = new GenerationProperties();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ConvergenceLoop loop(TextGenerationBackend backend) {
        return new ConvergenceLoop(new TemplateRegistry(), PlanFixtures.synthesizer(),
                new RubricLoader(new DefaultResourceLoader()), properties, executor, Optional.ofNullable(backend));
    }

    @Test
    @DisplayName("全セクションが終了状態になり、文書全体の検査が付く")
    void 全セクションを処理する() {
        FactModel fact = PlanFixtures.fullFacts().build();
        GenerationRun run = loop(null).run(fact, Arrays.asList(SectionId.values()));

        assertThat(run.sections()).hasSize(SectionId.values().length);
        assertThat(run.sections().keySet()).containsExactly(SectionId.values());
        for (SectionResult result : run.sections().values()) {
            assertThat(result.status()).isIn(SectionStatus.ACCEPTED, SectionStatus.EXHAUSTED);
            assertThat(result.iterations()).isBetween(0, properties.getMaxIterations());
            assertThat(result.scoreHistory()).hasSize(result.iterations() + 1);
            assertThat(result.draft().isFrozen()).isTrue();
        }
        assertThat(run.documentValidation()).isNotNull();
        assertThat(run.residualIssues()).isEqualTo(run.documentValidation().issues());
        assertThat(run.cancelled()).isFalse();

        TemplateRegistry registry = new TemplateRegistry();
        for (SectionResult result : run.sections().values()) {
            SectionTemplate template = registry.get(result.sectionId(), fact.industryTag());
            Set<String> allowed = new HashSet<>(FactGuard.numbers(
                    PlanFixtures.synthesizer().synthesize(fact, template).text()));
            allowed.addAll(FactFormatter.numericTokens(fact));
            assertThat(FactGuard.numbers(result.text()))
                    .as("numbers of %s", result.sectionId())
                    .isSubsetOf(allowed);
        }
    }

    @Test
    @DisplayName("複数段落の入力値でも段落数はスロット数に一致する")
    void 入力値の空行は段落を増やさない() {
        FactModel fact = PlanFixtures.fullFacts()
                .text(FactField.BUSINESS_DESCRIPTION, "木造住宅の新築工事\n\nリフォーム工事")
                .build();

        SectionResult result = loop(null).run(fact, List.of(SectionId.CURRENT_ANALYSIS))
                .section(SectionId.CURRENT_ANALYSIS);

        SectionTemplate template = new TemplateRegistry().get(SectionId.CURRENT_ANALYSIS, fact.industryTag());
        assertThat(result.status()).isIn(SectionStatus.ACCEPTED, SectionStatus.EXHAUSTED);
        assertThat(TextSegmenter.paragraphs(result.text())).hasSize(template.slotCount());
        assertThat(result.validation().issues())
                .noneMatch(issue -> issue.category() == IssueCategory.STRUCTURAL_DRIFT);
    }

    @Test
    void 重複したセクション指定は一度だけ処理する() {
        GenerationRun run = loop(null).run(PlanFixtures.fullFacts().build(),
                List.of(SectionId.EFFECT, SectionId.CURRENT_ANALYSIS, SectionId.EFFECT));

        assertThat(run.sections().keySet()).containsExactly(SectionId.EFFECT, SectionId.CURRENT_ANALYSIS);
    }

    @Test
    @DisplayName("直せない欠陥は3回修正した時点で打ち切る")
    void 修正予算を使い切ると打ち切り() {
        properties.setQualityThreshold(0.95);
        FactModel fact = PlanFixtures.fullFacts()
                .text(FactField.EQUIPMENT_FEATURES, "図面データを99.12345の精度で解析する")
                .build();

        SectionResult result = loop(null).run(fact, List.of(SectionId.BEFORE_AFTER)).section(SectionId.BEFORE_AFTER);

        assertThat(result.status()).isEqualTo(SectionStatus.EXHAUSTED);
        assertThat(result.iterations()).isEqualTo(3);
        assertThat(result.scoreHistory()).hasSize(4).allMatch(score -> score < 0.95);
        assertThat(result.score()).isEqualTo(result.scoreHistory().stream().mapToDouble(Double::doubleValue).max().orElseThrow());
        assertThat(result.text()).contains("99.12345");
    }

    @Nested
    @DisplayName("セクション単位の失敗")
    class Failures {

        @Test
        void 必須項目の欠落は該当セクションだけ失敗させる() {
            FactModel fact = PlanFixtures.fullFacts().build();
            FactModel withoutWage = FactModel.builder()
                    .text(FactField.COMPANY_NAME, fact.text(FactField.COMPANY_NAME))
                    .text(FactField.INDUSTRY, fact.text(FactField.INDUSTRY))
                    .text(FactField.PREFECTURE, fact.text(FactField.PREFECTURE))
                    .text(FactField.BUSINESS_DESCRIPTION, fact.text(FactField.BUSINESS_DESCRIPTION))
                    .integer(FactField.EMPLOYEE_COUNT, fact.integer(FactField.EMPLOYEE_COUNT))
                    .integer(FactField.REVENUE_2022, fact.integer(FactField.REVENUE_2022))
                    .integer(FactField.REVENUE_2023, fact.integer(FactField.REVENUE_2023))
                    .integer(FactField.REVENUE_2024, fact.integer(FactField.REVENUE_2024))
                    .text(FactField.RECRUITMENT_PERIOD, fact.text(FactField.RECRUITMENT_PERIOD))
                    .integer(FactField.APPLICATIONS, fact.integer(FactField.APPLICATIONS))
                    .integer(FactField.HIRED, fact.integer(FactField.HIRED))
                    .text(FactField.SHORTAGE_TASKS, fact.text(FactField.SHORTAGE_TASKS))
                    .decimal(FactField.REDUCTION_HOURS, fact.decimal(FactField.REDUCTION_HOURS))
                    .integer(FactField.WORKING_DAYS_PER_MONTH, fact.integer(FactField.WORKING_DAYS_PER_MONTH))
                    .build();

            GenerationRun run = loop(null).run(withoutWage,
                    List.of(SectionId.CURRENT_ANALYSIS, SectionId.EFFECT));

            SectionResult effect = run.section(SectionId.EFFECT);
            assertThat(effect.status()).isEqualTo(SectionStatus.FAILED);
            assertThat(effect.errorCode()).isEqualTo("MISSING_FACT");
            assertThat(effect.errorMessage()).contains("plan.hourlyWage");
            assertThat(run.section(SectionId.CURRENT_ANALYSIS).status())
                    .isIn(SectionStatus.ACCEPTED, SectionStatus.EXHAUSTED);
            assertThat(run.finalizedTexts()).containsOnlyKeys(SectionId.CURRENT_ANALYSIS);
        }

        @Test
        void バックエンドが使えなければ該当セクションだけ失敗させる() {
            properties.setQualityThreshold(0.99);
            TextGenerationBackend unavailable = request -> {
                throw new BackendUnavailableException("generation backend down", null);
            };
            FactModel fact = PlanFixtures.fullFacts()
                    .text(FactField.EQUIPMENT_FEATURES, "既存の会計ソフトとのシームレスな連携")
                    .build();

            GenerationRun run = loop(unavailable).run(fact, List.of(SectionId.BEFORE_AFTER, SectionId.CURRENT_ANALYSIS));

            SectionResult beforeAfter = run.section(SectionId.BEFORE_AFTER);
            assertThat(beforeAfter.status()).isEqualTo(SectionStatus.FAILED);
            assertThat(beforeAfter.errorCode()).isEqualTo("BACKEND_UNAVAILABLE");
            assertThat(run.section(SectionId.CURRENT_ANALYSIS).status()).isNotEqualTo(SectionStatus.FAILED);
        }
    }

    @Test
    @DisplayName("キャンセルすると処理中のセクションは最良の下書きで終わる")
    void キャンセル() throws Exception {
        properties.setQualityThreshold(0.99);
        CountDownLatch entered = new CountDownLatch(1);
        TextGenerationBackend blocking = request -> {
            entered.countDown();
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackendUnavailableException("interrupted", e);
            }
            return request.input();
        };
        FactModel fact = PlanFixtures.fullFacts()
                .text(FactField.EQUIPMENT_FEATURES, "既存の会計ソフトとのシームレスな連携")
                .build();

        RunHandle handle = loop(blocking).start(fact, List.of(SectionId.BEFORE_AFTER));
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
        handle.cancel();
        GenerationRun run = handle.await();

        SectionResult result = run.section(SectionId.BEFORE_AFTER);
        assertThat(run.cancelled()).isTrue();
        assertThat(run.documentValidation()).isNull();
        assertThat(result.status()).isEqualTo(SectionStatus.CANCELLED);
        assertThat(result.text()).contains("シームレスな連携");
        assertThat(result.iterations()).isZero();
        assertThat(result.scoreHistory()).hasSize(1);
    }
}
