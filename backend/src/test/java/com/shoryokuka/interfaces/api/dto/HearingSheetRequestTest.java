package com.shoryokuka.interfaces.api.dto;

import com.shoryokuka.domain.plan.model.FactField;
import com.shoryokuka.domain.plan.model.FactModel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HearingSheetRequestTest {

    private static HearingSheetRequest request(BigDecimal currentHours, BigDecimal targetHours,
                                               BigDecimal growthRate, Long hourlyWage,
                                               List<HearingSheetRequest.ProcessStepRequest> steps) {
        return new HearingSheetRequest(
                "株式会社山田工務店", "建設業", "愛知県", null, "木造住宅の新築", null, 18L,
                null, null, 340_000_000L, 18_000_000L, null, null,
                "見積書作成", "2年間", 3L, 1L, null, 4L, 6L, null,
                currentHours, targetHours, null, null,
                "積算見積システム", "数量を自動で拾い出す", 8_000_000L,
                growthRate, null, hourlyWage, null,
                null, null, null,
                steps, null);
    }

    @Test
    void 計画パラメータの既定値を補う() {
        FactModel fact = request(null, null, null, 1200L, null).toFactModel();

        assertThat(fact.decimal(FactField.GROWTH_RATE)).isEqualByComparingTo("1.05");
        assertThat(fact.decimal(FactField.SALARY_GROWTH_RATE)).isEqualByComparingTo("1.025");
        assertThat(fact.integer(FactField.WORKING_DAYS_PER_MONTH)).isEqualTo(22L);
        assertThat(fact.integer(FactField.HOURLY_WAGE)).isEqualTo(1200L);
    }

    @Test
    void 時給には既定値を置かない() {
        FactModel fact = request(null, null, new BigDecimal("1.15"), null, null).toFactModel();

        assertThat(fact.has(FactField.HOURLY_WAGE)).isFalse();
        assertThat(fact.decimal(FactField.GROWTH_RATE)).isEqualByComparingTo("1.15");
    }

    @Test
    void 削減時間と削減率を現状と目標から求める() {
        FactModel fact = request(new BigDecimal("6"), new BigDecimal("2.5"), null, 1200L, null).toFactModel();

        assertThat(fact.decimal(FactField.REDUCTION_HOURS)).isEqualByComparingTo("3.5");
        assertThat(fact.decimal(FactField.REDUCTION_RATE)).isEqualByComparingTo("58.3");
    }

    @Test
    void 工程をドメインの工程に変換する() {
        FactModel fact = request(null, null, null, 1200L, List.of(
                new HearingSheetRequest.ProcessStepRequest("拾い出し", "手作業", "自動", 60, 15)))
                .toFactModel();

        assertThat(fact.processSteps()).hasSize(1);
        assertThat(fact.processSteps().get(0).savedMinutes()).isEqualTo(45);
        assertThat(fact.has(FactField.OFFICER_COUNT)).isFalse();
    }
}
