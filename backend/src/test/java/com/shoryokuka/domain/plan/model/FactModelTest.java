package com.shoryokuka.domain.plan.model;

import com.shoryokuka.domain.plan.exception.MissingFactException;
import com.shoryokuka.domain.plan.exception.TemplateMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FactModelTest {

    @Nested
    @DisplayName("値の取得")
    class Access {

        @Test
        void 未入力の項目はMissingFactExceptionで項目キーを示す() {
            FactModel fact = FactModel.builder().text(FactField.COMPANY_NAME, "山田工務店").build();

            assertThatThrownBy(() -> fact.integer(FactField.HOURLY_WAGE))
                    .isInstanceOf(MissingFactException.class)
                    .hasMessageContaining("plan.hourlyWage")
                    .satisfies(e -> assertThat(((MissingFactException) e).getField()).isEqualTo(FactField.HOURLY_WAGE))
                    .satisfies(e -> assertThat(((MissingFactException) e).getErrorCode()).isEqualTo("MISSING_FACT"));
        }

        @Test
        void 種別の違う取得はIllegalArgumentException() {
            FactModel fact = FactModel.builder().integer(FactField.HOURLY_WAGE, 1200L).build();

            assertThatThrownBy(() -> fact.decimal(FactField.HOURLY_WAGE))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void 業種タグは未入力なら空文字() {
            assertThat(FactModel.builder().build().industryTag()).isEmpty();
            assertThat(FactModel.builder().text(FactField.INDUSTRY, "製造業").build().industryTag()).isEqualTo("製造業");
        }
    }

    @Nested
    @DisplayName("ビルダー")
    class Building {

        @Test
        void 空白だけのテキストは未入力扱い() {
            FactModel fact = FactModel.builder()
                    .text(FactField.COMPANY_NAME, "   ")
                    .text(FactField.PREFECTURE, "  愛知県 ")
                    .build();

            assertThat(fact.has(FactField.COMPANY_NAME)).isFalse();
            assertThat(fact.text(FactField.PREFECTURE)).isEqualTo("愛知県");
        }

        @Test
        void テキストの空行は一つの改行にまとめる() {
            FactModel fact = FactModel.builder()
                    .text(FactField.BUSINESS_DESCRIPTION, "木造住宅の新築工事\n\nリフォーム工事")
                    .text(FactField.MOTIVATION_BACKGROUND, "受注が増えている。\r\n \r\n\u3000\n人手が足りない。")
                    .build();

            assertThat(fact.text(FactField.BUSINESS_DESCRIPTION)).isEqualTo("木造住宅の新築工事\nリフォーム工事");
            assertThat(fact.text(FactField.MOTIVATION_BACKGROUND)).isEqualTo("受注が増えている。\n人手が足りない。");
        }

        @Test
        void 工程の説明の空行もまとめる() {
            ProcessStep step = new ProcessStep("拾い出し", "図面を読む。\n\n手で数える。", " 自動で集計する。 ", 60, 15);

            assertThat(step.beforeDescription()).isEqualTo("図面を読む。\n手で数える。");
            assertThat(step.afterDescription()).isEqualTo("自動で集計する。");
        }

        @Test
        void nullの数値と空の工程は未入力扱い() {
            FactModel fact = FactModel.builder()
                    .integer(FactField.HOURLY_WAGE, (Long) null)
                    .decimal(FactField.GROWTH_RATE, (BigDecimal) null)
                    .processSteps(List.of())
                    .build();

            assertThat(fact.availableFields()).isEmpty();
        }

        @Test
        void 構築後の値は変更できない() {
            FactModel fact = FactModel.builder().integer(FactField.HOURLY_WAGE, 1200L).build();

            assertThatThrownBy(() -> fact.availableFields().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Test
    void 未知の項目キーはテンプレート不整合() {
        assertThat(FactField.fromKey("plan.growthRate")).isEqualTo(FactField.GROWTH_RATE);
        assertThatThrownBy(() -> FactField.fromKey("plan.unknown"))
                .isInstanceOf(TemplateMismatchException.class);
    }
}
