package com.shoryokuka.infrastructure.generation.repair;

import com.shoryokuka.domain.plan.model.FactField;
import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.ProcessStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FactGuardTest {

    private FactGuard guard;

    @BeforeEach
    void setUp() {
        FactModel fact = FactModel.builder()
                .integer(FactField.HOURLY_WAGE, 1200L)
                .decimal(FactField.GROWTH_RATE, new BigDecimal("1.150"))
                .processSteps(List.of(new ProcessStep("拾い出し", "手作業", "自動", 60, 15)))
                .build();
        guard = new FactGuard(fact);
    }

    @Test
    void 数値を落とす書き換えは拒否() {
        assertThat(guard.accepts("時給1,200円で試算した。", "時給で試算した。")).isFalse();
    }

    @Test
    void 事実にない数値を足す書き換えは拒否() {
        assertThat(guard.accepts("時給1,200円で試算した。", "時給1,200円、1日8時間で試算した。")).isFalse();
    }

    @Test
    void 事実の数値を足す書き換えは許可() {
        assertThat(guard.accepts("成長率を置いた。", "成長率を1.15倍と置いた。")).isTrue();
        assertThat(guard.accepts("短縮する。", "60分から15分へ短縮する。")).isTrue();
    }

    @Test
    void 数値を変えない言い換えは許可() {
        assertThat(guard.accepts("時給1,200円と言えるでしょう。", "時給1,200円といえる。")).isTrue();
    }

    @Test
    void 桁区切りと小数を1つの数値として扱う() {
        assertThat(FactGuard.numbers("売上340,000,000円、成長率1.15倍、3名")).containsExactly("340,000,000", "1.15", "3");
    }
}
