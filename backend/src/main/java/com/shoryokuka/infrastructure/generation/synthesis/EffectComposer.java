package com.shoryokuka.infrastructure.generation.synthesis;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import org.springframework.stereotype.Component;

import static com.shoryokuka.domain.plan.model.FactField.*;

/**
 * 2-2 省力化投資により期待される効果.
 */
@Component
public class EffectComposer extends AbstractSectionComposer {

    @Override
    public SectionId sectionId() {
        return SectionId.EFFECT;
    }

    @Override
    public String compose(String slotName, FactModel fact, SectionTemplate template) {
        return switch (slotName) {
            case "effect" -> "本事業により、1日あたり" + fmt(fact, REDUCTION_HOURS)
                    + "時間の業務時間が生まれ、人件費と残業の両面で効果が見込める。";
            case "quantitative" -> quantitative(fact);
            case "qualitative" -> "その理由は、長時間労働が解消されると従業員の心身の負担が軽くなり、定着率の改善につながるからである。"
                    + "手作業の工程を設備に置き換えることで、ヒューマンエラーも起きにくくなる。"
                    + "安定した品質を提供できれば、取引先からの信頼も厚くなっていく。";
            case "utilization" -> "このように、創出した時間を"
                    + (fact.has(TIME_UTILIZATION_PLAN) ? fmt(fact, TIME_UTILIZATION_PLAN) : "新規顧客の開拓や付加価値の高いサービス")
                    + "に振り向けることで、売上の拡大と利益率の改善を同時に進められる。";
            default -> throw unknownSlot(slotName);
        };
    }

    private String quantitative(FactModel fact) {
        PlanFigures figures = new PlanFigures(fact);
        StringBuilder sb = new StringBuilder();
        sb.append("具体的には、月間で約").append(num(figures.monthlySavedHours())).append("時間の業務時間を創出できる。");
        sb.append("時給").append(fmt(fact, HOURLY_WAGE)).append("円で換算すると、年間約")
                .append(num(figures.annualSaving())).append("円相当の効果となる。");
        if (fact.has(OVERTIME_HOURS)) {
            sb.append("現状で月").append(fmt(fact, OVERTIME_HOURS))
                    .append("時間に達する残業が減れば、割増賃金の支出も抑えられる。");
        }
        return sb.toString();
    }
}
