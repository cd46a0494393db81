package com.shoryokuka.infrastructure.generation.synthesis;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import org.springframework.stereotype.Component;

import static com.shoryokuka.domain.plan.model.FactField.*;

/**
 * 1-3 省力化補助金活用の動機・目的.
 */
@Component
public class MotivationComposer extends AbstractSectionComposer {

    @Override
    public SectionId sectionId() {
        return SectionId.MOTIVATION;
    }

    @Override
    public String compose(String slotName, FactModel fact, SectionTemplate template) {
        return switch (slotName) {
            case "decision" -> decision(fact);
            case "purpose" -> purpose(fact);
            case "utilization" -> utilization(fact);
            case "closing" -> "このように、本補助金を活用して経営基盤を強化し、人手に頼り切らない持続的な成長を実現したい。";
            default -> throw unknownSlot(slotName);
        };
    }

    private String decision(FactModel fact) {
        String text = "上記の経営課題を解決するため、当社は" + fmt(fact, EQUIPMENT_NAME) + "の導入を決断した。";
        if (fact.has(MOTIVATION_BACKGROUND)) {
            text += "決断の背景には、" + fmt(fact, MOTIVATION_BACKGROUND) + "という事情がある。";
        }
        return text;
    }

    private String purpose(FactModel fact) {
        StringBuilder sb = new StringBuilder();
        sb.append("その理由は、").append(fmt(fact, SHORTAGE_TASKS))
                .append("の作業時間を削減し、従業員の過重労働を解消することにある。");
        sb.append("現在1日あたり").append(fmt(fact, CURRENT_HOURS)).append("時間を要している作業を、本設備により")
                .append(fmt(fact, TARGET_HOURS)).append("時間まで短縮し、作業時間を")
                .append(fmt(fact, REDUCTION_RATE)).append("%削減する。");
        if (fact.has(OVERTIME_HOURS)) {
            sb.append("これにより、月").append(fmt(fact, OVERTIME_HOURS)).append("時間に及ぶ残業の圧縮を見込んでいる。");
        }
        return sb.toString();
    }

    private String utilization(FactModel fact) {
        String first = fact.has(TIME_UTILIZATION_PLAN)
                ? "具体的には、省力化で生まれた時間を" + fmt(fact, TIME_UTILIZATION_PLAN) + "に充てる計画である。"
                : "具体的には、省力化で生まれた時間を付加価値の高い業務に充てる。";
        return first + "従業員が本来の専門性を発揮できる環境を整え、サービス品質と売上の向上につなげていく。";
    }
}
