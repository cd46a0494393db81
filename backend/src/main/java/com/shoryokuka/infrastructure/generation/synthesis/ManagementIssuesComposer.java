package com.shoryokuka.infrastructure.generation.synthesis;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import org.springframework.stereotype.Component;

import static com.shoryokuka.domain.plan.model.FactField.*;

/**
 * 1-2 経営上の課題.
 */
@Component
public class ManagementIssuesComposer extends AbstractSectionComposer {

    @Override
    public SectionId sectionId() {
        return SectionId.MANAGEMENT_ISSUES;
    }

    @Override
    public String compose(String slotName, FactModel fact, SectionTemplate template) {
        return switch (slotName) {
            case "issue" -> "当社が直面する最も深刻な経営課題は、慢性的な人手不足と、それに起因する"
                    + fmt(fact, SHORTAGE_TASKS) + "担当者の過重労働である。";
            case "staffing" -> staffing(fact);
            case "burden" -> "具体的には、" + fmt(fact, SHORTAGE_TASKS) + "は熟練者の経験と勘に頼っており、1日あたり"
                    + fmt(fact, CURRENT_HOURS) + "時間を要している。"
                    + "案件数が増えるほどこの作業に時間を取られ、ほかの業務に充てる時間が圧迫されてきた。";
            case "outlook" -> "したがって、採用難が続く以上、業務プロセスを見直して省力化を図る必要性は高まる一方である。";
            default -> throw unknownSlot(slotName);
        };
    }

    private String staffing(FactModel fact) {
        long gap = new PlanFigures(fact).workforceGap();
        StringBuilder sb = new StringBuilder();
        sb.append("その背景には、必要な人員と実際の人員との開きがある。");
        sb.append("現在この業務を担うのは").append(fmt(fact, CURRENT_WORKERS))
                .append("名だが、業務量に見合う人員は").append(fmt(fact, DESIRED_WORKERS)).append("名と見込んでおり、");
        if (gap > 0) {
            sb.append(num(gap)).append("名が足りない状態で業務を回している。");
        } else {
            sb.append("余裕のない人員配置で業務を回している。");
        }
        sb.append("不足分を補うため、現場では月平均").append(fmt(fact, OVERTIME_HOURS)).append("時間の残業が常態化した。");
        return sb.toString();
    }
}
