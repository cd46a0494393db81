package com.shoryokuka.infrastructure.generation.synthesis;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.ProcessStep;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.shoryokuka.domain.plan.model.FactField.*;

/**
 * 2-1 業務プロセスの変化. Process steps come from the hearing sheet when it has them,
 * otherwise from the industry process template bound to the section template.
 */
@Component
public class BeforeAfterComposer extends AbstractSectionComposer {

    @Override
    public SectionId sectionId() {
        return SectionId.BEFORE_AFTER;
    }

    @Override
    public String compose(String slotName, FactModel fact, SectionTemplate template) {
        List<ProcessStep> steps = steps(fact, template);
        return switch (slotName) {
            case "intro" -> fmt(fact, EQUIPMENT_NAME) + "の導入により、" + fmt(fact, SHORTAGE_TASKS)
                    + "の業務プロセスは手作業中心の流れから設備を活用した流れへ切り替わる。";
            case "before" -> before(steps);
            case "after" -> after(steps);
            case "mechanism" -> mechanism(fact, steps);
            case "summary" -> summary(fact);
            default -> throw unknownSlot(slotName);
        };
    }

    static List<ProcessStep> steps(FactModel fact, SectionTemplate template) {
        if (fact.has(PROCESS_STEPS)) {
            return fact.processSteps();
        }
        return template.processTemplate().steps();
    }

    private String before(List<ProcessStep> steps) {
        StringBuilder sb = new StringBuilder("具体的には、導入前の工程と所要時間は次のとおりである。");
        for (ProcessStep step : steps) {
            sb.append("\n・「").append(step.name()).append("」").append(step.beforeDescription())
                    .append("：").append(num(step.beforeMinutes())).append("分");
        }
        sb.append("\n合計すると1サイクルあたり").append(num(PlanFigures.beforeTotal(steps))).append("分を要している。");
        return sb.toString();
    }

    private String after(List<ProcessStep> steps) {
        int saved = PlanFigures.beforeTotal(steps) - PlanFigures.afterTotal(steps);
        StringBuilder sb = new StringBuilder("実際に、導入後は各工程が次のように変わる。");
        for (ProcessStep step : steps) {
            sb.append("\n・「").append(step.name()).append("」").append(step.afterDescription())
                    .append("：").append(num(step.afterMinutes())).append("分");
        }
        sb.append("\n導入後の合計は").append(num(PlanFigures.afterTotal(steps))).append("分となり、")
                .append(num(saved)).append("分の短縮、削減率にして")
                .append(num(PlanFigures.reductionPercent(steps))).append("%の省力化となる。");
        return sb.toString();
    }

    private String mechanism(FactModel fact, List<ProcessStep> steps) {
        StringBuilder sb = new StringBuilder();
        sb.append("その根拠は、").append(fmt(fact, EQUIPMENT_NAME)).append("が備える")
                .append(fmt(fact, EQUIPMENT_FEATURES)).append("という機能にある。");
        if (!steps.isEmpty()) {
            ProcessStep biggest = PlanFigures.biggestSaving(steps);
            sb.append("最も効果が大きい「").append(biggest.name()).append("」工程では、")
                    .append(biggest.beforeDescription()).append("に").append(num(biggest.beforeMinutes()))
                    .append("分を要していたが、").append(biggest.afterDescription()).append("により")
                    .append(num(biggest.afterMinutes())).append("分まで縮まる。");
        }
        return sb.toString();
    }

    private String summary(FactModel fact) {
        StringBuilder sb = new StringBuilder();
        sb.append("以上のとおり、従業員は定型的な作業から解放され、顧客対応や品質管理に時間を振り向けられる。");
        sb.append("1日あたりの削減時間は").append(fmt(fact, REDUCTION_HOURS)).append("時間であり、");
        if (fact.has(WORKING_DAYS_PER_MONTH)) {
            sb.append("月間では約").append(num(new PlanFigures(fact).monthlySavedHours()))
                    .append("時間の業務時間を生み出せる。");
        } else {
            sb.append("その分を人の判断が要る業務に回せる。");
        }
        return sb.toString();
    }
}
