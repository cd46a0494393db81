package com.shoryokuka.infrastructure.generation.synthesis;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import org.springframework.stereotype.Component;

import static com.shoryokuka.domain.plan.model.FactField.*;

/**
 * 3-1 付加価値額の向上と賃上げ. Quotes the plan parameters verbatim so the reader can
 * recompute the projection.
 */
@Component
public class ProductivityComposer extends AbstractSectionComposer {

    static final int PLAN_YEARS = 5;

    @Override
    public SectionId sectionId() {
        return SectionId.PRODUCTIVITY;
    }

    @Override
    public String compose(String slotName, FactModel fact, SectionTemplate template) {
        return switch (slotName) {
            case "target" -> "本事業の実施により、当社は付加価値額を年率"
                    + num(new PlanFigures(fact).growthPercent()) + "%以上のペースで伸ばすことを目指す。";
            case "basis" -> basis(fact);
            case "projection" -> projection(fact);
            case "wage" -> wage(fact);
            default -> throw unknownSlot(slotName);
        };
    }

    private String basis(FactModel fact) {
        PlanFigures figures = new PlanFigures(fact);
        return "その根拠は、省力化によって対応できる案件が増え、営業利益の伸びが見込めることにある。"
                + "計画では営業利益が毎年" + fmt(fact, GROWTH_RATE) + "倍で伸びると置き、賃金水準は時給"
                + fmt(fact, HOURLY_WAGE) + "円を前提に試算した。"
                + "直近の2024年度における付加価値額（営業利益＋人件費＋減価償却費）は約"
                + num(figures.addedValue()) + "円である。";
    }

    private String projection(FactModel fact) {
        PlanFigures figures = new PlanFigures(fact);
        StringBuilder sb = new StringBuilder("具体的には、5年間の付加価値額の推移を次のように見込む。");
        sb.append("\n・基準年度：約").append(num(figures.addedValue(0))).append("円");
        for (int year = 1; year <= PLAN_YEARS; year++) {
            sb.append("\n・").append(year).append("年目：約").append(num(figures.addedValue(year))).append("円");
        }
        return sb.toString();
    }

    private String wage(FactModel fact) {
        StringBuilder sb = new StringBuilder();
        sb.append("したがって、生産性向上で得た利益の一部を原資として、1人当たり給与支給総額の年平均成長率")
                .append(num(new PlanFigures(fact).salaryGrowthPercent())).append("%以上を達成する。");
        if (fact.has(WAGE_INCREASE_RATE)) {
            sb.append("賃上げ率は").append(fmt(fact, WAGE_INCREASE_RATE)).append("%を計画している。");
        }
        if (fact.has(PREFECTURE)) {
            sb.append("事業場内最低賃金は、").append(fmt(fact, PREFECTURE))
                    .append("の地域別最低賃金を30円以上上回る水準に保つ。");
        }
        return sb.toString();
    }
}
