package com.shoryokuka.infrastructure.generation.synthesis;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import org.springframework.stereotype.Component;

import static com.shoryokuka.domain.plan.model.FactField.*;

/**
 * 1-1 現状分析: company profile, revenue trend, recruitment difficulty.
 */
@Component
public class CurrentAnalysisComposer extends AbstractSectionComposer {

    @Override
    public SectionId sectionId() {
        return SectionId.CURRENT_ANALYSIS;
    }

    @Override
    public String compose(String slotName, FactModel fact, SectionTemplate template) {
        return switch (slotName) {
            case "overview" -> overview(fact);
            case "performance" -> performance(fact);
            case "shortage" -> shortage(fact);
            case "conclusion" -> "このように、人手が足りない中で品質を保ちながら需要に応えるには、"
                    + fmt(fact, SHORTAGE_TASKS) + "の省力化が欠かせない経営課題である。";
            default -> throw unknownSlot(slotName);
        };
    }

    private String overview(FactModel fact) {
        StringBuilder sb = new StringBuilder();
        sb.append("当社").append(fmt(fact, COMPANY_NAME)).append("は、");
        if (fact.has(ESTABLISHED_DATE)) {
            sb.append(fmt(fact, ESTABLISHED_DATE)).append("の設立以来、");
        }
        sb.append(fmt(fact, PREFECTURE)).append("を拠点として")
                .append(fmt(fact, INDUSTRY)).append("を営む企業である。");
        sb.append("主たる事業は").append(fmt(fact, BUSINESS_DESCRIPTION)).append("であり、");
        if (fact.has(OFFICER_COUNT)) {
            sb.append("役員").append(fmt(fact, OFFICER_COUNT)).append("名、");
        }
        sb.append("従業員").append(fmt(fact, EMPLOYEE_COUNT)).append("名の体制で運営している。");
        return sb.toString();
    }

    private String performance(FactModel fact) {
        StringBuilder sb = new StringBuilder();
        sb.append("その背景には、").append(fmt(fact, INDUSTRY)).append("に対する堅調な需要がある。");
        sb.append("売上高は2022年度").append(fmt(fact, REVENUE_2022))
                .append("円、2023年度").append(fmt(fact, REVENUE_2023))
                .append("円、2024年度").append(fmt(fact, REVENUE_2024))
                .append("円と推移した。");
        if (fact.has(OPERATING_PROFIT_2024)) {
            sb.append("2024年度の営業利益は").append(fmt(fact, OPERATING_PROFIT_2024))
                    .append("円を確保しており、技術力と顧客からの信頼が数字に表れている。");
        }
        return sb.toString();
    }

    private String shortage(FactModel fact) {
        StringBuilder sb = new StringBuilder();
        sb.append("具体的には、").append(fmt(fact, RECRUITMENT_PERIOD))
                .append("にわたり求人を出し続けたものの、応募者は").append(fmt(fact, APPLICATIONS))
                .append("名にとどまり、採用できたのは").append(fmt(fact, HIRED)).append("名であった。");
        if (fact.has(JOB_OPENINGS_RATIO)) {
            String scope = fact.has(INDUSTRY) ? fmt(fact, INDUSTRY) : "地域";
            sb.append(scope).append("の有効求人倍率は").append(fmt(fact, JOB_OPENINGS_RATIO))
                    .append("倍と高く、人材の確保は年々難しくなっている。");
        }
        return sb.toString();
    }
}
