package com.shoryokuka.infrastructure.generation.template;

import com.shoryokuka.domain.plan.exception.TemplateMismatchException;
import com.shoryokuka.domain.plan.model.FactField;
import com.shoryokuka.domain.plan.model.LengthBand;
import com.shoryokuka.domain.plan.model.ProcessTemplate;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import com.shoryokuka.domain.plan.model.SlotRole;
import com.shoryokuka.domain.plan.model.TemplateSlot;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.shoryokuka.domain.plan.model.SlotRole.ASSERTION;
import static com.shoryokuka.domain.plan.model.SlotRole.ILLUSTRATION;
import static com.shoryokuka.domain.plan.model.SlotRole.JUSTIFICATION;
import static com.shoryokuka.domain.plan.model.SlotRole.RESTATEMENT;

/**
 * Section templates of the business plan, one per {@link SectionId}.
 * Slot fact references are written as dotted keys and resolved against {@link FactField}
 * when the registry is built.
 */
@Component
public class TemplateRegistry {

    private final Map<SectionId, SectionTemplate> templates = new EnumMap<>(SectionId.class);

    public TemplateRegistry() {
        register(SectionId.CURRENT_ANALYSIS,
                slot("overview", ASSERTION, 40, 320,
                        req("company.name", "company.industry", "company.prefecture",
                                "company.businessDescription", "company.employeeCount"),
                        opt("company.establishedDate", "company.officerCount")),
                slot("performance", JUSTIFICATION, 50, 360,
                        req("company.industry", "company.revenue2022", "company.revenue2023", "company.revenue2024"),
                        opt("company.operatingProfit2024")),
                slot("shortage", ILLUSTRATION, 40, 320,
                        req("shortage.recruitmentPeriod", "shortage.applications", "shortage.hired"),
                        opt("shortage.jobOpeningsRatio", "company.industry")),
                slot("conclusion", RESTATEMENT, 30, 240,
                        req("shortage.tasks"),
                        opt()));

        register(SectionId.MANAGEMENT_ISSUES,
                slot("issue", ASSERTION, 30, 240,
                        req("shortage.tasks"),
                        opt()),
                slot("staffing", JUSTIFICATION, 60, 360,
                        req("shortage.currentWorkers", "shortage.desiredWorkers", "shortage.overtimeHours"),
                        opt()),
                slot("burden", ILLUSTRATION, 40, 300,
                        req("saving.currentHours", "shortage.tasks"),
                        opt()),
                slot("outlook", RESTATEMENT, 25, 240,
                        req(),
                        opt()));

        register(SectionId.MOTIVATION,
                slot("decision", ASSERTION, 20, 300,
                        req("equipment.name"),
                        opt("narrative.motivationBackground")),
                slot("purpose", JUSTIFICATION, 60, 360,
                        req("shortage.tasks", "saving.currentHours", "saving.targetHours", "saving.reductionRate"),
                        opt("shortage.overtimeHours")),
                slot("utilization", ILLUSTRATION, 30, 300,
                        req(),
                        opt("narrative.timeUtilizationPlan")),
                slot("closing", RESTATEMENT, 25, 200,
                        req(),
                        opt()));

        register(SectionId.BEFORE_AFTER,
                slot("intro", ASSERTION, 30, 240,
                        req("equipment.name", "shortage.tasks"),
                        opt()),
                slot("before", ILLUSTRATION, 40, 700,
                        req(),
                        opt("process.steps")),
                slot("after", ILLUSTRATION, 40, 700,
                        req(),
                        opt("process.steps")),
                slot("mechanism", JUSTIFICATION, 40, 400,
                        req("equipment.name", "equipment.features"),
                        opt("process.steps")),
                slot("summary", RESTATEMENT, 40, 300,
                        req("saving.reductionHours"),
                        opt("plan.workingDaysPerMonth")));

        register(SectionId.EFFECT,
                slot("effect", ASSERTION, 25, 240,
                        req("saving.reductionHours"),
                        opt()),
                slot("quantitative", ILLUSTRATION, 50, 360,
                        req("saving.reductionHours", "plan.workingDaysPerMonth", "plan.hourlyWage"),
                        opt("shortage.overtimeHours")),
                slot("qualitative", JUSTIFICATION, 50, 360,
                        req(),
                        opt()),
                slot("utilization", RESTATEMENT, 30, 300,
                        req(),
                        opt("narrative.timeUtilizationPlan")));

        register(SectionId.PRODUCTIVITY,
                slot("target", ASSERTION, 25, 200,
                        req("plan.growthRate"),
                        opt()),
                slot("basis", JUSTIFICATION, 60, 400,
                        req("plan.growthRate", "plan.hourlyWage", "company.operatingProfit2024"),
                        opt("finance.laborCost", "finance.depreciation", "company.revenue2024",
                                "funding.totalInvestment")),
                slot("projection", ILLUSTRATION, 60, 500,
                        req("plan.growthRate", "plan.salaryGrowthRate", "company.operatingProfit2024"),
                        opt("finance.laborCost", "finance.depreciation", "company.revenue2024",
                                "funding.totalInvestment")),
                slot("wage", RESTATEMENT, 40, 360,
                        req("plan.salaryGrowthRate"),
                        opt("wage.increaseRate", "company.prefecture")));
    }

    private void register(SectionId sectionId, TemplateSlot... slots) {
        templates.put(sectionId, new SectionTemplate(sectionId, List.of(slots), IndustryProcessTemplates.GENERIC));
    }

    /**
     * Template for a section, bound to the process template matching the industry tag.
     */
    public SectionTemplate get(SectionId sectionId, String industry) {
        SectionTemplate template = templates.get(sectionId);
        if (template == null) {
            throw new TemplateMismatchException("セクションのテンプレートが登録されていません: " + sectionId.code());
        }
        return template.withProcessTemplate(processTemplateFor(industry));
    }

    public ProcessTemplate processTemplateFor(String industry) {
        return IndustryProcessTemplates.forIndustry(industry);
    }

    public List<SectionTemplate> getAll() {
        return List.copyOf(templates.values());
    }

    private static TemplateSlot slot(String name, SlotRole role, int min, int max,
                                     List<FactField> required, List<FactField> optional) {
        return new TemplateSlot(name, role, new LengthBand(min, max), required, optional);
    }

    private static List<FactField> req(String... keys) {
        return resolve(keys);
    }

    private static List<FactField> opt(String... keys) {
        return resolve(keys);
    }

    private static List<FactField> resolve(String... keys) {
        return Arrays.stream(keys).map(FactField::fromKey).toList();
    }
}
