package com.shoryokuka.domain.plan.model;

import com.shoryokuka.domain.plan.exception.TemplateMismatchException;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed schema of the business-plan facts a template may reference.
 * Templates refer to facts by {@link #key()}; a key outside this schema is a configuration bug.
 */
public enum FactField {
    // 企業基本情報
    COMPANY_NAME("company.name", FactKind.TEXT),
    INDUSTRY("company.industry", FactKind.TEXT),
    PREFECTURE("company.prefecture", FactKind.TEXT),
    ESTABLISHED_DATE("company.establishedDate", FactKind.TEXT),
    BUSINESS_DESCRIPTION("company.businessDescription", FactKind.TEXT),
    OFFICER_COUNT("company.officerCount", FactKind.INTEGER),
    EMPLOYEE_COUNT("company.employeeCount", FactKind.INTEGER),
    REVENUE_2022("company.revenue2022", FactKind.INTEGER),
    REVENUE_2023("company.revenue2023", FactKind.INTEGER),
    REVENUE_2024("company.revenue2024", FactKind.INTEGER),
    OPERATING_PROFIT_2024("company.operatingProfit2024", FactKind.INTEGER),

    // 決算書由来（任意）
    LABOR_COST("finance.laborCost", FactKind.INTEGER),
    DEPRECIATION("finance.depreciation", FactKind.INTEGER),

    // 人手不足
    SHORTAGE_TASKS("shortage.tasks", FactKind.TEXT),
    RECRUITMENT_PERIOD("shortage.recruitmentPeriod", FactKind.TEXT),
    APPLICATIONS("shortage.applications", FactKind.INTEGER),
    HIRED("shortage.hired", FactKind.INTEGER),
    OVERTIME_HOURS("shortage.overtimeHours", FactKind.DECIMAL),
    CURRENT_WORKERS("shortage.currentWorkers", FactKind.INTEGER),
    DESIRED_WORKERS("shortage.desiredWorkers", FactKind.INTEGER),
    JOB_OPENINGS_RATIO("shortage.jobOpeningsRatio", FactKind.DECIMAL),

    // 省力化効果
    CURRENT_HOURS("saving.currentHours", FactKind.DECIMAL),
    TARGET_HOURS("saving.targetHours", FactKind.DECIMAL),
    REDUCTION_HOURS("saving.reductionHours", FactKind.DECIMAL),
    REDUCTION_RATE("saving.reductionRate", FactKind.DECIMAL),

    // 設備・資金
    EQUIPMENT_NAME("equipment.name", FactKind.TEXT),
    EQUIPMENT_FEATURES("equipment.features", FactKind.TEXT),
    TOTAL_INVESTMENT("funding.totalInvestment", FactKind.INTEGER),

    // 計画パラメータ
    GROWTH_RATE("plan.growthRate", FactKind.DECIMAL),
    SALARY_GROWTH_RATE("plan.salaryGrowthRate", FactKind.DECIMAL),
    HOURLY_WAGE("plan.hourlyWage", FactKind.INTEGER),
    WORKING_DAYS_PER_MONTH("plan.workingDaysPerMonth", FactKind.INTEGER),

    // ヒアリング追加項目
    MOTIVATION_BACKGROUND("narrative.motivationBackground", FactKind.TEXT),
    TIME_UTILIZATION_PLAN("narrative.timeUtilizationPlan", FactKind.TEXT),
    WAGE_INCREASE_RATE("wage.increaseRate", FactKind.DECIMAL),

    PROCESS_STEPS("process.steps", FactKind.STEPS);

    private static final Map<String, FactField> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(FactField::key, Function.identity()));

    private final String key;
    private final FactKind kind;

    FactField(String key, FactKind kind) {
        this.key = key;
        this.kind = kind;
    }

    public String key() {
        return key;
    }

    public FactKind kind() {
        return kind;
    }

    public boolean isNumeric() {
        return kind == FactKind.INTEGER || kind == FactKind.DECIMAL;
    }

    /**
     * Resolve a template fact reference.
     *
     * @throws TemplateMismatchException if the key is not part of the schema
     */
    public static FactField fromKey(String key) {
        FactField field = BY_KEY.get(key);
        if (field == null) {
            throw new TemplateMismatchException("テンプレートが未定義の項目を参照しています: " + key);
        }
        return field;
    }
}
