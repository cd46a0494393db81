package com.shoryokuka.infrastructure.generation.synthesis;

import com.shoryokuka.domain.plan.model.FactField;
import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.ProcessStep;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Figures derived from the fact model.
 * <p>
 * 付加価値額 = 営業利益 + 人件費 + 減価償却費. Reported values take precedence; when the
 * labour cost is unknown it is estimated as 35% of FY2024 revenue, and an unknown
 * depreciation is the investment spread over 5 years. Projections grow operating profit
 * by the growth rate and labour cost by the salary growth rate; depreciation stays flat.
 * </p>
 */
public class PlanFigures {

    static final BigDecimal LABOR_COST_RATIO = new BigDecimal("0.35");
    static final int DEPRECIATION_YEARS = 5;
    static final int MONTHS_PER_YEAR = 12;

    private final FactModel fact;

    public PlanFigures(FactModel fact) {
        this.fact = fact;
    }

    public long laborCost() {
        if (fact.has(FactField.LABOR_COST)) {
            return fact.integer(FactField.LABOR_COST);
        }
        BigDecimal revenue = BigDecimal.valueOf(fact.integer(FactField.REVENUE_2024));
        return truncate(revenue.multiply(LABOR_COST_RATIO));
    }

    public long depreciation() {
        if (fact.has(FactField.DEPRECIATION)) {
            return fact.integer(FactField.DEPRECIATION);
        }
        return fact.integer(FactField.TOTAL_INVESTMENT) / DEPRECIATION_YEARS;
    }

    public long operatingProfit() {
        return fact.integer(FactField.OPERATING_PROFIT_2024);
    }

    public long addedValue() {
        return operatingProfit() + laborCost() + depreciation();
    }

    /**
     * Added value in the given plan year (0 is the base year).
     */
    public long addedValue(int year) {
        BigDecimal growth = fact.decimal(FactField.GROWTH_RATE).pow(year);
        BigDecimal salaryGrowth = fact.decimal(FactField.SALARY_GROWTH_RATE).pow(year);
        long op = truncate(BigDecimal.valueOf(operatingProfit()).multiply(growth));
        long labor = truncate(BigDecimal.valueOf(laborCost()).multiply(salaryGrowth));
        return op + labor + depreciation();
    }

    public BigDecimal growthPercent() {
        return toPercent(fact.decimal(FactField.GROWTH_RATE));
    }

    public BigDecimal salaryGrowthPercent() {
        return toPercent(fact.decimal(FactField.SALARY_GROWTH_RATE));
    }

    public long workforceGap() {
        return Math.max(0, fact.integer(FactField.DESIRED_WORKERS) - fact.integer(FactField.CURRENT_WORKERS));
    }

    public long monthlySavedHours() {
        return fact.decimal(FactField.REDUCTION_HOURS)
                .multiply(BigDecimal.valueOf(fact.integer(FactField.WORKING_DAYS_PER_MONTH)))
                .setScale(0, RoundingMode.HALF_UP)
                .longValue();
    }

    public long annualSaving() {
        return truncate(fact.decimal(FactField.REDUCTION_HOURS)
                .multiply(BigDecimal.valueOf(fact.integer(FactField.WORKING_DAYS_PER_MONTH)))
                .multiply(BigDecimal.valueOf(MONTHS_PER_YEAR))
                .multiply(BigDecimal.valueOf(fact.integer(FactField.HOURLY_WAGE))));
    }

    public static int beforeTotal(List<ProcessStep> steps) {
        return steps.stream().mapToInt(ProcessStep::beforeMinutes).sum();
    }

    public static int afterTotal(List<ProcessStep> steps) {
        return steps.stream().mapToInt(ProcessStep::afterMinutes).sum();
    }

    /**
     * Reduction rate in whole percent, 0 when nothing was measured before.
     */
    public static long reductionPercent(List<ProcessStep> steps) {
        int before = beforeTotal(steps);
        if (before <= 0) {
            return 0;
        }
        return BigDecimal.valueOf(before - afterTotal(steps))
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(before), 0, RoundingMode.HALF_UP)
                .longValue();
    }

    /**
     * Step with the largest saving; the first one wins a tie.
     */
    public static ProcessStep biggestSaving(List<ProcessStep> steps) {
        ProcessStep best = steps.get(0);
        for (ProcessStep step : steps) {
            if (step.savedMinutes() > best.savedMinutes()) {
                best = step;
            }
        }
        return best;
    }

    private static BigDecimal toPercent(BigDecimal rate) {
        return rate.subtract(BigDecimal.ONE).multiply(BigDecimal.valueOf(100));
    }

    private static long truncate(BigDecimal value) {
        return value.setScale(0, RoundingMode.DOWN).longValue();
    }
}
