package com.shoryokuka.interfaces.api.dto;

import com.shoryokuka.domain.plan.model.FactField;
import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.ProcessStep;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Hearing sheet answers. Only the company name is mandatory here; a section whose
 * facts are missing fails on its own with MISSING_FACT.
 */
public record HearingSheetRequest(
        @NotBlank(message = "事業者名は必須です")
        @Size(max = 200)
        String companyName,
        String industry,
        String prefecture,
        String establishedDate,
        @Size(max = 2000)
        String businessDescription,
        @PositiveOrZero Long officerCount,
        @PositiveOrZero Long employeeCount,
        Long revenue2022,
        Long revenue2023,
        Long revenue2024,
        Long operatingProfit2024,
        @PositiveOrZero Long laborCost,
        @PositiveOrZero Long depreciation,

        String shortageTasks,
        String recruitmentPeriod,
        @PositiveOrZero Long applications,
        @PositiveOrZero Long hired,
        @PositiveOrZero BigDecimal overtimeHours,
        @PositiveOrZero Long currentWorkers,
        @PositiveOrZero Long desiredWorkers,
        @PositiveOrZero BigDecimal jobOpeningsRatio,

        @PositiveOrZero BigDecimal currentHours,
        @PositiveOrZero BigDecimal targetHours,
        @PositiveOrZero BigDecimal reductionHours,
        @PositiveOrZero BigDecimal reductionRate,

        String equipmentName,
        @Size(max = 2000)
        String equipmentFeatures,
        @PositiveOrZero Long totalInvestment,

        @DecimalMin(value = "1.0", message = "成長率は1.0以上で指定してください")
        BigDecimal growthRate,
        @DecimalMin(value = "1.0", message = "給与成長率は1.0以上で指定してください")
        BigDecimal salaryGrowthRate,
        @PositiveOrZero Long hourlyWage,
        @Min(1) @Max(31) Integer workingDaysPerMonth,

        @Size(max = 2000)
        String motivationBackground,
        @Size(max = 2000)
        String timeUtilizationPlan,
        @PositiveOrZero BigDecimal wageIncreaseRate,

        @Valid
        List<ProcessStepRequest> processSteps,

        List<String> sections
) {
    static final BigDecimal DEFAULT_GROWTH_RATE = new BigDecimal("1.05");
    static final BigDecimal DEFAULT_SALARY_GROWTH_RATE = new BigDecimal("1.025");
    static final int DEFAULT_WORKING_DAYS = 22;

    public record ProcessStepRequest(
            @NotBlank String name,
            @NotBlank String beforeDescription,
            @NotBlank String afterDescription,
            @NotNull @PositiveOrZero Integer beforeMinutes,
            @NotNull @PositiveOrZero Integer afterMinutes
    ) {
        ProcessStep toDomain() {
            return new ProcessStep(name, beforeDescription, afterDescription, beforeMinutes, afterMinutes);
        }
    }

    public FactModel toFactModel() {
        BigDecimal reduction = reductionHours;
        if (reduction == null && currentHours != null && targetHours != null) {
            reduction = currentHours.subtract(targetHours).max(BigDecimal.ZERO);
        }
        BigDecimal rate = reductionRate;
        if (rate == null && reduction != null && currentHours != null && currentHours.signum() > 0) {
            rate = reduction.multiply(BigDecimal.valueOf(100)).divide(currentHours, 1, RoundingMode.HALF_UP);
        }

        return FactModel.builder()
                .text(FactField.COMPANY_NAME, companyName)
                .text(FactField.INDUSTRY, industry)
                .text(FactField.PREFECTURE, prefecture)
                .text(FactField.ESTABLISHED_DATE, establishedDate)
                .text(FactField.BUSINESS_DESCRIPTION, businessDescription)
                .integer(FactField.OFFICER_COUNT, officerCount)
                .integer(FactField.EMPLOYEE_COUNT, employeeCount)
                .integer(FactField.REVENUE_2022, revenue2022)
                .integer(FactField.REVENUE_2023, revenue2023)
                .integer(FactField.REVENUE_2024, revenue2024)
                .integer(FactField.OPERATING_PROFIT_2024, operatingProfit2024)
                .integer(FactField.LABOR_COST, laborCost)
                .integer(FactField.DEPRECIATION, depreciation)
                .text(FactField.SHORTAGE_TASKS, shortageTasks)
                .text(FactField.RECRUITMENT_PERIOD, recruitmentPeriod)
                .integer(FactField.APPLICATIONS, applications)
                .integer(FactField.HIRED, hired)
                .decimal(FactField.OVERTIME_HOURS, overtimeHours)
                .integer(FactField.CURRENT_WORKERS, currentWorkers)
                .integer(FactField.DESIRED_WORKERS, desiredWorkers)
                .decimal(FactField.JOB_OPENINGS_RATIO, jobOpeningsRatio)
                .decimal(FactField.CURRENT_HOURS, currentHours)
                .decimal(FactField.TARGET_HOURS, targetHours)
                .decimal(FactField.REDUCTION_HOURS, reduction)
                .decimal(FactField.REDUCTION_RATE, rate)
                .text(FactField.EQUIPMENT_NAME, equipmentName)
                .text(FactField.EQUIPMENT_FEATURES, equipmentFeatures)
                .integer(FactField.TOTAL_INVESTMENT, totalInvestment)
                .decimal(FactField.GROWTH_RATE, growthRate != null ? growthRate : DEFAULT_GROWTH_RATE)
                .decimal(FactField.SALARY_GROWTH_RATE,
                        salaryGrowthRate != null ? salaryGrowthRate : DEFAULT_SALARY_GROWTH_RATE)
                .integer(FactField.HOURLY_WAGE, hourlyWage)
                .integer(FactField.WORKING_DAYS_PER_MONTH,
                        (long) (workingDaysPerMonth != null ? workingDaysPerMonth : DEFAULT_WORKING_DAYS))
                .text(FactField.MOTIVATION_BACKGROUND, motivationBackground)
                .text(FactField.TIME_UTILIZATION_PLAN, timeUtilizationPlan)
                .decimal(FactField.WAGE_INCREASE_RATE, wageIncreaseRate)
                .processSteps(processSteps == null ? null
                        : processSteps.stream().map(ProcessStepRequest::toDomain).toList())
                .build();
    }
}
