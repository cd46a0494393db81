package com.shoryokuka.infrastructure.generation.synthesis;

import com.shoryokuka.domain.plan.model.FactField;
import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.ProcessStep;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Renders fact values the way they appear in the plan text.
 * Integers get {@code ,} grouping ({@code 1,200}); decimals are printed in plain form
 * without trailing zeros ({@code 1.15}).
 */
public final class FactFormatter {

    private FactFormatter() {
    }

    public static String integer(long value) {
        return String.format(Locale.JAPAN, "%,d", value);
    }

    public static String decimal(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }

    public static String format(FactModel fact, FactField field) {
        return switch (field.kind()) {
            case TEXT -> fact.text(field);
            case INTEGER -> integer(fact.integer(field));
            case DECIMAL -> decimal(fact.decimal(field));
            case STEPS -> throw new IllegalArgumentException(field.key() + " has no single-value rendering");
        };
    }

    /**
     * Every number the fact model can legitimately contribute to a text, in rendered form.
     */
    public static Set<String> numericTokens(FactModel fact) {
        Set<String> tokens = new LinkedHashSet<>();
        for (FactField field : fact.availableFields()) {
            if (field.isNumeric()) {
                tokens.add(format(fact, field));
            }
        }
        if (fact.has(FactField.PROCESS_STEPS)) {
            for (ProcessStep step : fact.processSteps()) {
                tokens.add(integer(step.beforeMinutes()));
                tokens.add(integer(step.afterMinutes()));
            }
        }
        return tokens;
    }
}
