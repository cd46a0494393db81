package com.shoryokuka.domain.plan.model;

import com.shoryokuka.domain.plan.exception.MissingFactException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable snapshot of the business-plan inputs for one generation run.
 * <p>
 * Every section of a run reads the same snapshot, so numbers quoted in different
 * sections stay consistent. A field that was never put is "unavailable" and
 * reading it raises {@link MissingFactException}.
 * </p>
 */
public final class FactModel {

    // A fact is quoted inside a single slot paragraph, so it may not carry a blank line
    private static final Pattern BLANK_LINES = Pattern.compile("\\n(?:[ \\t\\u3000]*\\n)+");

    private final Map<FactField, Object> values;

    private FactModel(EnumMap<FactField, Object> values) {
        this.values = Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean has(FactField field) {
        return values.containsKey(field);
    }

    public Set<FactField> availableFields() {
        return values.keySet();
    }

    public Object require(FactField field) {
        Object value = values.get(field);
        if (value == null) {
            throw new MissingFactException(field);
        }
        return value;
    }

    public String text(FactField field) {
        checkKind(field, FactKind.TEXT);
        return (String) require(field);
    }

    public long integer(FactField field) {
        checkKind(field, FactKind.INTEGER);
        return (Long) require(field);
    }

    public BigDecimal decimal(FactField field) {
        checkKind(field, FactKind.DECIMAL);
        return (BigDecimal) require(field);
    }

    @SuppressWarnings("unchecked")
    public List<ProcessStep> processSteps() {
        return (List<ProcessStep>) require(FactField.PROCESS_STEPS);
    }

    /**
     * Industry tag used for template lookup. Empty when unavailable.
     */
    public String industryTag() {
        return has(FactField.INDUSTRY) ? text(FactField.INDUSTRY) : "";
    }

    /**
     * Strip the value and collapse blank lines to a single line break.
     */
    static String singleParagraph(String value) {
        if (value == null) {
            return null;
        }
        String text = value.replace("\r\n", "\n").replace('\r', '\n').strip();
        return BLANK_LINES.matcher(text).replaceAll("\n");
    }

    private static void checkKind(FactField field, FactKind expected) {
        if (field.kind() != expected) {
            throw new IllegalArgumentException(field.key() + " is " + field.kind() + ", not " + expected);
        }
    }

    public static final class Builder {

        private final EnumMap<FactField, Object> values = new EnumMap<>(FactField.class);

        private Builder() {
        }

        /**
         * Blank text is treated as unavailable. Blank lines inside the text are collapsed.
         */
        public Builder text(FactField field, String value) {
            checkKind(field, FactKind.TEXT);
            if (value != null && !value.isBlank()) {
                values.put(field, singleParagraph(value));
            }
            return this;
        }

        public Builder integer(FactField field, Long value) {
            checkKind(field, FactKind.INTEGER);
            if (value != null) {
                values.put(field, value);
            }
            return this;
        }

        public Builder integer(FactField field, long value) {
            return integer(field, Long.valueOf(value));
        }

        public Builder decimal(FactField field, BigDecimal value) {
            checkKind(field, FactKind.DECIMAL);
            if (value != null) {
                values.put(field, value);
            }
            return this;
        }

        public Builder decimal(FactField field, double value) {
            return decimal(field, BigDecimal.valueOf(value));
        }

        public Builder processSteps(List<ProcessStep> steps) {
            if (steps != null && !steps.isEmpty()) {
                values.put(FactField.PROCESS_STEPS, List.copyOf(steps));
            }
            return this;
        }

        public FactModel build() {
            return new FactModel(values);
        }
    }
}
