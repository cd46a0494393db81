package com.shoryokuka.domain.plan.exception;

import com.shoryokuka.domain.plan.model.FactField;
import lombok.Getter;

/**
 * A required fact is unavailable. Fatal for the section that needs it.
 */
@Getter
public class MissingFactException extends PlanGenerationException {

    private final FactField field;

    public MissingFactException(FactField field) {
        super("MISSING_FACT", "必須項目が未入力です: " + field.key());
        this.field = field;
    }
}
