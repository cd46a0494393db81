package com.shoryokuka.infrastructure.generation.synthesis;

import com.shoryokuka.domain.plan.exception.TemplateMismatchException;
import com.shoryokuka.domain.plan.model.FactField;
import com.shoryokuka.domain.plan.model.FactModel;

import java.math.BigDecimal;

abstract class AbstractSectionComposer implements SectionComposer {

    protected static String fmt(FactModel fact, FactField field) {
        return FactFormatter.format(fact, field);
    }

    protected static String num(long value) {
        return FactFormatter.integer(value);
    }

    protected static String num(BigDecimal value) {
        return FactFormatter.decimal(value);
    }

    protected TemplateMismatchException unknownSlot(String slotName) {
        return new TemplateMismatchException(
                "セクション " + sectionId().code() + " に未知のスロットがあります: " + slotName);
    }
}
