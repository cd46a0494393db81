package com.shoryokuka.domain.plan.model;

/**
 * One Before/After work process step.
 *
 * @param name              process name, e.g. "数量拾い出し"
 * @param beforeDescription how the step is done today
 * @param afterDescription  how the step is done after the equipment is introduced
 * @param beforeMinutes     minutes per cycle today
 * @param afterMinutes      minutes per cycle after introduction
 */
public record ProcessStep(
        String name,
        String beforeDescription,
        String afterDescription,
        int beforeMinutes,
        int afterMinutes
) {
    public ProcessStep {
        name = FactModel.singleParagraph(name);
        beforeDescription = FactModel.singleParagraph(beforeDescription);
        afterDescription = FactModel.singleParagraph(afterDescription);
    }

    public int savedMinutes() {
        return beforeMinutes - afterMinutes;
    }
}
