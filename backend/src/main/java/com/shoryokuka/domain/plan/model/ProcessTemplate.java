package com.shoryokuka.domain.plan.model;

import java.util.List;

/**
 * Industry-specific Before/After process template referenced by a section template.
 *
 * @param industryKey keyword the template was selected by ("default" for the generic one)
 * @param steps       ordered process steps
 */
public record ProcessTemplate(String industryKey, List<ProcessStep> steps) {

    public ProcessTemplate {
        steps = List.copyOf(steps);
    }
}
