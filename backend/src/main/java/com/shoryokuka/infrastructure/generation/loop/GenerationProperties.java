package com.shoryokuka.infrastructure.generation.loop;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings of the generation loop ({@code plan.generation.*}).
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "plan.generation")
public class GenerationProperties {

    /** Repair cycles allowed per section. */
    private int maxIterations = 3;

    /** Minimum score a section needs to be accepted. */
    private double qualityThreshold = 0.8;

    /** Sections processed concurrently. */
    private int parallelism = 4;

    private String rubricLocation = "classpath:quality/rubric.yml";
}
