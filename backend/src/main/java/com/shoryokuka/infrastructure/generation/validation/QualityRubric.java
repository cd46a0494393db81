package com.shoryokuka.infrastructure.generation.validation;

import com.shoryokuka.domain.plan.model.IssueCategory;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Immutable quality rubric: penalty weights, phrase catalogues, repetition limits and
 * rewrite tables. Loaded once per run and handed to the detector and the repair engine.
 */
public record QualityRubric(
        Map<IssueCategory, BigDecimal> penalties,
        Repetition repetition,
        List<GenericPhrase> genericPhrases,
        List<PatternRule> unnaturalPatterns,
        List<PatternRule> textHoles,
        Enumeration enumeration,
        Rewrite rewrite
) {
    public QualityRubric {
        penalties = Collections.unmodifiableMap(new EnumMap<>(penalties));
        genericPhrases = List.copyOf(genericPhrases);
        unnaturalPatterns = List.copyOf(unnaturalPatterns);
        textHoles = List.copyOf(textHoles);
    }

    public BigDecimal penalty(IssueCategory category) {
        return penalties.getOrDefault(category, BigDecimal.ZERO);
    }

    public PatternRule unnaturalRule(String id) {
        return unnaturalPatterns.stream().filter(r -> r.id().equals(id)).findFirst().orElse(null);
    }

    public GenericPhrase genericPhrase(String phrase) {
        return genericPhrases.stream().filter(p -> p.phrase().equals(phrase)).findFirst().orElse(null);
    }

    /**
     * @param openingLength        characters compared at the start of a sentence
     * @param openingLimit         occurrences of one opening allowed per section
     * @param documentOpeningLimit occurrences of one opening allowed across the document
     * @param endingLength         characters compared at the end of a sentence
     * @param endingRunLimit       consecutive identical endings that count as a defect
     * @param minDuplicateLength   shortest sentence checked for duplication
     * @param listMarker           prefix of bulleted list lines, exempt from repetition checks
     */
    public record Repetition(
            int openingLength,
            int openingLimit,
            int documentOpeningLimit,
            int endingLength,
            int endingRunLimit,
            int minDuplicateLength,
            String listMarker
    ) {
    }

    /**
     * Vague filler phrase.
     *
     * @param phrase      text to look for
     * @param replacement replacement, may carry {@code {fact.key}} placeholders
     * @param fallback    used when a placeholder fact is unavailable
     */
    public record GenericPhrase(String phrase, String replacement, String fallback) {
    }

    /**
     * Regex rule. A null replacement means the rule has no rule-based fix.
     */
    public record PatternRule(String id, Pattern pattern, String replacement, String description) {
    }

    public record Enumeration(List<String> markers, int limit) {

        public Enumeration {
            markers = List.copyOf(markers);
        }
    }

    /**
     * @param openingSynonyms alternatives for repeated sentence openings
     * @param endingJoins     sentence ending to its connective form, checked in order
     * @param backendRewrite  whether unnatural slots are sent to the text backend first
     */
    public record Rewrite(
            Map<String, List<String>> openingSynonyms,
            Map<String, String> endingJoins,
            boolean backendRewrite
    ) {
        public Rewrite {
            openingSynonyms = Collections.unmodifiableMap(new LinkedHashMap<>(openingSynonyms));
            endingJoins = Collections.unmodifiableMap(new LinkedHashMap<>(endingJoins));
        }
    }
}
