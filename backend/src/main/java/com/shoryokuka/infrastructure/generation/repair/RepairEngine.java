package com.shoryokuka.infrastructure.generation.repair;

import com.shoryokuka.domain.plan.exception.TemplateMismatchException;
import com.shoryokuka.domain.plan.model.FactField;
import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.IssueCategory;
import com.shoryokuka.domain.plan.model.SectionDraft;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import com.shoryokuka.domain.plan.model.SlotRole;
import com.shoryokuka.domain.plan.model.TemplateSlot;
import com.shoryokuka.domain.plan.model.ValidationIssue;
import com.shoryokuka.domain.plan.service.TextGenerationBackend;
import com.shoryokuka.infrastructure.generation.synthesis.FactFormatter;
import com.shoryokuka.infrastructure.generation.synthesis.SectionSynthesizer;
import com.shoryokuka.infrastructure.generation.validation.DefectDetector;
import com.shoryokuka.infrastructure.generation.validation.QualityRubric;
import com.shoryokuka.infrastructure.generation.validation.TextSegmenter;
import com.shoryokuka.infrastructure.generation.validation.TextSegmenter.Sentence;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a section draft in place to address detected issues.
 * <p>
 * Structural drift is repaired first and alone: broken slots are re-synthesized and the
 * remaining categories wait for the next pass. Otherwise each slot runs the strategies
 * for generic phrases, unnatural patterns, repetition and length, in that order. Every
 * change goes through the slot guard (role cue kept, content non-blank, single paragraph)
 * and the {@link FactGuard}; a change that fails either is dropped. Issues without a
 * matching strategy are left for the next pass.
 * </p>
 */
@Slf4j
public class RepairEngine {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9.]+)}");
    private static final String TERMINATORS = "。！？!?";

    private final QualityRubric rubric;
    private final SectionSynthesizer synthesizer;
    private final TextGenerationBackend backend;
    private final RewritePromptBuilder promptBuilder = new RewritePromptBuilder();

    /**
     * @param backend text backend for slot rewrites, null to use the rule-based path only
     */
    public RepairEngine(QualityRubric rubric, SectionSynthesizer synthesizer, TextGenerationBackend backend) {
        this.rubric = rubric;
        this.synthesizer = synthesizer;
        this.backend = backend;
    }

    /**
     * Apply one repair cycle. The draft's iteration count grows by exactly one, even when
     * no change could be applied.
     *
     * @throws IllegalStateException if the draft's iteration budget is already spent
     */
    public SectionDraft repair(SectionDraft draft, List<ValidationIssue> issues, FactModel fact,
                               SectionTemplate template) {
        if (!draft.canRepair()) {
            throw new IllegalStateException("Draft " + draft.getSectionId().code() + " cannot be repaired further");
        }
        RepairPass pass = new RepairPass(new ArrayList<>(draft.getSlots()), new FactGuard(fact));

        boolean structural = issues.stream().anyMatch(i -> i.category() == IssueCategory.STRUCTURAL_DRIFT);
        if (structural) {
            realign(pass, fact, template);
        } else {
            for (int index = 0; index < template.slotCount(); index++) {
                List<ValidationIssue> slotIssues = issuesForSlot(issues, index);
                if (slotIssues.isEmpty()) {
                    continue;
                }
                TemplateSlot slot = template.slot(index);
                repairGenericPhrases(pass, index, slot, of(slotIssues, IssueCategory.GENERIC_PHRASE), fact);
                repairUnnaturalPatterns(pass, index, slot, of(slotIssues, IssueCategory.UNNATURAL_PATTERN));
                repairRepetition(pass, index, slot, of(slotIssues, IssueCategory.REPETITION));
                repairLength(pass, index, slot, of(slotIssues, IssueCategory.LENGTH_VIOLATION), fact);
            }
        }

        draft.rewrite(pass.slots);
        log.info("Repaired section {} -> iteration {}: {} changes applied, {} reverted",
                draft.getSectionId().code(), draft.getIteration(), pass.applied, pass.reverted);
        return draft;
    }

    // Structure: keep slots that fit their role, re-synthesize the rest
    private void realign(RepairPass pass, FactModel fact, SectionTemplate template) {
        for (int index = 0; index < template.slotCount(); index++) {
            TemplateSlot slot = template.slot(index);
            String current = pass.slots.get(index);
            if (slotFits(current, slot.role()) && !hasTextHole(current)) {
                continue;
            }
            String regenerated = synthesizer.synthesizeSlot(fact, template, index);
            if (slotFits(regenerated, slot.role())) {
                pass.slots.set(index, regenerated);
                pass.applied++;
                log.debug("Realigned slot {} ({}) of section {}", index, slot.name(), template.sectionId().code());
            } else {
                pass.reverted++;
                log.warn("Re-synthesized slot {} of section {} does not fit role {}",
                        slot.name(), template.sectionId().code(), slot.role());
            }
        }
    }

    // Generic phrases: fact-grounded replacement, fallback text when a placeholder fact is missing
    private void repairGenericPhrases(RepairPass pass, int index, TemplateSlot slot,
                                      List<ValidationIssue> issues, FactModel fact) {
        issues.stream().map(ValidationIssue::matchedText).distinct().forEach(phrase -> {
            QualityRubric.GenericPhrase entry = rubric.genericPhrase(phrase);
            if (entry == null) {
                return;
            }
            String replacement = resolvePlaceholders(entry, fact);
            pass.tryApply(index, slot, text -> text.replace(phrase, replacement), "generic-phrase");
        });
    }

    // Unnatural patterns: backend rewrite when enabled, otherwise catalogue replacement
    private void repairUnnaturalPatterns(RepairPass pass, int index, TemplateSlot slot, List<ValidationIssue> issues) {
        if (issues.isEmpty()) {
            return;
        }
        if (backend != null && rubric.rewrite().backendRewrite() && rewriteWithBackend(pass, index, slot, issues)) {
            return;
        }
        for (ValidationIssue issue : issues) {
            if (DefectDetector.RULE_ENUMERATION.equals(issue.ruleId())) {
                pass.tryApply(index, slot, text -> stripEnumerationMarker(text, issue.matchedText()), "enumeration");
                continue;
            }
            QualityRubric.PatternRule rule = rubric.unnaturalRule(issue.ruleId());
            if (rule == null || rule.replacement() == null) {
                log.debug("No rule-based fix for {} in slot {}", issue.ruleId(), slot.name());
                continue;
            }
            String replacement = Matcher.quoteReplacement(rule.replacement());
            pass.tryApply(index, slot, text -> rule.pattern().matcher(text).replaceAll(replacement), rule.id());
        }
    }

    private boolean rewriteWithBackend(RepairPass pass, int index, TemplateSlot slot, List<ValidationIssue> issues) {
        String current = pass.slots.get(index);
        String rewritten = backend.generate(promptBuilder.build(current, slot.role(), issues));
        boolean cleared = issues.stream()
                .map(ValidationIssue::matchedText)
                .filter(t -> t != null && !t.isEmpty())
                .noneMatch(rewritten::contains);
        if (!cleared) {
            log.debug("Backend rewrite of slot {} still carries flagged text, using rule path", slot.name());
            return false;
        }
        return pass.tryApply(index, slot, text -> rewritten, "backend-rewrite");
    }

    private String stripEnumerationMarker(String text, String marker) {
        for (Sentence sentence : TextSegmenter.sentences(text)) {
            if (sentence.text().startsWith(marker)) {
                int cut = sentence.start() + marker.length();
                if (cut < text.length() && text.charAt(cut) == '、') {
                    cut++;
                }
                return text.substring(0, sentence.start()) + text.substring(cut);
            }
        }
        return text;
    }

    // Repetition: opening synonym or subject drop, duplicate removal, ending-run merge
    private void repairRepetition(RepairPass pass, int index, TemplateSlot slot, List<ValidationIssue> issues) {
        for (ValidationIssue issue : issues) {
            switch (issue.ruleId()) {
                case DefectDetector.RULE_OPENING ->
                        pass.tryApply(index, slot, text -> varyOpening(text, issue.matchedText()), issue.ruleId());
                case DefectDetector.RULE_DUPLICATE, DefectDetector.RULE_DOCUMENT_DUPLICATE ->
                        pass.tryApply(index, slot, text -> removeSentence(text, issue.matchedText()), issue.ruleId());
                case DefectDetector.RULE_ENDING_RUN ->
                        pass.tryApply(index, slot, text -> mergeEnding(text, issue.matchedText()), issue.ruleId());
                default -> log.debug("No repetition strategy for {}", issue.ruleId());
            }
        }
    }

    private String varyOpening(String text, String opening) {
        Sentence target = lastSentenceStartingWith(text, opening);
        if (target == null) {
            return text;
        }
        String sentence = target.text();
        List<String> synonyms = rubric.rewrite().openingSynonyms().getOrDefault(opening, List.of());
        String varied = null;
        for (String synonym : synonyms) {
            if (!synonym.equals(opening)) {
                varied = synonym + sentence.substring(opening.length());
                break;
            }
        }
        if (varied == null) {
            int topic = sentence.indexOf("は、");
            if (topic < 0 || topic > 12 || topic + 2 >= sentence.length()) {
                return text;
            }
            varied = sentence.substring(topic + 2);
        }
        return text.substring(0, target.start()) + varied + text.substring(target.end());
    }

    private Sentence lastSentenceStartingWith(String text, String opening) {
        Sentence found = null;
        for (Sentence sentence : TextSegmenter.sentences(text)) {
            if (sentence.text().startsWith(opening) && !sentence.isListItem(rubric.repetition().listMarker())) {
                found = sentence;
            }
        }
        return found;
    }

    private String removeSentence(String text, String duplicate) {
        Sentence last = null;
        for (Sentence sentence : TextSegmenter.sentences(text)) {
            if (sentence.text().equals(duplicate)) {
                last = sentence;
            }
        }
        if (last == null) {
            return text;
        }
        return (text.substring(0, last.start()) + text.substring(last.end())).replaceAll("\\n{2,}", "\n").strip();
    }

    private String mergeEnding(String text, String ending) {
        List<Sentence> sentences = TextSegmenter.sentences(text);
        for (int i = 0; i + 1 < sentences.size(); i++) {
            Sentence current = sentences.get(i);
            Sentence next = sentences.get(i + 1);
            String marker = rubric.repetition().listMarker();
            if (current.isListItem(marker) || next.isListItem(marker)) {
                continue;
            }
            if (!current.ending(ending.length()).equals(ending)) {
                continue;
            }
            if (text.substring(current.end(), next.start()).contains("\n")) {
                continue;
            }
            String body = stripTerminator(current.text());
            for (Map.Entry<String, String> join : rubric.rewrite().endingJoins().entrySet()) {
                if (body.endsWith(join.getKey())) {
                    String merged = body.substring(0, body.length() - join.getKey().length()) + join.getValue();
                    return text.substring(0, current.start()) + merged + text.substring(next.start());
                }
            }
        }
        return text;
    }

    // Length: trim trailing number-free sentences, or append fact-grounded elaborations
    private void repairLength(RepairPass pass, int index, TemplateSlot slot, List<ValidationIssue> issues,
                              FactModel fact) {
        for (ValidationIssue issue : issues) {
            if (DefectDetector.RULE_TOO_LONG.equals(issue.ruleId())) {
                pass.tryApply(index, slot, text -> trimTrailing(text, slot), issue.ruleId());
            } else if (DefectDetector.RULE_TOO_SHORT.equals(issue.ruleId())) {
                List<String> elaborations = synthesizer.elaborations(fact, slot.role());
                pass.tryApply(index, slot, text -> extend(text, slot, elaborations), issue.ruleId());
            }
        }
    }

    private String trimTrailing(String text, TemplateSlot slot) {
        String result = text;
        while (TextSegmenter.visibleLength(result) > slot.band().midpoint()) {
            List<Sentence> sentences = TextSegmenter.sentences(result);
            if (sentences.size() <= 1) {
                break;
            }
            Sentence last = sentences.get(sentences.size() - 1);
            if (FactGuard.containsNumber(last.text()) || last.isListItem(rubric.repetition().listMarker())) {
                break;
            }
            String shorter = result.substring(0, last.start()).strip();
            if (TextSegmenter.visibleLength(shorter) < slot.band().min()) {
                break;
            }
            result = shorter;
        }
        return result;
    }

    private String extend(String text, TemplateSlot slot, List<String> elaborations) {
        StringBuilder sb = new StringBuilder(text.strip());
        for (String sentence : elaborations) {
            if (TextSegmenter.visibleLength(sb.toString()) >= slot.band().min()) {
                break;
            }
            if (sb.indexOf(sentence) >= 0) {
                continue;
            }
            if (sb.length() > 0 && TERMINATORS.indexOf(sb.charAt(sb.length() - 1)) < 0) {
                sb.append('\n');
            }
            sb.append(sentence);
        }
        return sb.toString();
    }

    private String resolvePlaceholders(QualityRubric.GenericPhrase entry, FactModel fact) {
        Matcher m = PLACEHOLDER.matcher(entry.replacement());
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            FactField field;
            try {
                field = FactField.fromKey(m.group(1));
            } catch (TemplateMismatchException e) {
                log.warn("Rubric phrase '{}' references unknown fact {}", entry.phrase(), m.group(1));
                return entry.fallback();
            }
            if (!fact.has(field)) {
                return entry.fallback();
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(FactFormatter.format(fact, field)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private boolean slotFits(String text, SlotRole role) {
        return text != null
                && !text.isBlank()
                && TextSegmenter.isSingleParagraph(text)
                && role.accepts(text);
    }

    private boolean hasTextHole(String text) {
        return rubric.textHoles().stream().anyMatch(rule -> rule.pattern().matcher(text).find());
    }

    private static String stripTerminator(String sentence) {
        int end = sentence.length();
        while (end > 0 && TERMINATORS.indexOf(sentence.charAt(end - 1)) >= 0) {
            end--;
        }
        return sentence.substring(0, end);
    }

    private static List<ValidationIssue> issuesForSlot(List<ValidationIssue> issues, int index) {
        return issues.stream().filter(i -> i.slotIndex() == index).toList();
    }

    private static List<ValidationIssue> of(List<ValidationIssue> issues, IssueCategory category) {
        return issues.stream().filter(i -> i.category() == category).toList();
    }

    /**
     * Working slot texts of one repair cycle plus the guards every change must pass.
     */
    private final class RepairPass {

        private final List<String> slots;
        private final FactGuard factGuard;
        private int applied;
        private int reverted;

        private RepairPass(List<String> slots, FactGuard factGuard) {
            this.slots = slots;
            this.factGuard = factGuard;
        }

        boolean tryApply(int index, TemplateSlot slot, UnaryOperator<String> change, String strategy) {
            String current = slots.get(index);
            String candidate = change.apply(current);
            if (candidate == null || candidate.equals(current)) {
                return false;
            }
            if (!slotFits(candidate, slot.role())) {
                reverted++;
                log.debug("Reverted {} on slot {}: slot guard failed", strategy, slot.name());
                return false;
            }
            List<String> next = new ArrayList<>(slots);
            next.set(index, candidate);
            if (!factGuard.accepts(String.join(SectionDraft.SLOT_SEPARATOR, slots),
                    String.join(SectionDraft.SLOT_SEPARATOR, next))) {
                reverted++;
                log.debug("Reverted {} on slot {}: fact guard failed", strategy, slot.name());
                return false;
            }
            slots.set(index, candidate);
            applied++;
            return true;
        }
    }
}
