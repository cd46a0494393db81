package com.shoryokuka.infrastructure.generation.validation;

import com.shoryokuka.domain.plan.model.IssueCategory;
import com.shoryokuka.domain.plan.model.IssueLocation;
import com.shoryokuka.domain.plan.model.SectionId;
import com.shoryokuka.domain.plan.model.SectionTemplate;
import com.shoryokuka.domain.plan.model.SlotRole;
import com.shoryokuka.domain.plan.model.TemplateSlot;
import com.shoryokuka.domain.plan.model.ValidationIssue;
import com.shoryokuka.domain.plan.model.ValidationIssue.Severity;
import com.shoryokuka.domain.plan.model.ValidationResult;
import com.shoryokuka.infrastructure.generation.validation.TextSegmenter.Sentence;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Rule-based quality check of section text against a {@link QualityRubric}.
 * <p>
 * Rules run in a fixed order: structure, length, generic phrases, repetition,
 * unnatural patterns. Detection has no side effects, so the same text and template
 * always yield the same result.
 * </p>
 */
@Slf4j
public class DefectDetector {

    public static final String RULE_SLOT_COUNT = "structure.slot-count";
    public static final String RULE_EMPTY_SLOT = "structure.empty-slot";
    public static final String RULE_ROLE_ORDER = "structure.role-order";
    public static final String RULE_TOO_SHORT = "length.too-short";
    public static final String RULE_TOO_LONG = "length.too-long";
    public static final String RULE_GENERIC = "generic-phrase";
    public static final String RULE_OPENING = "repetition.opening";
    public static final String RULE_DUPLICATE = "repetition.duplicate";
    public static final String RULE_ENDING_RUN = "repetition.ending-run";
    public static final String RULE_ENUMERATION = "unnatural.enumeration";
    public static final String RULE_DOCUMENT_DUPLICATE = "document.duplicate";
    public static final String RULE_DOCUMENT_OPENING = "document.opening";

    private final QualityRubric rubric;

    public DefectDetector(QualityRubric rubric) {
        this.rubric = rubric;
    }

    public QualityRubric rubric() {
        return rubric;
    }

    /**
     * Validate one section's text (slots separated by blank lines) against its template.
     */
    public ValidationResult validate(String text, SectionTemplate template) {
        SectionId sectionId = template.sectionId();
        List<String> paragraphs = TextSegmenter.paragraphs(text);
        List<ValidationIssue> issues = new ArrayList<>();

        checkStructure(sectionId, paragraphs, template, issues);
        checkLength(sectionId, paragraphs, template, issues);
        checkGenericPhrases(sectionId, paragraphs, issues);
        checkRepetition(sectionId, paragraphs, issues);
        checkUnnaturalPatterns(sectionId, paragraphs, issues);

        ValidationResult result = new ValidationResult(score(issues), issues);
        if (!issues.isEmpty()) {
            log.debug("Validated section {}: score={}, {} issues ({} errors)",
                    sectionId.code(), result.score(), issues.size(), result.errors().size());
        }
        return result;
    }

    /**
     * Whole-document pass over finalized section texts: sentences duplicated across
     * sections and openings recurring across the document.
     */
    public ValidationResult validateDocument(Map<SectionId, String> sections) {
        List<ValidationIssue> issues = new ArrayList<>();
        Map<String, SectionId> firstSeen = new HashMap<>();
        Map<String, Integer> openingCounts = new HashMap<>();
        QualityRubric.Repetition rep = rubric.repetition();

        for (Map.Entry<SectionId, String> entry : sections.entrySet()) {
            SectionId sectionId = entry.getKey();
            List<String> paragraphs = TextSegmenter.paragraphs(entry.getValue());
            for (Located located : proseSentences(paragraphs)) {
                Sentence sentence = located.sentence();
                if (sentence.text().length() >= rep.minDuplicateLength()) {
                    SectionId seenIn = firstSeen.putIfAbsent(sentence.text(), sectionId);
                    if (seenIn != null && seenIn != sectionId) {
                        issues.add(issue(IssueCategory.REPETITION, Severity.WARNING,
                                locate(sectionId, located),
                                "セクション" + seenIn.code() + "と同じ文が繰り返されています",
                                sentence.text(), RULE_DOCUMENT_DUPLICATE));
                    }
                }
                if (!isOpeningExempt(sentence)) {
                    String opening = sentence.opening(rep.openingLength());
                    int count = openingCounts.merge(opening, 1, Integer::sum);
                    if (count > rep.documentOpeningLimit()) {
                        issues.add(issue(IssueCategory.REPETITION, Severity.WARNING,
                                locate(sectionId, located),
                                "文書全体で「" + opening + "」で始まる文が" + count + "回目です",
                                opening, RULE_DOCUMENT_OPENING));
                    }
                }
            }
        }
        return new ValidationResult(score(issues), issues);
    }

    double score(List<ValidationIssue> issues) {
        BigDecimal total = BigDecimal.ZERO;
        for (ValidationIssue issue : issues) {
            total = total.add(rubric.penalty(issue.category()));
        }
        return BigDecimal.ONE.subtract(total).max(BigDecimal.ZERO).min(BigDecimal.ONE).doubleValue();
    }

    // Rule 1: structural drift
    private void checkStructure(SectionId sectionId, List<String> paragraphs, SectionTemplate template,
                                List<ValidationIssue> issues) {
        if (paragraphs.size() != template.slotCount()) {
            issues.add(issue(IssueCategory.STRUCTURAL_DRIFT, Severity.ERROR, IssueLocation.section(sectionId),
                    "段落数(" + paragraphs.size() + ")がテンプレートのスロット数(" + template.slotCount() + ")と一致しません",
                    null, RULE_SLOT_COUNT));
        }

        int aligned = Math.min(paragraphs.size(), template.slotCount());
        for (int i = 0; i < aligned; i++) {
            String paragraph = paragraphs.get(i);
            TemplateSlot slot = template.slot(i);
            if (paragraph.isBlank()) {
                issues.add(issue(IssueCategory.STRUCTURAL_DRIFT, Severity.ERROR, IssueLocation.slot(sectionId, i),
                        "スロット「" + slot.name() + "」が空です", null, RULE_EMPTY_SLOT));
            } else if (!slot.role().accepts(paragraph)) {
                SlotRole found = SlotRole.cueRole(paragraph);
                issues.add(issue(IssueCategory.STRUCTURAL_DRIFT, Severity.ERROR, IssueLocation.slot(sectionId, i),
                        "スロット「" + slot.name() + "」は" + slot.role().label() + "の位置ですが、"
                                + (found == null ? "書き出しに対応する表現がありません" : found.label() + "の書き出しになっています"),
                        paragraph.strip().substring(0, Math.min(10, paragraph.strip().length())), RULE_ROLE_ORDER));
            }
        }

        for (int i = 0; i < paragraphs.size(); i++) {
            for (QualityRubric.PatternRule hole : rubric.textHoles()) {
                Matcher m = hole.pattern().matcher(paragraphs.get(i));
                while (m.find()) {
                    issues.add(issue(IssueCategory.STRUCTURAL_DRIFT, Severity.ERROR,
                            new IssueLocation(sectionId, i, m.start(), m.end()),
                            "穴あき表現: " + hole.description() + " \"" + m.group() + "\"",
                            m.group(), hole.id()));
                }
            }
        }
    }

    // Rule 2: length band per slot
    private void checkLength(SectionId sectionId, List<String> paragraphs, SectionTemplate template,
                             List<ValidationIssue> issues) {
        if (paragraphs.size() != template.slotCount()) {
            return;
        }
        for (int i = 0; i < paragraphs.size(); i++) {
            String paragraph = paragraphs.get(i);
            if (paragraph.isBlank()) {
                continue;
            }
            TemplateSlot slot = template.slot(i);
            int length = TextSegmenter.visibleLength(paragraph);
            if (!slot.band().contains(length)) {
                boolean tooShort = length < slot.band().min();
                issues.add(issue(IssueCategory.LENGTH_VIOLATION, Severity.WARNING, IssueLocation.slot(sectionId, i),
                        "スロット「" + slot.name() + "」の文字数" + length + "字が目安(" + slot.band().min()
                                + "〜" + slot.band().max() + "字)の" + (tooShort ? "下限を下回っています" : "上限を超えています"),
                        null, tooShort ? RULE_TOO_SHORT : RULE_TOO_LONG));
            }
        }
    }

    // Rule 3: generic filler phrases
    private void checkGenericPhrases(SectionId sectionId, List<String> paragraphs, List<ValidationIssue> issues) {
        for (int i = 0; i < paragraphs.size(); i++) {
            String paragraph = paragraphs.get(i);
            for (QualityRubric.GenericPhrase phrase : rubric.genericPhrases()) {
                int from = paragraph.indexOf(phrase.phrase());
                while (from >= 0) {
                    int end = from + phrase.phrase().length();
                    issues.add(issue(IssueCategory.GENERIC_PHRASE, Severity.WARNING,
                            new IssueLocation(sectionId, i, from, end),
                            "具体性に欠ける表現: \"" + phrase.phrase() + "\"", phrase.phrase(), RULE_GENERIC));
                    from = paragraph.indexOf(phrase.phrase(), end);
                }
            }
        }
    }

    // Rule 4: repeated openings, duplicated sentences, runs of identical endings
    private void checkRepetition(SectionId sectionId, List<String> paragraphs, List<ValidationIssue> issues) {
        QualityRubric.Repetition rep = rubric.repetition();
        List<Located> sentences = proseSentences(paragraphs);

        Map<String, Integer> openingCounts = new LinkedHashMap<>();
        for (Located located : sentences) {
            Sentence sentence = located.sentence();
            if (isOpeningExempt(sentence)) {
                continue;
            }
            String opening = sentence.opening(rep.openingLength());
            int count = openingCounts.merge(opening, 1, Integer::sum);
            if (count > rep.openingLimit()) {
                issues.add(issue(IssueCategory.REPETITION, Severity.WARNING, locate(sectionId, located),
                        "「" + opening + "」で始まる文が" + count + "回続いています", opening, RULE_OPENING));
            }
        }

        Set<String> seen = new HashSet<>();
        for (Located located : sentences) {
            String text = located.sentence().text();
            if (text.length() >= rep.minDuplicateLength() && !seen.add(text)) {
                issues.add(issue(IssueCategory.REPETITION, Severity.WARNING, locate(sectionId, located),
                        "同じ文が重複しています", text, RULE_DUPLICATE));
            }
        }

        String previousEnding = null;
        int run = 0;
        for (Located located : sentences) {
            String ending = located.sentence().ending(rep.endingLength());
            run = ending.equals(previousEnding) ? run + 1 : 1;
            previousEnding = ending;
            if (run == rep.endingRunLimit()) {
                issues.add(issue(IssueCategory.REPETITION, Severity.WARNING, locate(sectionId, located),
                        "文末「" + ending + "」が" + run + "文連続しています", ending, RULE_ENDING_RUN));
            }
        }
    }

    // Rule 5: machine-prose markers and mechanical enumeration
    private void checkUnnaturalPatterns(SectionId sectionId, List<String> paragraphs, List<ValidationIssue> issues) {
        for (int i = 0; i < paragraphs.size(); i++) {
            String paragraph = paragraphs.get(i);
            for (QualityRubric.PatternRule rule : rubric.unnaturalPatterns()) {
                Matcher m = rule.pattern().matcher(paragraph);
                while (m.find()) {
                    issues.add(issue(IssueCategory.UNNATURAL_PATTERN, Severity.WARNING,
                            new IssueLocation(sectionId, i, m.start(), m.end()),
                            "不自然な表現: " + rule.description() + " \"" + m.group() + "\"", m.group(), rule.id()));
                }
            }
        }

        QualityRubric.Enumeration enumeration = rubric.enumeration();
        int markers = 0;
        for (Located located : proseSentences(paragraphs)) {
            String marker = enumerationMarker(located.sentence().text());
            if (marker != null && ++markers > enumeration.limit()) {
                issues.add(issue(IssueCategory.UNNATURAL_PATTERN, Severity.WARNING,
                        new IssueLocation(sectionId, located.slotIndex(), located.sentence().start(),
                                located.sentence().start() + marker.length()),
                        "機械的な列挙表現「" + marker + "」が" + markers + "回使われています", marker, RULE_ENUMERATION));
            }
        }
    }

    /**
     * Enumeration marker that opens the sentence, or null.
     */
    public String enumerationMarker(String sentence) {
        return rubric.enumeration().markers().stream()
                .filter(sentence::startsWith)
                .findFirst()
                .orElse(null);
    }

    private boolean isOpeningExempt(Sentence sentence) {
        return sentence.text().length() < rubric.repetition().openingLength()
                || SlotRole.startsWithCue(sentence.text());
    }

    private List<Located> proseSentences(List<String> paragraphs) {
        List<Located> sentences = new ArrayList<>();
        String marker = rubric.repetition().listMarker();
        for (int i = 0; i < paragraphs.size(); i++) {
            for (Sentence sentence : TextSegmenter.sentences(paragraphs.get(i))) {
                if (!sentence.isListItem(marker)) {
                    sentences.add(new Located(i, sentence));
                }
            }
        }
        return sentences;
    }

    private static IssueLocation locate(SectionId sectionId, Located located) {
        return new IssueLocation(sectionId, located.slotIndex(), located.sentence().start(), located.sentence().end());
    }

    private static ValidationIssue issue(IssueCategory category, Severity severity, IssueLocation location,
                                         String message, String matchedText, String ruleId) {
        return new ValidationIssue(category, severity, location, message, matchedText, ruleId);
    }

    private record Located(int slotIndex, Sentence sentence) {
    }
}
