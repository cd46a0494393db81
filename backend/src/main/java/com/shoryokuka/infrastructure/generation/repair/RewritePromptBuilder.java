package com.shoryokuka.infrastructure.generation.repair;

import com.shoryokuka.domain.plan.model.SlotRole;
import com.shoryokuka.domain.plan.model.ValidationIssue;
import com.shoryokuka.domain.plan.service.GenerationRequest;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the backend request for rewriting one slot that reads as machine-written prose.
 */
public class RewritePromptBuilder {

    private static final String INSTRUCTION = """
            あなたは省力化投資補助金の事業計画書を推敲する編集者です。
            与えられた段落を、意味と数値を一切変えずに自然な日本語のである調へ書き直してください。
            - 数値、固有名詞、年度はそのまま残す
            - 新しい数値や事実を追加しない
            - 段落の書き出し表現「%s」は変えない
            - 空行を入れず、1段落で出力する
            - 次の表現は使わない: %s
            書き直した段落のみを出力してください。""";

    public GenerationRequest build(String slotText, SlotRole role, List<ValidationIssue> issues) {
        String cue = role.cues().stream().filter(slotText.strip()::startsWith).findFirst().orElse("なし");
        String avoid = issues.stream()
                .map(ValidationIssue::matchedText)
                .filter(t -> t != null && !t.isBlank())
                .distinct()
                .collect(Collectors.joining("、"));
        return new GenerationRequest(INSTRUCTION.formatted(cue, avoid.isEmpty() ? "なし" : avoid), slotText);
    }
}
