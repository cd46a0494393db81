package com.shoryokuka.domain.plan.model;

import java.util.Arrays;
import java.util.List;

/**
 * Rhetorical role of a template slot (PREP: point, reason, example, point).
 * <p>
 * Every role except {@link #ASSERTION} opens its paragraph with one of its cue phrases.
 * The detector uses the cues to check slot order; the assertion is recognised by
 * carrying no other role's cue.
 * </p>
 */
public enum SlotRole {
    ASSERTION("結論", List.of()),
    JUSTIFICATION("理由", List.of("その背景には", "その理由は", "その根拠は", "なぜなら")),
    ILLUSTRATION("具体例", List.of("具体的には", "実際に", "例えば")),
    RESTATEMENT("結論の再提示", List.of("以上のとおり", "このように", "したがって"));

    private final String label;
    private final List<String> cues;

    SlotRole(String label, List<String> cues) {
        this.label = label;
        this.cues = cues;
    }

    public String label() {
        return label;
    }

    public List<String> cues() {
        return cues;
    }

    public boolean accepts(String paragraph) {
        String head = paragraph.strip();
        if (this == ASSERTION) {
            return cueRole(head) == null;
        }
        return cues.stream().anyMatch(head::startsWith);
    }

    /**
     * The role whose cue opens the given text, or null.
     */
    public static SlotRole cueRole(String text) {
        String head = text.strip();
        return Arrays.stream(values())
                .filter(role -> role.cues.stream().anyMatch(head::startsWith))
                .findFirst()
                .orElse(null);
    }

    public static boolean startsWithCue(String text) {
        return cueRole(text) != null;
    }
}
