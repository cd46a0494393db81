package com.shoryokuka.domain.plan.model;

import java.util.Arrays;

/**
 * Document sections of 事業計画書 その1・その2 produced by the pipeline.
 */
public enum SectionId {
    CURRENT_ANALYSIS("1-1", "現状分析"),
    MANAGEMENT_ISSUES("1-2", "経営上の課題"),
    MOTIVATION("1-3", "省力化補助金活用の動機・目的"),
    BEFORE_AFTER("2-1", "省力化設備導入による業務プロセスの変化"),
    EFFECT("2-2", "省力化投資により期待される効果"),
    PRODUCTIVITY("3-1", "付加価値額の向上と賃上げ");

    private final String code;
    private final String title;

    SectionId(String code, String title) {
        this.code = code;
        this.title = title;
    }

    public String code() {
        return code;
    }

    public String title() {
        return title;
    }

    public static SectionId fromCode(String code) {
        return Arrays.stream(values())
                .filter(id -> id.code.equals(code) || id.name().equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown section: " + code));
    }
}
