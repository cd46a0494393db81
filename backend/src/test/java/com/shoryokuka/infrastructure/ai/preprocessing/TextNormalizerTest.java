package com.shoryokuka.infrastructure.ai.preprocessing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TextNormalizer();
    }

    @Test
    @DisplayName("nullと空文字はそのまま")
    void null_空文字() {
        assertThat(normalizer.normalize(null)).isNull();
        assertThat(normalizer.normalize("")).isEmpty();
    }

    @Test
    @DisplayName("見えない文字と制御文字を除去")
    void 見えない文字の除去() {
        assertThat(normalizer.normalize("当社\u200Bは\uFEFF建設業\u0007である。")).isEqualTo("当社は建設業である。");
    }

    @Test
    @DisplayName("コードフェンスとラベルを除去")
    void コードフェンスの除去() {
        assertThat(normalizer.normalize("```text\n修正後：その理由は、人手が足りないことにある。\n```"))
                .isEqualTo("その理由は、人手が足りないことにある。");
    }

    @Test
    @DisplayName("空行は1つの改行にまとめ、1段落にする")
    void 空行の圧縮() {
        assertThat(normalizer.normalize("具体的には、次のとおり。\r\n\r\n・工程A：30分"))
                .isEqualTo("具体的には、次のとおり。\n・工程A：30分");
    }

    @Test
    @DisplayName("連続した空白をまとめる")
    void 空白の圧縮() {
        assertThat(normalizer.normalize("  当社は   建設業である。  ")).isEqualTo("当社は 建設業である。");
    }

    @Test
    @DisplayName("NFC正規化")
    void nfc正規化() {
        // か + 結合用濁点 → が
        assertThat(normalizer.normalize("\u304B\u3099")).isEqualTo("\u304C");
    }
}
