package com.shoryokuka.infrastructure.generation.validation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextSegmenterTest {

    @Test
    void 空行を含まない本文は一段落() {
        assertThat(TextSegmenter.isSingleParagraph("木造住宅の新築工事\nリフォーム工事")).isTrue();
        assertThat(TextSegmenter.isSingleParagraph("第一段落。\n　\n第二段落。")).isFalse();
    }

    @Test
    void 空行で段落に分ける() {
        assertThat(TextSegmenter.paragraphs("第一段落。\n\n第二段落。\n \n第三段落。"))
                .containsExactly("第一段落。", "第二段落。", "第三段落。");
    }

    @Test
    void 改行と句点で文に分ける() {
        assertThat(TextSegmenter.sentences("当社は建設業である。\n・見積\n・積算"))
                .extracting(TextSegmenter.Sentence::text)
                .containsExactly("当社は建設業である。", "・見積", "・積算");
    }
}
