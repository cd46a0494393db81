package com.shoryokuka.domain.plan.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SectionDraftTest {

    private SectionDraft draft;

    @BeforeEach
    void setUp() {
        draft = new SectionDraft(SectionId.EFFECT, FactModel.builder().build(), 2);
        draft.populate(List.of("一段落目", "二段落目"));
    }

    @Test
    void 生成直後は反復0回() {
        assertThat(draft.getIteration()).isZero();
        assertThat(draft.text()).isEqualTo("一段落目\n\n二段落目");
    }

    @Test
    void 書き直しごとに反復回数が1増える() {
        draft.rewrite(List.of("a", "b"));
        draft.rewrite(List.of("c", "d"));

        assertThat(draft.getIteration()).isEqualTo(2);
        assertThat(draft.canRepair()).isFalse();
        assertThat(draft.getSlots()).containsExactly("c", "d");
    }

    @Test
    void 上限を超える書き直しは拒否() {
        draft.rewrite(List.of("a", "b"));
        draft.rewrite(List.of("c", "d"));

        assertThatThrownBy(() -> draft.rewrite(List.of("e", "f")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(draft.getIteration()).isEqualTo(2);
    }

    @Test
    void スロット数が変わる書き直しは拒否() {
        assertThatThrownBy(() -> draft.rewrite(List.of("a")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 確定後は変更できない() {
        draft.freeze();

        assertThat(draft.canRepair()).isFalse();
        assertThatThrownBy(() -> draft.rewrite(List.of("a", "b")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void スナップショットの復元は反復回数を保つ() {
        DraftSnapshot first = draft.snapshot();
        draft.rewrite(List.of("a", "b"));

        draft.restore(first);

        assertThat(draft.getSlots()).containsExactly("一段落目", "二段落目");
        assertThat(draft.getIteration()).isEqualTo(1);
    }
}
