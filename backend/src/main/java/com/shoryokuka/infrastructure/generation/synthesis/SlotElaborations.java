package com.shoryokuka.infrastructure.generation.synthesis;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.domain.plan.model.SlotRole;

import java.util.ArrayList;
import java.util.List;

import static com.shoryokuka.domain.plan.model.FactField.*;

/**
 * Extra sentences a slot can take when it is too short. Each one only quotes facts that
 * are available, so appending it never introduces a number of its own.
 */
final class SlotElaborations {

    private SlotElaborations() {
    }

    static List<String> forRole(FactModel fact, SlotRole role) {
        List<String> sentences = new ArrayList<>();
        switch (role) {
            case ASSERTION -> {
                if (fact.has(COMPANY_NAME) && fact.has(PREFECTURE)) {
                    sentences.add(FactFormatter.format(fact, COMPANY_NAME) + "は"
                            + FactFormatter.format(fact, PREFECTURE) + "に根ざして事業を続けてきた。");
                }
                if (fact.has(EQUIPMENT_NAME)) {
                    sentences.add("この方針は" + FactFormatter.format(fact, EQUIPMENT_NAME) + "の導入計画とも一致する。");
                }
            }
            case JUSTIFICATION -> {
                if (fact.has(OVERTIME_HOURS)) {
                    sentences.add("現場では月平均" + FactFormatter.format(fact, OVERTIME_HOURS)
                            + "時間の残業が発生しており、改善の余地は小さくない。");
                }
                if (fact.has(JOB_OPENINGS_RATIO)) {
                    sentences.add("有効求人倍率" + FactFormatter.format(fact, JOB_OPENINGS_RATIO)
                            + "倍という水準も、採用による解決を難しくしている。");
                }
            }
            case ILLUSTRATION -> {
                if (fact.has(CURRENT_HOURS) && fact.has(TARGET_HOURS)) {
                    sentences.add("対象業務の時間は" + FactFormatter.format(fact, CURRENT_HOURS) + "時間から"
                            + FactFormatter.format(fact, TARGET_HOURS) + "時間へ短くなる見込みだ。");
                }
                if (fact.has(EMPLOYEE_COUNT)) {
                    sentences.add("従業員" + FactFormatter.format(fact, EMPLOYEE_COUNT) + "名の働き方がこの変化で見直される。");
                }
            }
            case RESTATEMENT -> {
                if (fact.has(REDUCTION_HOURS)) {
                    sentences.add("毎日" + FactFormatter.format(fact, REDUCTION_HOURS) + "時間の削減が、その裏付けとなる。");
                }
                sentences.add("当社はこの取り組みを計画どおり進めていく。");
            }
        }
        return sentences;
    }
}
