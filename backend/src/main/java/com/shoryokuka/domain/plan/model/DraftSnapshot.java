package com.shoryokuka.domain.plan.model;

import java.util.List;

/**
 * Copy of a draft's slot texts at one iteration, kept for best-of selection.
 */
public record DraftSnapshot(int iteration, List<String> slots) {

    public DraftSnapshot {
        slots = List.copyOf(slots);
    }

    public String text() {
        return String.join(SectionDraft.SLOT_SEPARATOR, slots);
    }
}
