package com.shoryokuka.domain.plan.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Working copy of one section's text.
 * <p>
 * Holds exactly one text per template slot, in template order. The Synthesizer
 * populates it, the Repair Engine rewrites it in place, and the loop freezes it
 * once the section reaches a terminal state.
 * </p>
 */
@Getter
public class SectionDraft {

    public static final int DEFAULT_MAX_ITERATIONS = 3;
    public static final String SLOT_SEPARATOR = "\n\n";

    private final SectionId sectionId;
    private final FactModel factModel;
    private final int maxIterations;
    private final List<String> slots = new ArrayList<>();
    private int iteration;
    private boolean frozen;

    public SectionDraft(SectionId sectionId, FactModel factModel, int maxIterations) {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must not be negative: " + maxIterations);
        }
        this.sectionId = sectionId;
        this.factModel = factModel;
        this.maxIterations = maxIterations;
    }

    public SectionDraft(SectionId sectionId, FactModel factModel) {
        this(sectionId, factModel, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Rebuild a draft from a snapshot, e.g. to report the best text of a cancelled section.
     */
    public static SectionDraft restored(SectionId sectionId, FactModel factModel, int maxIterations,
                                        DraftSnapshot snapshot) {
        SectionDraft draft = new SectionDraft(sectionId, factModel, maxIterations);
        draft.slots.addAll(snapshot.slots());
        draft.iteration = snapshot.iteration();
        return draft;
    }

    /**
     * Fill an empty draft with the first synthesized slot texts. Iteration stays at 0.
     */
    public void populate(List<String> slotTexts) {
        checkNotFrozen();
        if (!slots.isEmpty()) {
            throw new IllegalStateException("Draft " + sectionId.code() + " is already populated");
        }
        slots.addAll(slotTexts);
    }

    /**
     * Replace all slot texts as one repair cycle.
     *
     * @throws IllegalStateException if the draft is frozen, the slot count changes,
     *                               or the iteration budget is already spent
     */
    public void rewrite(List<String> slotTexts) {
        checkNotFrozen();
        if (slotTexts.size() != slots.size()) {
            throw new IllegalStateException("Slot count changed from " + slots.size() + " to " + slotTexts.size());
        }
        if (iteration >= maxIterations) {
            throw new IllegalStateException("Draft " + sectionId.code() + " reached max iterations " + maxIterations);
        }
        slots.clear();
        slots.addAll(slotTexts);
        iteration++;
    }

    public List<String> getSlots() {
        return Collections.unmodifiableList(slots);
    }

    public String slot(int index) {
        return slots.get(index);
    }

    public int slotCount() {
        return slots.size();
    }

    public boolean canRepair() {
        return !frozen && iteration < maxIterations;
    }

    public String text() {
        return String.join(SLOT_SEPARATOR, slots);
    }

    public DraftSnapshot snapshot() {
        return new DraftSnapshot(iteration, slots);
    }

    /**
     * Put a snapshot's texts back. The iteration counter is left untouched.
     */
    public void restore(DraftSnapshot snapshot) {
        checkNotFrozen();
        if (snapshot.slots().size() != slots.size()) {
            throw new IllegalStateException("Snapshot slot count does not match draft");
        }
        slots.clear();
        slots.addAll(snapshot.slots());
    }

    public void freeze() {
        frozen = true;
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Draft " + sectionId.code() + " is frozen");
        }
    }
}
