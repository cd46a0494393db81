package com.shoryokuka.infrastructure.generation.loop;

import com.shoryokuka.domain.plan.model.DraftSnapshot;
import com.shoryokuka.domain.plan.model.DraftState;
import com.shoryokuka.domain.plan.model.SectionDraft;
import com.shoryokuka.domain.plan.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Lifecycle of one section: DRAFT(n) → VALIDATED → ACCEPTED | REPAIRING(n+1) | EXHAUSTED.
 * <p>
 * Tracks the score of every validated iteration and the best-scoring snapshot. On a tie
 * the earlier iteration is kept.
 * </p>
 */
public class SectionStateMachine {

    private final double qualityThreshold;
    private final List<Double> scoreHistory = new ArrayList<>();
    private DraftState state = DraftState.DRAFT;
    private DraftSnapshot best;
    private ValidationResult bestValidation;

    public SectionStateMachine(double qualityThreshold) {
        this.qualityThreshold = qualityThreshold;
    }

    /**
     * Record a validation of the draft's current text and decide the next state.
     */
    public DraftState onValidated(SectionDraft draft, ValidationResult result) {
        if (state != DraftState.DRAFT && state != DraftState.REPAIRING) {
            throw new IllegalStateException("Cannot validate in state " + state);
        }
        state = DraftState.VALIDATED;
        scoreHistory.add(result.score());
        if (best == null || result.score() > bestValidation.score()) {
            best = draft.snapshot();
            bestValidation = result;
        }

        if (isAcceptable(result)) {
            state = DraftState.ACCEPTED;
        } else if (draft.canRepair()) {
            state = DraftState.REPAIRING;
        } else {
            state = DraftState.EXHAUSTED;
        }
        return state;
    }

    public boolean isAcceptable(ValidationResult result) {
        return result.score() >= qualityThreshold && !result.hasStructuralDrift();
    }

    /**
     * Put the best-scoring text back into the draft. Its iteration count is kept.
     */
    public void restoreBest(SectionDraft draft) {
        if (best == null) {
            throw new IllegalStateException("No validated iteration to restore");
        }
        if (best.iteration() != draft.getIteration()) {
            draft.restore(best);
        }
    }

    public DraftState state() {
        return state;
    }

    public List<Double> scoreHistory() {
        return List.copyOf(scoreHistory);
    }

    public DraftSnapshot best() {
        return best;
    }

    public ValidationResult bestValidation() {
        return bestValidation;
    }
}
