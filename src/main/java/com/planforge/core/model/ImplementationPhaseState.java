package com.planforge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * Progress of the implement/review loop.
 *
 * @param phase         current implementation phase
 * @param iteration     current round, starting at 1
 * @param maxIterations rounds allowed before the user must decide
 * @param lastVerdict   verdict of the most recent implementation review, null before the first review
 * @param lastFeedback  reviewer or user feedback carried into the next round, may be null
 */
public record ImplementationPhaseState(
        ImplementationPhase phase,
        Iteration iteration,
        MaxIterations maxIterations,
        ImplementationVerdict lastVerdict,
        String lastFeedback
) implements Serializable {

    public static ImplementationPhaseState start(MaxIterations maxIterations) {
        return new ImplementationPhaseState(ImplementationPhase.IMPLEMENTING, Iteration.first(),
                maxIterations, null, null);
    }

    public ImplementationPhaseState withPhase(ImplementationPhase newPhase) {
        return new ImplementationPhaseState(newPhase, iteration, maxIterations, lastVerdict, lastFeedback);
    }

    public ImplementationPhaseState withReview(ImplementationVerdict verdict, String feedback) {
        return new ImplementationPhaseState(phase, iteration, maxIterations, verdict, feedback);
    }

    public ImplementationPhaseState nextRound() {
        return new ImplementationPhaseState(ImplementationPhase.IMPLEMENTING, iteration.next(),
                maxIterations, lastVerdict, lastFeedback);
    }

    public ImplementationPhaseState extended(int additional, String feedback) {
        return new ImplementationPhaseState(ImplementationPhase.IMPLEMENTING, iteration.next(),
                maxIterations.extendBy(additional), lastVerdict, feedback);
    }

    @JsonIgnore
    public boolean canContinue() {
        return !iteration.reached(maxIterations) && phase != ImplementationPhase.COMPLETE;
    }

    @JsonIgnore
    public boolean isApproved() {
        return lastVerdict == ImplementationVerdict.APPROVED;
    }
}
