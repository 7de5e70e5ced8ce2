package com.planforge.core.model;

/**
 * Flattened lifecycle position of a workflow, combining the planning and implementation phases.
 * This is what the daemon registry and status displays carry.
 */
public enum PhaseLabel {
    PLANNING("Plan", "Planning"),
    REVIEWING("Review", "Reviewing"),
    REVISING("Revise", "Revising"),
    AWAITING_PLANNING_DECISION("Decide", "Awaiting Decision"),
    IMPLEMENTING("Impl", "Implementing"),
    IMPLEMENTATION_REVIEW("ImplRev", "Implementation Review"),
    AWAITING_IMPLEMENTATION_DECISION("ImplDec", "Awaiting Implementation Decision"),
    COMPLETE("Done", "Complete"),
    CANCELLED("Cancel", "Cancelled");

    private final String shortLabel;
    private final String fullLabel;

    PhaseLabel(String shortLabel, String fullLabel) {
        this.shortLabel = shortLabel;
        this.fullLabel = fullLabel;
    }

    public String shortLabel() {
        return shortLabel;
    }

    public String fullLabel() {
        return fullLabel;
    }

    /**
     * Label with the round appended, e.g. {@code "Reviewing #2"}. Terminal phases carry no round.
     */
    public String withIteration(Iteration iteration) {
        if (isTerminal() || iteration == null) {
            return fullLabel;
        }
        return fullLabel + " #" + iteration.value();
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == CANCELLED;
    }

    public static PhaseLabel of(Phase planning, ImplementationPhase implementation) {
        if (implementation != null) {
            return switch (implementation) {
                case IMPLEMENTING -> IMPLEMENTING;
                case IMPLEMENTATION_REVIEW -> IMPLEMENTATION_REVIEW;
                case AWAITING_DECISION -> AWAITING_IMPLEMENTATION_DECISION;
                case COMPLETE -> COMPLETE;
            };
        }
        return switch (planning) {
            case PLANNING -> PLANNING;
            case REVIEWING -> REVIEWING;
            case REVISING -> REVISING;
            case AWAITING_PLANNING_DECISION -> AWAITING_PLANNING_DECISION;
            case COMPLETE -> COMPLETE;
        };
    }
}
