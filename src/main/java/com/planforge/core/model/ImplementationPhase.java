package com.planforge.core.model;

/**
 * Phase of the implementation half of a workflow, entered once the user asks for implementation.
 */
public enum ImplementationPhase {
    IMPLEMENTING("Implementing"),
    IMPLEMENTATION_REVIEW("Implementation Review"),
    AWAITING_DECISION("Awaiting Decision"),
    COMPLETE("Complete");

    private final String label;

    ImplementationPhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
