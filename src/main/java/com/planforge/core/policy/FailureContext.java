package com.planforge.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.planforge.core.model.PhaseLabel;

import java.io.Serializable;
import java.time.Instant;

/**
 * A failure as recorded in a workflow's history.
 *
 * @param kind           classified failure
 * @param message        raw error text
 * @param phase          phase the failure happened in
 * @param agentName      failing agent, null for non-agent failures
 * @param retryCount     attempts already made
 * @param maxRetries     attempts allowed
 * @param failedAt       when the failure was observed
 * @param recoveryAction action chosen for it, null until decided
 */
public record FailureContext(
        FailureKind kind,
        String message,
        PhaseLabel phase,
        String agentName,
        int retryCount,
        int maxRetries,
        Instant failedAt,
        RecoveryAction recoveryAction
) implements Serializable {

    public static FailureContext of(FailureKind kind, String message, PhaseLabel phase, String agentName,
                                    int maxRetries, Instant failedAt) {
        return new FailureContext(kind, message, phase, agentName, 0, maxRetries, failedAt, null);
    }

    @JsonIgnore
    public boolean canRetry() {
        return kind.isRetryable() && retryCount < maxRetries;
    }

    public FailureContext incrementRetry() {
        return new FailureContext(kind, message, phase, agentName, retryCount + 1, maxRetries, failedAt,
                recoveryAction);
    }

    public FailureContext withRecoveryAction(RecoveryAction action) {
        return new FailureContext(kind, message, phase, agentName, retryCount, maxRetries, failedAt, action);
    }
}
