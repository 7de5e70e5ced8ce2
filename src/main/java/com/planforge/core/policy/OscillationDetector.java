package com.planforge.core.policy;

import java.util.List;
import java.util.Objects;

/**
 * Detects failure patterns where retrying is pointless: an agent alternating
 * between two distinct failures (A-B-A), or repeating the same one.
 */
public final class OscillationDetector {

    private OscillationDetector() {}

    public static boolean isOscillating(List<FailureContext> history, String agentName) {
        List<FailureKind> kinds = history.stream()
                .filter(f -> Objects.equals(f.agentName(), agentName))
                .map(FailureContext::kind)
                .toList();
        if (kinds.size() < 3) {
            return false;
        }
        // error[N] matches error[N-2] but differs from error[N-1]
        for (int i = 2; i < kinds.size(); i++) {
            FailureKind current = kinds.get(i);
            if (current.equals(kinds.get(i - 2)) && !current.equals(kinds.get(i - 1))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Number of failures at the end of the history that belong to the given agent, uninterrupted.
     */
    public static int consecutiveFailures(List<FailureContext> history, String agentName) {
        int count = 0;
        for (int i = history.size() - 1; i >= 0; i--) {
            if (!Objects.equals(history.get(i).agentName(), agentName)) {
                break;
            }
            count++;
        }
        return count;
    }
}
