package com.planforge.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Maps a failure to the {@link RecoveryAction} the orchestration should take.
 * The aggregate only records failures; acting on the decision happens outside of it.
 *
 * @param maxRetries           attempts allowed for retryable failures
 * @param backoffSecs          delay between attempts
 * @param onAllReviewersFailed what to do once a review cycle has no usable result and retries are spent
 */
public record FailurePolicy(int maxRetries, long backoffSecs, OnAllReviewersFailed onAllReviewersFailed) {

    private static final Logger log = LoggerFactory.getLogger(FailurePolicy.class);

    public static final int MAX_FAILURE_HISTORY = 50;

    public static final FailurePolicy DEFAULT = new FailurePolicy(2, 5, OnAllReviewersFailed.SAVE_STATE);

    public FailurePolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (backoffSecs < 0) {
            throw new IllegalArgumentException("backoffSecs must not be negative");
        }
        if (onAllReviewersFailed == null) {
            onAllReviewersFailed = OnAllReviewersFailed.SAVE_STATE;
        }
    }

    public RecoveryAction decide(FailureContext failure, List<FailureContext> history) {
        if (failure.canRetry() && !OscillationDetector.isOscillating(history, failure.agentName())) {
            return RecoveryAction.RETRY;
        }
        if (failure.kind().category() == FailureKind.Category.ALL_REVIEWERS_FAILED) {
            return switch (onAllReviewersFailed) {
                case ABORT -> RecoveryAction.ABORT;
                case SAVE_STATE -> RecoveryAction.ESCALATE_TO_USER;
                case CONTINUE_WITHOUT_REVIEW -> RecoveryAction.CONTINUE_WITHOUT_REVIEW;
            };
        }
        log.debug("Escalating {} failure after {} attempt(s)", failure.kind().category(), failure.retryCount());
        return RecoveryAction.ESCALATE_TO_USER;
    }

    public Duration backoff() {
        return Duration.ofSeconds(backoffSecs);
    }
}
