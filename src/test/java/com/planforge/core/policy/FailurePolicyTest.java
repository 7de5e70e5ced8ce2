package com.planforge.core.policy;

import com.planforge.core.model.PhaseLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for failure classification and {@link FailurePolicy}.
 */
class FailurePolicyTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private static FailureContext failure(FailureKind kind, String agent) {
        return FailureContext.of(kind, kind.describe(), PhaseLabel.REVIEWING, agent, 2, NOW);
    }

    // -- Classification ------------------------------------------------------

    @Nested
    @DisplayName("FailureKind.classify")
    class ClassifyTests {

        @Test
        @DisplayName("recognises timeouts before network errors")
        void timeoutWins() {
            assertEquals(FailureKind.Category.TIMEOUT, FailureKind.classify("connection timed out").category());
            assertEquals(FailureKind.Category.TIMEOUT, FailureKind.classify("Request TIMEOUT").category());
        }

        @Test
        @DisplayName("recognises network errors case-insensitively")
        void networkErrors() {
            assertEquals(FailureKind.Category.NETWORK, FailureKind.classify("ECONNREFUSED 127.0.0.1").category());
            assertEquals(FailureKind.Category.NETWORK, FailureKind.classify("dns lookup failed").category());
            assertEquals(FailureKind.Category.NETWORK,
                    FailureKind.classify("Connection   refused by peer").category());
        }

        @Test
        @DisplayName("blank output and unknown messages")
        void blankAndUnknown() {
            assertEquals(FailureKind.Category.EMPTY_OUTPUT, FailureKind.classify("  ").category());
            FailureKind unknown = FailureKind.classify("segfault in parser");
            assertEquals(FailureKind.Category.UNKNOWN, unknown.category());
            assertEquals("segfault in parser", unknown.describe());
        }

        @Test
        @DisplayName("only transient kinds are retryable")
        void retryable() {
            assertTrue(FailureKind.timeout().isRetryable());
            assertTrue(FailureKind.network().isRetryable());
            assertTrue(FailureKind.emptyOutput().isRetryable());
            assertTrue(FailureKind.allReviewersFailed().isRetryable());
            assertFalse(FailureKind.processExit(1).isRetryable());
            assertFalse(FailureKind.parseFailure("bad json").isRetryable());
            assertFalse(FailureKind.unknown("x").isRetryable());
        }
    }

    // -- Decisions -----------------------------------------------------------

    @Nested
    @DisplayName("decide")
    class DecideTests {

        @Test
        @DisplayName("retries a transient failure while attempts remain")
        void retriesTransient() {
            assertEquals(RecoveryAction.RETRY,
                    FailurePolicy.DEFAULT.decide(failure(FailureKind.timeout(), "claude"), List.of()));
        }

        @Test
        @DisplayName("escalates once retries are spent")
        void escalatesWhenSpent() {
            FailureContext spent = failure(FailureKind.timeout(), "claude").incrementRetry().incrementRetry();
            assertFalse(spent.canRetry());
            assertEquals(RecoveryAction.ESCALATE_TO_USER, FailurePolicy.DEFAULT.decide(spent, List.of()));
        }

        @Test
        @DisplayName("escalates permanent failures immediately")
        void escalatesPermanent() {
            assertEquals(RecoveryAction.ESCALATE_TO_USER,
                    FailurePolicy.DEFAULT.decide(failure(FailureKind.processExit(2), "codex"), List.of()));
        }

        @Test
        @DisplayName("does not retry an oscillating agent")
        void oscillationStopsRetry() {
            List<FailureContext> history = List.of(
                    failure(FailureKind.timeout(), "claude"),
                    failure(FailureKind.network(), "claude"),
                    failure(FailureKind.timeout(), "claude"));
            assertEquals(RecoveryAction.ESCALATE_TO_USER,
                    FailurePolicy.DEFAULT.decide(failure(FailureKind.network(), "claude"), history));
        }

        @Test
        @DisplayName("all-reviewers-failed follows the configured policy")
        void allReviewersFailed() {
            FailureContext spent = failure(FailureKind.allReviewersFailed(), null)
                    .incrementRetry().incrementRetry();
            assertEquals(RecoveryAction.ABORT,
                    new FailurePolicy(2, 5, OnAllReviewersFailed.ABORT).decide(spent, List.of()));
            assertEquals(RecoveryAction.ESCALATE_TO_USER,
                    new FailurePolicy(2, 5, OnAllReviewersFailed.SAVE_STATE).decide(spent, List.of()));
            assertEquals(RecoveryAction.CONTINUE_WITHOUT_REVIEW,
                    new FailurePolicy(2, 5, OnAllReviewersFailed.CONTINUE_WITHOUT_REVIEW).decide(spent, List.of()));
        }

        @Test
        @DisplayName("rejects negative settings and defaults a missing review policy")
        void validatesSettings() {
            assertThrows(IllegalArgumentException.class, () -> new FailurePolicy(-1, 5, null));
            assertEquals(OnAllReviewersFailed.SAVE_STATE, new FailurePolicy(1, 0, null).onAllReviewersFailed());
            assertEquals(Duration.ofSeconds(5), FailurePolicy.DEFAULT.backoff());
        }
    }

    // -- Oscillation ---------------------------------------------------------

    @Nested
    @DisplayName("OscillationDetector")
    class OscillationTests {

        @Test
        @DisplayName("needs an A-B-A pattern from the same agent")
        void detectsAlternation() {
            var a = failure(FailureKind.timeout(), "claude");
            var b = failure(FailureKind.network(), "claude");
            var other = failure(FailureKind.network(), "codex");

            assertTrue(OscillationDetector.isOscillating(List.of(a, b, a), "claude"));
            assertFalse(OscillationDetector.isOscillating(List.of(a, a, a), "claude"));
            assertFalse(OscillationDetector.isOscillating(List.of(a, other, a), "claude"));
        }

        @Test
        @DisplayName("counts the trailing run of one agent's failures")
        void consecutiveFailures() {
            var a = failure(FailureKind.timeout(), "claude");
            var other = failure(FailureKind.network(), "codex");

            assertEquals(2, OscillationDetector.consecutiveFailures(List.of(a, other, a, a), "claude"));
            assertEquals(0, OscillationDetector.consecutiveFailures(List.of(a, other), "claude"));
        }
    }
}
