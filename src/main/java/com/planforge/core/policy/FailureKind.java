package com.planforge.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.regex.Pattern;

/**
 * What went wrong with an agent invocation.
 *
 * @param category the failure class
 * @param exitCode process exit code, only set for {@link Category#PROCESS_EXIT}
 * @param detail   parser message or unclassified error text, may be null
 */
public record FailureKind(Category category, Integer exitCode, String detail) implements Serializable {

    private static final Pattern NETWORK_ERROR_PATTERN = Pattern.compile(
            "connect|network|ECONNREFUSED|ETIMEDOUT|connection\\s+refused|name\\s+resolution|DNS|socket",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TIMEOUT_PATTERN = Pattern.compile("timed?\\s*out", Pattern.CASE_INSENSITIVE);

    public enum Category {
        TIMEOUT,
        NETWORK,
        PROCESS_EXIT,
        PARSE_FAILURE,
        EMPTY_OUTPUT,
        ALL_REVIEWERS_FAILED,
        UNKNOWN
    }

    public static FailureKind timeout() {
        return new FailureKind(Category.TIMEOUT, null, null);
    }

    public static FailureKind network() {
        return new FailureKind(Category.NETWORK, null, null);
    }

    public static FailureKind processExit(int exitCode) {
        return new FailureKind(Category.PROCESS_EXIT, exitCode, null);
    }

    public static FailureKind parseFailure(String detail) {
        return new FailureKind(Category.PARSE_FAILURE, null, detail);
    }

    public static FailureKind emptyOutput() {
        return new FailureKind(Category.EMPTY_OUTPUT, null, null);
    }

    public static FailureKind allReviewersFailed() {
        return new FailureKind(Category.ALL_REVIEWERS_FAILED, null, null);
    }

    public static FailureKind unknown(String detail) {
        return new FailureKind(Category.UNKNOWN, null, detail);
    }

    /**
     * Classifies a raw error message. Timeouts win over network errors since
     * "connection timed out" is both.
     */
    public static FailureKind classify(String message) {
        if (message == null || message.isBlank()) {
            return emptyOutput();
        }
        if (TIMEOUT_PATTERN.matcher(message).find()) {
            return timeout();
        }
        if (NETWORK_ERROR_PATTERN.matcher(message).find()) {
            return network();
        }
        return unknown(message);
    }

    /** Transient failures worth another attempt. */
    @JsonIgnore
    public boolean isRetryable() {
        return switch (category) {
            case TIMEOUT, NETWORK, EMPTY_OUTPUT, ALL_REVIEWERS_FAILED -> true;
            case PROCESS_EXIT, PARSE_FAILURE, UNKNOWN -> false;
        };
    }

    public String describe() {
        return switch (category) {
            case TIMEOUT -> "agent timed out";
            case NETWORK -> "network error";
            case PROCESS_EXIT -> "process exited with code " + exitCode;
            case PARSE_FAILURE -> "could not parse agent output: " + detail;
            case EMPTY_OUTPUT -> "agent produced no output";
            case ALL_REVIEWERS_FAILED -> "all reviewers failed";
            case UNKNOWN -> detail != null ? detail : "unknown failure";
        };
    }
}
