package com.planforge.core.workflow;

/**
 * Thrown when a workflow command is rejected or its events cannot be persisted.
 * A rejected command never leaves partial state behind.
 */
public class WorkflowException extends RuntimeException {

    private final WorkflowError error;

    public WorkflowException(WorkflowError error, String message) {
        super(message);
        this.error = error;
    }

    public WorkflowException(WorkflowError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public static WorkflowException invalidTransition(String message) {
        return new WorkflowException(WorkflowError.INVALID_TRANSITION, message);
    }

    public static WorkflowException notInitialized() {
        return new WorkflowException(WorkflowError.NOT_INITIALIZED, "workflow has not been created");
    }

    public static WorkflowException storageFailure(String message, Throwable cause) {
        return new WorkflowException(WorkflowError.STORAGE_FAILURE, message, cause);
    }

    public static WorkflowException concurrencyConflict(String message) {
        return new WorkflowException(WorkflowError.CONCURRENCY_CONFLICT, message);
    }

    public WorkflowError error() {
        return error;
    }
}
