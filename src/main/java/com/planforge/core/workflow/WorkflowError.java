package com.planforge.core.workflow;

/**
 * Kinds of failure a workflow command can produce.
 */
public enum WorkflowError {
    /** The state machine does not accept the command in the current phase. */
    INVALID_TRANSITION,
    /** A command other than create was sent before the workflow was created. */
    NOT_INITIALIZED,
    /** The event log or snapshot could not be read or written. */
    STORAGE_FAILURE,
    /** Another writer appended to the log since this state was loaded. */
    CONCURRENCY_CONFLICT
}
