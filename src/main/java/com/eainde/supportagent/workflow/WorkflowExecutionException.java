package com.eainde.supportagent.workflow;

/**
 * The graph itself failed to run to completion.
 *
 * <p>Ability failures never surface here; they degrade to empty updates inside the
 * run. This signals a defect in the workflow or its wiring.</p>
 */
public class WorkflowExecutionException extends RuntimeException {

    public WorkflowExecutionException(String message) {
        super(message);
    }

    public WorkflowExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
