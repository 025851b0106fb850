package com.flagship.letter_workflow.exception;

import java.util.Map;

/**
 * Base class of every expected failure of a workflow operation.
 *
 * All subclasses are unchecked so that throwing one from inside a
 * {@code @Transactional} method rolls the whole operation back.
 */
public abstract class WorkflowException extends RuntimeException {

    private final ErrorCode code;

    protected WorkflowException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected WorkflowException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * Extra fields rendered in the error body.
     */
    public Map<String, String> getDetails() {
        return Map.of();
    }
}
