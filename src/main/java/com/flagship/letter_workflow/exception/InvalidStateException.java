package com.flagship.letter_workflow.exception;

/**
 * The operation is not valid for the entity's current status,
 * e.g. claiming a completed letter.
 */
public class InvalidStateException extends WorkflowException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
