package com.flagship.letter_workflow.exception;

public class ValidationException extends WorkflowException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }
}
