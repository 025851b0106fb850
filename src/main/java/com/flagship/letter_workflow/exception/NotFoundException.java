package com.flagship.letter_workflow.exception;

public class NotFoundException extends WorkflowException {

    public NotFoundException(String entity, Object id) {
        super(ErrorCode.NOT_FOUND, entity + " not found: " + id);
    }
}
