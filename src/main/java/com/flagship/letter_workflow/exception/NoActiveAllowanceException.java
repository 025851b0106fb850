package com.flagship.letter_workflow.exception;

import java.util.UUID;

/**
 * The user holds no active allowance and the free trial is already used.
 */
public class NoActiveAllowanceException extends WorkflowException {

    public NoActiveAllowanceException(UUID userId) {
        super(ErrorCode.NO_ACTIVE_ALLOWANCE, "No active subscription found for user " + userId);
    }
}
