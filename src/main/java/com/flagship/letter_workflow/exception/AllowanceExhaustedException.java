package com.flagship.letter_workflow.exception;

import java.util.UUID;

/**
 * The user's active allowance has no letter credits left.
 */
public class AllowanceExhaustedException extends WorkflowException {

    public AllowanceExhaustedException(UUID userId) {
        super(ErrorCode.ALLOWANCE_EXHAUSTED, "No letter credits remaining for user " + userId);
    }
}
