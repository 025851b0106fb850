package com.flagship.letter_workflow.exception;

import java.util.UUID;

public class NotClaimOwnerException extends WorkflowException {

    public NotClaimOwnerException(UUID letterId, UUID reviewerId) {
        super(ErrorCode.NOT_CLAIM_OWNER,
                "Reviewer " + reviewerId + " does not hold the claim on letter " + letterId);
    }
}
