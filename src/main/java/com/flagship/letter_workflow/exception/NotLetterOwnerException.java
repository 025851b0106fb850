package com.flagship.letter_workflow.exception;

import java.util.UUID;

public class NotLetterOwnerException extends WorkflowException {

    public NotLetterOwnerException(UUID letterId, UUID userId) {
        super(ErrorCode.NOT_LETTER_OWNER,
                "User " + userId + " does not own letter " + letterId);
    }
}
