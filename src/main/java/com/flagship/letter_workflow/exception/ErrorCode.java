package com.flagship.letter_workflow.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy of the workflow engine and the HTTP status each maps to.
 */
public enum ErrorCode {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_STATE(HttpStatus.CONFLICT),
    ALREADY_CLAIMED(HttpStatus.CONFLICT),
    NOT_CLAIM_OWNER(HttpStatus.FORBIDDEN),
    NOT_LETTER_OWNER(HttpStatus.FORBIDDEN),
    ALLOWANCE_EXHAUSTED(HttpStatus.PAYMENT_REQUIRED),
    NO_ACTIVE_ALLOWANCE(HttpStatus.PAYMENT_REQUIRED),
    TRANSACTION_CONFLICT(HttpStatus.SERVICE_UNAVAILABLE),
    VALIDATION(HttpStatus.BAD_REQUEST);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
