package com.flagship.letter_workflow.exception;

/**
 * A lock wait timed out or the database aborted the transaction on a
 * serialization failure. Nothing was committed, so the operation may be retried.
 */
public class TransactionConflictException extends WorkflowException {

    public TransactionConflictException(String operation, Throwable cause) {
        super(ErrorCode.TRANSACTION_CONFLICT,
                "Transient conflict while executing " + operation, cause);
    }
}
