package com.flagship.letter_workflow.subscription;

public enum CommissionStatus {
    PENDING,
    PAID
}
