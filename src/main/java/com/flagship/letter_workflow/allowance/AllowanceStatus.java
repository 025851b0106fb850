package com.flagship.letter_workflow.allowance;

/**
 * Lifecycle of a subscription allowance.
 *
 * PENDING rows are opened at checkout and wait for the payment notification.
 * At most one row per user is ACTIVE; the others are history.
 */
public enum AllowanceStatus {
    PENDING,
    ACTIVE,
    EXPIRED,
    CANCELED,
    PAYMENT_FAILED
}
