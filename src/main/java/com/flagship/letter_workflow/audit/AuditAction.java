package com.flagship.letter_workflow.audit;

import java.util.Arrays;

/**
 * Actions recorded in the audit trail. The stored value is the lower-case name.
 */
public enum AuditAction {
    CREATED("created"),
    SUBMITTED("submitted"),
    GENERATED("generated"),
    GENERATION_FAILED("generation_failed"),
    CLAIMED("claimed"),
    RELEASED("released"),
    APPROVED("approved"),
    REJECTED("rejected"),
    COMPLETED("completed"),
    RESUBMITTED("resubmitted"),
    FREE_TRIAL_USED("free_trial_used"),
    CREDIT_DEDUCTED("credit_deducted"),
    CREDIT_REFUNDED("credit_refunded"),
    SUBSCRIPTION_ACTIVATED("subscription_activated");

    private final String value;

    AuditAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AuditAction fromValue(String value) {
        return Arrays.stream(values())
                .filter(action -> action.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown audit action: " + value));
    }
}
