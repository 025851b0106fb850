package com.flagship.letter_workflow.allowance;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read model of a subscription allowance.
 */
@Value
public class Allowance {
    UUID id;
    UUID userId;
    AllowanceStatus status;
    String planType;
    int grantedCredits;
    int creditsRemaining;
    BigDecimal basePrice;
    BigDecimal discountAmount;
    BigDecimal finalPrice;
    String couponCode;
    UUID employeeId;
    Instant periodStart;
    Instant periodEnd;
    Instant createdAt;

    public boolean isActive() {
        return status == AllowanceStatus.ACTIVE;
    }
}
