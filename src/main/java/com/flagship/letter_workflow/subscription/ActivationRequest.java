package com.flagship.letter_workflow.subscription;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Everything the activation transaction needs: who, which plan, what was paid
 * and who referred the purchase.
 */
@Value
@Builder
public class ActivationRequest {
    UUID userId;
    String planType;
    int letters;
    BigDecimal basePrice;
    BigDecimal discountAmount;
    BigDecimal finalPrice;
    String couponCode;
    UUID employeeId;
    String externalSessionId;
    String externalCustomerId;

    public boolean hasCoupon() {
        return couponCode != null && !couponCode.isBlank();
    }

    public boolean earnsCommission() {
        return employeeId != null && finalPrice.signum() > 0;
    }
}
