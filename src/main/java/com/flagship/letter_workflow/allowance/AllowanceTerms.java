package com.flagship.letter_workflow.allowance;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Commercial terms an allowance was bought under.
 */
@Value
public class AllowanceTerms {
    BigDecimal basePrice;
    BigDecimal discountAmount;
    BigDecimal finalPrice;
    String couponCode;
    UUID employeeId;

    public static AllowanceTerms free() {
        return new AllowanceTerms(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null, null);
    }
}
