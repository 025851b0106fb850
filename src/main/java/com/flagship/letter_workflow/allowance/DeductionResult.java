package com.flagship.letter_workflow.allowance;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a successful credit check.
 *
 * A free-trial deduction carries no remaining balance and no allowance.
 */
@Value
public class DeductionResult {
    boolean freeTrial;
    Integer remaining;
    UUID allowanceId;

    public static DeductionResult freeTrial() {
        return new DeductionResult(true, null, null);
    }

    public static DeductionResult credit(int remaining, UUID allowanceId) {
        return new DeductionResult(false, remaining, allowanceId);
    }
}
