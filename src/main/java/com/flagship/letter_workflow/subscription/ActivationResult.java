package com.flagship.letter_workflow.subscription;

import com.flagship.letter_workflow.allowance.Allowance;
import lombok.Value;

import java.util.UUID;

@Value
public class ActivationResult {
    Allowance allowance;
    Commission commission;
    UUID couponUsageId;

    public boolean hasCommission() {
        return commission != null;
    }
}
