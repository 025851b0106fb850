package com.flagship.letter_workflow.subscription;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class Commission {
    UUID id;
    UUID employeeId;
    UUID allowanceId;
    BigDecimal subscriptionAmount;
    BigDecimal commissionRate;
    BigDecimal commissionAmount;
    CommissionStatus status;
    Instant createdAt;
}
