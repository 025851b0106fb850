package com.flagship.letter_workflow.subscription.event;

import com.flagship.letter_workflow.subscription.Commission;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class CommissionEarnedEvent {

    public static final String EVENT_TYPE = "CommissionEarned";

    UUID eventId;
    UUID commissionId;
    UUID employeeId;
    UUID allowanceId;
    BigDecimal commissionAmount;
    Instant occurredAt;

    public static CommissionEarnedEvent from(Commission commission) {
        return new CommissionEarnedEvent(
            UUID.randomUUID(),
            commission.getId(),
            commission.getEmployeeId(),
            commission.getAllowanceId(),
            commission.getCommissionAmount(),
            Instant.now()
        );
    }
}
