package com.flagship.letter_workflow.subscription.event;

import com.flagship.letter_workflow.allowance.Allowance;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a paid (or fully discounted) subscription becomes active,
 * so the user receives their confirmation.
 */
@Value
public class SubscriptionActivatedEvent {

    public static final String EVENT_TYPE = "SubscriptionActivated";

    UUID eventId;
    UUID allowanceId;
    UUID userId;
    String planType;
    int letters;
    BigDecimal finalPrice;
    Instant periodEnd;
    Instant occurredAt;

    public static SubscriptionActivatedEvent from(Allowance allowance) {
        return new SubscriptionActivatedEvent(
            UUID.randomUUID(),
            allowance.getId(),
            allowance.getUserId(),
            allowance.getPlanType(),
            allowance.getGrantedCredits(),
            allowance.getFinalPrice(),
            allowance.getPeriodEnd(),
            Instant.now()
        );
    }
}
