package com.flagship.letter_workflow.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.letter_workflow.subscription.Commission;
import com.flagship.letter_workflow.subscription.CommissionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class CommissionSummaryResponse {

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("commissions")
    List<Item> commissions;

    @Value
    @Builder
    public static class Item {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("allowance_id")
        UUID allowanceId;

        @JsonProperty("subscription_amount")
        BigDecimal subscriptionAmount;

        @JsonProperty("commission_amount")
        BigDecimal commissionAmount;

        @JsonProperty("status")
        CommissionStatus status;

        @JsonProperty("created_at")
        Instant createdAt;

        public static Item from(Commission commission) {
            return Item.builder()
                .id(commission.getId())
                .allowanceId(commission.getAllowanceId())
                .subscriptionAmount(commission.getSubscriptionAmount())
                .commissionAmount(commission.getCommissionAmount())
                .status(commission.getStatus())
                .createdAt(commission.getCreatedAt())
                .build();
        }
    }
}
