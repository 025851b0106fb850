package com.flagship.letter_workflow.allowance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.letter_workflow.allowance.Allowance;
import com.flagship.letter_workflow.allowance.AllowanceStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AllowanceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("status")
    AllowanceStatus status;

    @JsonProperty("plan_type")
    String planType;

    @JsonProperty("granted_credits")
    int grantedCredits;

    @JsonProperty("credits_remaining")
    int creditsRemaining;

    @JsonProperty("final_price")
    BigDecimal finalPrice;

    @JsonProperty("coupon_code")
    String couponCode;

    @JsonProperty("period_start")
    Instant periodStart;

    @JsonProperty("period_end")
    Instant periodEnd;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AllowanceResponse from(Allowance allowance) {
        return AllowanceResponse.builder()
            .id(allowance.getId())
            .status(allowance.getStatus())
            .planType(allowance.getPlanType())
            .grantedCredits(allowance.getGrantedCredits())
            .creditsRemaining(allowance.getCreditsRemaining())
            .finalPrice(allowance.getFinalPrice())
            .couponCode(allowance.getCouponCode())
            .periodStart(allowance.getPeriodStart())
            .periodEnd(allowance.getPeriodEnd())
            .createdAt(allowance.getCreatedAt())
            .build();
    }
}
